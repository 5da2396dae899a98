package com.vtb.vulnpolicy.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.vulnpolicy.models.Finding;
import com.vtb.vulnpolicy.models.RiskOverride;
import com.vtb.vulnpolicy.util.Identifiers;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Реестр принятых рисков (overrides), ключ - канонический ID.
 *
 * Формат: {"overrides": [{"id", "reason", "expires_on": "YYYY-MM-DD"}]}.
 * Любая невалидная запись делает невалидным весь реестр.
 */
@Slf4j
public class OverrideRegistry {

    private static final DateTimeFormatter EXPIRY_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Map<String, RiskOverride> overrides;

    private OverrideRegistry(Map<String, RiskOverride> overrides) {
        this.overrides = Collections.unmodifiableMap(overrides);
    }

    public static OverrideRegistry empty() {
        return new OverrideRegistry(new LinkedHashMap<>());
    }

    public static OverrideRegistry load(Path path) throws IOException {
        log.info("Загрузка реестра исключений: {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            OverrideRegistry registry = load(in);
            log.info("Загружено исключений: {}", registry.size());
            return registry;
        } catch (NoSuchFileException e) {
            throw new PolicyInputException("Файл реестра исключений не найден: " + path, e);
        } catch (PolicyInputException e) {
            throw new PolicyInputException(path + ": " + e.getMessage(), e.getCause());
        }
    }

    public static OverrideRegistry load(InputStream in) throws IOException {
        OverrideFile file;
        try {
            file = new ObjectMapper().readValue(in, OverrideFile.class);
        } catch (JsonProcessingException e) {
            throw new PolicyInputException("Некорректный JSON реестра исключений: " + e.getOriginalMessage(), e);
        }
        List<Entry> entries = file != null && file.getOverrides() != null ? file.getOverrides() : List.of();
        return fromEntries(entries);
    }

    static OverrideRegistry fromEntries(List<Entry> entries) throws PolicyInputException {
        Map<String, RiskOverride> overrides = new LinkedHashMap<>();
        for (Entry entry : entries) {
            if (entry == null) {
                throw new PolicyInputException("У исключения не указан id");
            }
            String id = Identifiers.normalize(entry.getId());
            if (id.isEmpty()) {
                throw new PolicyInputException("У исключения не указан id");
            }
            if (overrides.containsKey(id)) {
                throw new PolicyInputException("Дублирующийся id исключения: " + id);
            }
            String reason = trim(entry.getReason());
            if (reason.isEmpty()) {
                throw new PolicyInputException("Исключение " + id + " должно содержать reason");
            }
            String expiresOn = trim(entry.getExpiresOn());
            if (expiresOn.isEmpty()) {
                throw new PolicyInputException("Исключение " + id + " должно содержать expires_on");
            }
            LocalDate expiry;
            try {
                expiry = LocalDate.parse(expiresOn, EXPIRY_FORMAT);
            } catch (DateTimeParseException e) {
                throw new PolicyInputException(
                    "Исключение " + id + ": некорректный expires_on \"" + expiresOn + "\" (ожидается YYYY-MM-DD)", e);
            }
            overrides.put(id, RiskOverride.builder()
                .id(id)
                .reason(reason)
                .expiresOn(expiry)
                .build());
        }
        return new OverrideRegistry(overrides);
    }

    /**
     * Сначала собственный ID уязвимости, затем алиасы в сохраненном порядке.
     */
    public Optional<Match> match(Finding finding) {
        for (String candidate : Identifiers.candidates(finding)) {
            String normalized = Identifiers.normalize(candidate);
            RiskOverride override = overrides.get(normalized);
            if (override != null) {
                return Optional.of(new Match(override, normalized));
            }
        }
        return Optional.empty();
    }

    public Optional<RiskOverride> get(String id) {
        return Optional.ofNullable(overrides.get(Identifiers.normalize(id)));
    }

    public int size() {
        return overrides.size();
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }

    /**
     * Совпавший override и ID, по которому произошло совпадение
     */
    public record Match(RiskOverride override, String matchedById) { }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class OverrideFile {
        private List<Entry> overrides = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Entry {
        private String id;
        private String reason;
        @JsonProperty("expires_on")
        private String expiresOn;
    }
}
