package com.vtb.vulnpolicy.severity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.vulnpolicy.core.PolicyInputException;
import com.vtb.vulnpolicy.models.Severity;
import com.vtb.vulnpolicy.models.SeverityAssessment;
import com.vtb.vulnpolicy.models.SeverityMethod;
import com.vtb.vulnpolicy.util.Identifiers;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Закрепленный снапшот критичности CVE для офлайн-режима.
 * Формат: {"cves": {"CVE-...": {"severity": str, "score": number}}}.
 */
@Slf4j
public final class SeveritySnapshot {

    private static final SeveritySnapshot EMPTY = new SeveritySnapshot(Map.of());

    private final Map<String, SeverityAssessment> entries;

    private SeveritySnapshot(Map<String, SeverityAssessment> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static SeveritySnapshot empty() {
        return EMPTY;
    }

    /**
     * Пустой путь - пустой снапшот.
     */
    public static SeveritySnapshot load(String path) throws IOException {
        if (path == null || path.isBlank()) {
            return EMPTY;
        }
        Path file = Path.of(path.trim());
        log.info("Загрузка снапшота критичности: {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            SeveritySnapshot snapshot = load(in);
            log.info("В снапшоте {} CVE", snapshot.size());
            return snapshot;
        } catch (NoSuchFileException e) {
            throw new PolicyInputException("Файл снапшота критичности не найден: " + file, e);
        }
    }

    public static SeveritySnapshot load(InputStream in) throws IOException {
        SnapshotFile file;
        try {
            file = new ObjectMapper().readValue(in, SnapshotFile.class);
        } catch (JsonProcessingException e) {
            throw new PolicyInputException("Некорректный JSON снапшота критичности: " + e.getOriginalMessage(), e);
        }
        Map<String, Entry> raw = file != null && file.getCves() != null ? file.getCves() : Map.of();

        Map<String, SeverityAssessment> entries = new LinkedHashMap<>();
        for (Map.Entry<String, Entry> item : raw.entrySet()) {
            String id = Identifiers.normalize(item.getKey());
            if (!id.startsWith(Identifiers.CVE_PREFIX)) {
                throw new PolicyInputException("ID в снапшоте должен начинаться с CVE-: " + item.getKey());
            }
            Entry entry = item.getValue() != null ? item.getValue() : new Entry();
            entries.put(id, SeverityAssessment.builder()
                .severity(Severity.normalize(entry.getSeverity(), entry.getScore()))
                .score(entry.getScore())
                .source(id)
                .method(SeverityMethod.NVD)
                .build());
        }
        return new SeveritySnapshot(entries);
    }

    public static SeveritySnapshot of(Map<String, SeverityAssessment> entries) {
        Map<String, SeverityAssessment> normalized = new HashMap<>();
        entries.forEach((id, assessment) -> normalized.put(Identifiers.normalize(id), assessment));
        return new SeveritySnapshot(normalized);
    }

    public Optional<SeverityAssessment> get(String id) {
        return Optional.ofNullable(entries.get(Identifiers.normalize(id)));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SnapshotFile {
        private Map<String, Entry> cves;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Entry {
        private String severity;
        private double score;
    }
}
