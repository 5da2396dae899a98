package com.vtb.vulnpolicy.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.vtb.vulnpolicy.models.Finding;
import com.vtb.vulnpolicy.models.ScanMode;
import com.vtb.vulnpolicy.models.SeverityAssessment;
import com.vtb.vulnpolicy.models.SeverityMethod;
import com.vtb.vulnpolicy.models.Severity;
import com.vtb.vulnpolicy.util.CvssScores;
import com.vtb.vulnpolicy.util.Identifiers;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Сворачивает JSON-поток событий сканера в отсортированный список уязвимостей.
 *
 * Разбор строгий: любая синтаксическая ошибка прерывает агрегацию целиком.
 */
@Slf4j
public class FindingAggregator {

    private final ScanMode scanMode;
    private final ObjectReader eventReader;

    public FindingAggregator(ScanMode scanMode) {
        this(scanMode, new ObjectMapper());
    }

    public FindingAggregator(ScanMode scanMode, ObjectMapper mapper) {
        this.scanMode = scanMode;
        this.eventReader = mapper.readerFor(ScannerEvent.class);
    }

    /**
     * Загрузить вывод сканера из файла
     */
    public List<Finding> aggregate(Path path) throws IOException {
        log.info("Загрузка вывода сканера: {} (режим {})", path, scanMode);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return aggregate(reader);
        } catch (NoSuchFileException e) {
            throw new PolicyInputException("Файл вывода сканера не найден: " + path, e);
        } catch (PolicyInputException e) {
            throw new PolicyInputException(path + ": " + e.getMessage(), e.getCause());
        }
    }

    public List<Finding> aggregate(Reader reader) throws IOException {
        Map<String, Accumulator> byId = new LinkedHashMap<>();
        int events = 0;

        try (MappingIterator<ScannerEvent> iterator = eventReader.readValues(reader)) {
            while (iterator.hasNextValue()) {
                ScannerEvent event = iterator.nextValue();
                events++;
                if (event == null) {
                    continue;
                }
                if (event.getOsv() != null) {
                    applyAdvisory(byId, event.getOsv());
                }
                if (event.getFinding() != null) {
                    applyFinding(byId, event.getFinding());
                }
            }
        } catch (JsonProcessingException e) {
            throw new PolicyInputException("Некорректный JSON в выводе сканера (событие #" + (events + 1) + "): "
                + e.getOriginalMessage(), e);
        }

        List<Finding> findings = new ArrayList<>(byId.size());
        for (Accumulator accumulator : byId.values()) {
            findings.add(accumulator.toFinding());
        }
        findings.sort(Comparator.comparing(Finding::getId));

        log.info("Обработано событий: {}, уникальных уязвимостей: {}", events, findings.size());
        return findings;
    }

    private void applyAdvisory(Map<String, Accumulator> byId, ScannerEvent.Osv osv) {
        Accumulator entry = ensure(byId, osv.getId());
        if (osv.getAliases() != null) {
            entry.aliases.addAll(Identifiers.unique(osv.getAliases()));
        }
        if (isNotBlank(osv.getSummary())) {
            entry.summary = osv.getSummary().trim();
        }
        ScannerEvent.DatabaseSpecific databaseSpecific = osv.getDatabaseSpecific();
        if (databaseSpecific != null && isNotBlank(databaseSpecific.getUrl())) {
            entry.url = databaseSpecific.getUrl().trim();
        }
        SeverityAssessment candidate = embeddedSeverity(osv);
        if (candidate.isKnown() && candidate.isBetterThan(entry.osvSeverity)) {
            entry.osvSeverity = candidate;
        }
    }

    private void applyFinding(Map<String, Accumulator> byId, ScannerEvent.FindingTrace finding) {
        Accumulator entry = ensure(byId, finding.getOsv());
        if (isNotBlank(finding.getFixedVersion())) {
            entry.fixedVersions.add(finding.getFixedVersion().trim());
        }
        if (scanMode == ScanMode.BINARY || isReachable(finding.getTrace())) {
            entry.reachable = true;
        }
    }

    /**
     * В режиме source достижимость требует конкретный путь вызовов.
     * Один пустой фрейм означает "пути не найдено".
     */
    static boolean isReachable(List<ScannerEvent.Frame> trace) {
        if (trace == null || trace.isEmpty()) {
            return false;
        }
        if (trace.size() > 1) {
            return true;
        }
        ScannerEvent.Frame frame = trace.get(0);
        return frame != null && isNotBlank(frame.getPackageName()) && isNotBlank(frame.getFunction());
    }

    /**
     * Лучшая критичность из database_specific и поля severity advisory.
     */
    static SeverityAssessment embeddedSeverity(ScannerEvent.Osv osv) {
        String source = Identifiers.normalize(osv.getId());
        SeverityAssessment best = SeverityAssessment.unknown(source);

        ScannerEvent.DatabaseSpecific databaseSpecific = osv.getDatabaseSpecific();
        if (databaseSpecific != null) {
            best = better(best, candidate(source, databaseSpecific.getSeverity(), databaseSpecific.getScore()));
        }

        JsonNode severity = osv.getSeverity();
        if (severity != null) {
            if (severity.isArray()) {
                for (JsonNode item : severity) {
                    best = better(best, candidate(source, item));
                }
            } else {
                best = better(best, candidate(source, severity));
            }
        }
        return best;
    }

    private static SeverityAssessment candidate(String source, JsonNode node) {
        if (node.isTextual()) {
            return candidate(source, node.asText(), 0);
        }
        if (!node.isObject()) {
            return SeverityAssessment.unknown(source);
        }
        JsonNode label = node.get("severity");
        String rawLabel = label != null && label.isTextual() ? label.asText() : "";
        JsonNode scoreNode = node.get("score");
        OptionalDouble score = CvssScores.parse(scoreNode);
        if (score.isPresent()) {
            return candidate(source, rawLabel, score.getAsDouble());
        }
        if (scoreNode != null && scoreNode.isTextual()) {
            return candidate(source, rawLabel, CvssScores.fromVector(scoreNode.asText()));
        }
        return candidate(source, rawLabel, 0);
    }

    private static SeverityAssessment candidate(String source, String rawLabel, double score) {
        return SeverityAssessment.builder()
            .severity(Severity.normalize(rawLabel, score))
            .score(score)
            .source(source)
            .method(SeverityMethod.OSV)
            .build();
    }

    private static SeverityAssessment better(SeverityAssessment current, SeverityAssessment candidate) {
        return candidate.isBetterThan(current) ? candidate : current;
    }

    private static Accumulator ensure(Map<String, Accumulator> byId, String rawId) {
        return byId.computeIfAbsent(Identifiers.normalize(rawId), Accumulator::new);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Изменяемое состояние уязвимости на время свертки потока
     */
    private static final class Accumulator {
        private final String id;
        private final Set<String> aliases = new LinkedHashSet<>();
        private final Set<String> fixedVersions = new LinkedHashSet<>();
        private String summary;
        private String url;
        private boolean reachable;
        private SeverityAssessment osvSeverity;

        private Accumulator(String id) {
            this.id = id;
        }

        private Finding toFinding() {
            List<String> sortedAliases = new ArrayList<>(aliases);
            sortedAliases.sort(null);
            List<String> sortedFixed = new ArrayList<>(fixedVersions);
            sortedFixed.sort(null);
            return Finding.builder()
                .id(id)
                .aliases(sortedAliases)
                .summary(summary)
                .url(url)
                .fixedVersions(sortedFixed)
                .reachable(reachable)
                .osvSeverity(osvSeverity)
                .build();
        }
    }
}
