package com.vtb.vulnpolicy.reports;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.vulnpolicy.models.EvaluatedFinding;
import com.vtb.vulnpolicy.models.EvaluationResult;
import com.vtb.vulnpolicy.models.ScanMode;
import com.vtb.vulnpolicy.models.SeverityAssessment;
import com.vtb.vulnpolicy.severity.LookupFailure;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {
    
    private final ObjectMapper objectMapper;
    
    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }
    
    @Override
    public void generate(EvaluationResult result, ScanMode scanMode, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);
        
        if (result == null) {
            throw new IllegalArgumentException("EvaluationResult не может быть null");
        }

        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, render(result, scanMode));
        
        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    String render(EvaluationResult result, ScanMode scanMode) throws IOException {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("scanMode", scanMode.getValue());
        report.put("failing", result.isFailing());
        report.put("fail", entries(result.getFail()));
        report.put("warn", entries(result.getWarn()));
        report.put("info", entries(result.getInfo()));
        report.put("accepted", entries(result.getAccepted()));
        report.put("expired", entries(result.getExpired()));
        return objectMapper.writeValueAsString(report);
    }
    
    @Override
    public String getFileExtension() {
        return "json";
    }

    private List<ReportEntry> entries(List<EvaluatedFinding> items) {
        List<ReportEntry> entries = new ArrayList<>(items.size());
        for (EvaluatedFinding item : items) {
            ReportEntry entry = new ReportEntry();
            entry.id = item.getFinding().getId();
            entry.aliases = item.getFinding().getAliases();
            entry.summary = item.getFinding().getSummary();
            entry.url = item.getFinding().getUrl();
            entry.fixedVersions = item.getFinding().getFixedVersions();
            entry.reachable = item.getFinding().isReachable();
            entry.severity = item.getSeverity();
            if (item.getOverride() != null) {
                entry.override = new OverrideEntry(item.getMatchedById(), item.getOverride().getReason(),
                    item.getOverride().getExpiresOn());
            }
            if (item.hasResolverWarnings()) {
                entry.resolverWarnings = item.getResolverWarnings().stream()
                    .map(LookupFailure::getMessage)
                    .toList();
            }
            entries.add(entry);
        }
        return entries;
    }

    /**
     * Плоское представление для сериализации
     */
    @Data
    static class ReportEntry {
        private String id;
        private List<String> aliases;
        private String summary;
        private String url;
        private List<String> fixedVersions;
        private boolean reachable;
        private SeverityAssessment severity;
        private OverrideEntry override;
        private List<String> resolverWarnings;
    }

    record OverrideEntry(String matchedBy, String reason, LocalDate expiresOn) { }
}
