package com.vtb.vulnpolicy.reports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.vulnpolicy.models.EvaluatedFinding;
import com.vtb.vulnpolicy.models.EvaluationResult;
import com.vtb.vulnpolicy.models.Finding;
import com.vtb.vulnpolicy.models.RiskOverride;
import com.vtb.vulnpolicy.models.ScanMode;
import com.vtb.vulnpolicy.models.SeverityAssessment;
import com.vtb.vulnpolicy.severity.FailureKind;
import com.vtb.vulnpolicy.severity.LookupFailure;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для JsonReportGenerator
 */
class JsonReportGeneratorTest {

    @TempDir
    Path tempDir;

    @Test
    void writesAllBucketsWithOverridesAndWarnings() throws IOException {
        EvaluatedFinding failing = EvaluatedFinding.builder()
            .finding(Finding.builder().id("GO-1").alias("CVE-1").reachable(true).build())
            .severity(SeverityAssessment.unknown("CVE-1", "NVD lookup failed"))
            .resolverWarning(LookupFailure.builder()
                .source("NVD")
                .identifier("CVE-1")
                .kind(FailureKind.NETWORK)
                .message("NVD request for CVE-1 failed: connection refused")
                .cause(new IOException("connection refused"))
                .build())
            .build();
        EvaluatedFinding accepted = EvaluatedFinding.builder()
            .finding(Finding.builder().id("GO-2").build())
            .override(RiskOverride.builder().id("GO-2").reason("not exploitable").expiresOn(LocalDate.of(2030, 1, 31)).build())
            .matchedById("GO-2")
            .build();
        EvaluationResult result = EvaluationResult.builder()
            .fail(List.of(failing))
            .accepted(List.of(accepted))
            .build();

        Path output = tempDir.resolve("reports/policy.json");
        JsonReportGenerator generator = new JsonReportGenerator();
        generator.generate(result, ScanMode.BINARY, output);

        JsonNode report = new ObjectMapper().readTree(output.toFile());
        assertEquals("binary", report.get("scanMode").asText());
        assertTrue(report.get("failing").asBoolean());
        assertEquals(0, report.get("warn").size());

        JsonNode fail = report.get("fail").get(0);
        assertEquals("GO-1", fail.get("id").asText());
        assertEquals("UNKNOWN", fail.get("severity").get("severity").asText());
        assertEquals("unknown", fail.get("severity").get("method").asText());
        assertEquals("NVD request for CVE-1 failed: connection refused", fail.get("resolverWarnings").get(0).asText());

        JsonNode override = report.get("accepted").get(0).get("override");
        assertEquals("GO-2", override.get("matchedBy").asText());
        assertEquals("2030-01-31", override.get("expiresOn").asText());
        assertEquals("json", generator.getFileExtension());
    }
}
