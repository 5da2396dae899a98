package com.vtb.vulnpolicy.severity;

import com.vtb.vulnpolicy.core.PolicyInputException;
import com.vtb.vulnpolicy.models.Severity;
import com.vtb.vulnpolicy.models.SeverityAssessment;
import com.vtb.vulnpolicy.models.SeverityMethod;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SeveritySnapshotTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsEntriesWithLabelOrScore() throws IOException {
        SeveritySnapshot snapshot = load("{\"cves\":{"
            + "\"cve-2024-1\":{\"severity\":\"critical\",\"score\":9.8},"
            + "\"CVE-2024-2\":{\"score\":5.0}}}");

        assertEquals(2, snapshot.size());
        SeverityAssessment first = snapshot.get("CVE-2024-1").orElseThrow();
        assertEquals(Severity.CRITICAL, first.getSeverity());
        assertEquals(SeverityMethod.NVD, first.getMethod());
        assertEquals("CVE-2024-1", first.getSource());
        assertEquals(Severity.MEDIUM, snapshot.get("cve-2024-2").orElseThrow().getSeverity());
        assertTrue(snapshot.get("CVE-2024-3").isEmpty());
    }

    @Test
    void nonCveKeyRejectsWholeSnapshot() {
        PolicyInputException error = assertThrows(PolicyInputException.class,
            () -> load("{\"cves\":{\"CVE-1\":{\"score\":5.0},\"GHSA-x\":{\"score\":5.0}}}"));
        assertTrue(error.getMessage().contains("GHSA-x"));
    }

    @Test
    void malformedJsonRejected() {
        assertThrows(PolicyInputException.class, () -> load("{\"cves\":"));
    }

    @Test
    void blankPathMeansEmptySnapshot() throws IOException {
        assertTrue(SeveritySnapshot.load((String) null).isEmpty());
        assertTrue(SeveritySnapshot.load("  ").isEmpty());
    }

    @Test
    void loadFromFile() throws IOException {
        Path file = tempDir.resolve("snapshot.json");
        Files.writeString(file, "{\"cves\":{\"CVE-1\":{\"severity\":\"HIGH\",\"score\":7.5}}}");

        SeveritySnapshot snapshot = SeveritySnapshot.load(file.toString());
        assertEquals(Severity.HIGH, snapshot.get("CVE-1").orElseThrow().getSeverity());
    }

    @Test
    void missingFileIsFatal() {
        assertThrows(PolicyInputException.class,
            () -> SeveritySnapshot.load(tempDir.resolve("absent.json").toString()));
    }

    private static SeveritySnapshot load(String json) throws IOException {
        return SeveritySnapshot.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }
}
