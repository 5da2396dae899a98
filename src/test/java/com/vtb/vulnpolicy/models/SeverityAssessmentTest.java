package com.vtb.vulnpolicy.models;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class SeverityAssessmentTest {

    @Test
    void higherLevelWinsRegardlessOfScore() {
        SeverityAssessment high = assessment(Severity.HIGH, 7.0);
        SeverityAssessment medium = assessment(Severity.MEDIUM, 6.9);
        SeverityAssessment criticalNoScore = assessment(Severity.CRITICAL, 0);

        assertTrue(high.isBetterThan(medium));
        assertFalse(medium.isBetterThan(high));
        assertTrue(criticalNoScore.isBetterThan(high));
    }

    @Test
    void scoreBreaksTieAtSameLevel() {
        SeverityAssessment a = assessment(Severity.HIGH, 8.1);
        SeverityAssessment b = assessment(Severity.HIGH, 7.5);

        assertTrue(a.isBetterThan(b));
        assertFalse(b.isBetterThan(a));
        assertFalse(a.isBetterThan(assessment(Severity.HIGH, 8.1)), "равные оценки не лучше друг друга");
    }

    @Test
    void nullLosesToAnythingInformative() {
        assertTrue(assessment(Severity.LOW, 0).isBetterThan(null));
        assertTrue(assessment(Severity.UNKNOWN, 3.0).isBetterThan(null));
        assertFalse(SeverityAssessment.unknown("GO-1").isBetterThan(null));
    }

    @Test
    void unknownCarriesReason() {
        SeverityAssessment unknown = SeverityAssessment.unknown("CVE-1", "no data");
        assertFalse(unknown.isKnown());
        assertEquals(SeverityMethod.UNKNOWN, unknown.getMethod());
        assertEquals("no data", unknown.getReason());
        assertEquals(0, unknown.getScore());
    }

    @Test
    void overrideValidThroughExpiryDayInUtc() {
        RiskOverride override = RiskOverride.builder()
            .id("GO-9")
            .reason("x")
            .expiresOn(LocalDate.parse("2026-01-01"))
            .build();

        assertFalse(override.isExpired(Instant.parse("2026-01-01T23:59:59Z")));
        assertTrue(override.isExpired(Instant.parse("2026-01-02T00:00:00Z")));
    }

    private static SeverityAssessment assessment(Severity severity, double score) {
        return SeverityAssessment.builder()
            .severity(severity)
            .score(score)
            .source("CVE-1")
            .method(SeverityMethod.NVD)
            .build();
    }
}
