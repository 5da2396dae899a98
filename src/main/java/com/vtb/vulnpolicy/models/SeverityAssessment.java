package com.vtb.vulnpolicy.models;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;

/**
 * Оценка критичности одной уязвимости.
 *
 * score = 0 означает "оценка не предоставлена", а не нулевую оценку.
 * reason заполняется только для UNKNOWN.
 */
@Value
@Builder(toBuilder = true)
public class SeverityAssessment {

    /**
     * Полный порядок: сначала уровень, при равенстве уровней - score.
     */
    public static final Comparator<SeverityAssessment> ORDER = Comparator
        .comparingInt((SeverityAssessment a) -> a.getSeverity().getPriority())
        .thenComparingDouble(SeverityAssessment::getScore);

    @Builder.Default
    Severity severity = Severity.UNKNOWN;
    double score;
    String source;
    @Builder.Default
    SeverityMethod method = SeverityMethod.UNKNOWN;
    String reason;

    public static SeverityAssessment unknown(String source) {
        return unknown(source, null);
    }

    public static SeverityAssessment unknown(String source, String reason) {
        return SeverityAssessment.builder()
            .severity(Severity.UNKNOWN)
            .source(source)
            .method(SeverityMethod.UNKNOWN)
            .reason(reason)
            .build();
    }

    public boolean isKnown() {
        return severity != Severity.UNKNOWN;
    }

    /**
     * Строго лучше ли эта оценка, чем other. null проигрывает любой оценке,
     * кроме UNKNOWN без score.
     */
    public boolean isBetterThan(SeverityAssessment other) {
        if (other == null) {
            return severity != Severity.UNKNOWN || score > 0;
        }
        return ORDER.compare(this, other) > 0;
    }
}
