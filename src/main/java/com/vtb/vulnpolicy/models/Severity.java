package com.vtb.vulnpolicy.models;

import java.util.Locale;

/**
 * Уровни критичности уязвимостей.
 * Порядок строгий: UNKNOWN &lt; LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL.
 */
public enum Severity {
    CRITICAL(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1),
    UNKNOWN(0);

    private final int priority;

    Severity(int priority) {
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Явная метка уровня (CRITICAL/HIGH/MEDIUM/LOW) имеет приоритет,
     * иначе уровень выводится из CVSS score.
     */
    public static Severity normalize(String rawLabel, double score) {
        Severity explicit = fromLabel(rawLabel);
        if (explicit != UNKNOWN) {
            return explicit;
        }
        return fromScore(score);
    }

    public static Severity fromLabel(String rawLabel) {
        if (rawLabel == null) {
            return UNKNOWN;
        }
        return switch (rawLabel.trim().toUpperCase(Locale.ROOT)) {
            case "CRITICAL" -> CRITICAL;
            case "HIGH" -> HIGH;
            case "MEDIUM" -> MEDIUM;
            case "LOW" -> LOW;
            default -> UNKNOWN;
        };
    }

    public static Severity fromScore(double score) {
        if (score >= 9.0) {
            return CRITICAL;
        }
        if (score >= 7.0) {
            return HIGH;
        }
        if (score >= 4.0) {
            return MEDIUM;
        }
        if (score > 0) {
            return LOW;
        }
        return UNKNOWN;
    }

    /**
     * Блокирует ли уровень сборку. UNKNOWN трактуется как худший случай.
     */
    public boolean isBlocking() {
        return this == CRITICAL || this == HIGH || this == UNKNOWN;
    }
}
