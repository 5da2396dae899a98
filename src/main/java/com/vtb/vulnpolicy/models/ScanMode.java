package com.vtb.vulnpolicy.models;

import java.util.Locale;

/**
 * Режим сканирования, определяет правило достижимости
 */
public enum ScanMode {
    SOURCE("source"),
    BINARY("binary");

    private final String value;

    ScanMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ScanMode parse(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (ScanMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException(String.format(
            "Неподдерживаемый режим сканирования \"%s\" (допустимые значения: source, binary)", raw));
    }

    @Override
    public String toString() {
        return value;
    }
}
