package com.vtb.vulnpolicy.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Источник, из которого получена оценка критичности
 */
public enum SeverityMethod {
    OSV("osv"),
    GHSA("ghsa"),
    NVD("nvd"),
    UNKNOWN("unknown");

    private final String tag;

    SeverityMethod(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}
