package com.vtb.vulnpolicy.severity;

import lombok.Builder;
import lombok.Value;

/**
 * Нефатальная ошибка поиска критичности: источник, идентификатор и причина.
 */
@Value
@Builder
public class LookupFailure {
    /** GHSA или NVD */
    String source;
    String identifier;
    FailureKind kind;
    String message;
    Throwable cause;

    public static LookupFailure of(String source, String identifier, FailureKind kind, String message) {
        return LookupFailure.builder()
            .source(source)
            .identifier(identifier)
            .kind(kind)
            .message(message)
            .build();
    }

    @Override
    public String toString() {
        return message;
    }
}
