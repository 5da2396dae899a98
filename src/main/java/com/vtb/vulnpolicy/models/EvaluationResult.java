package com.vtb.vulnpolicy.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Итоговое разбиение уязвимостей на пять непересекающихся групп.
 */
@Value
@Builder
public class EvaluationResult {
    /** HIGH/CRITICAL/UNKNOWN без override */
    @Builder.Default
    List<EvaluatedFinding> fail = List.of();
    /** LOW/MEDIUM без override */
    @Builder.Default
    List<EvaluatedFinding> warn = List.of();
    /** Недостижимые без override */
    @Builder.Default
    List<EvaluatedFinding> info = List.of();
    /** Действующий override */
    @Builder.Default
    List<EvaluatedFinding> accepted = List.of();
    /** Просроченный override */
    @Builder.Default
    List<EvaluatedFinding> expired = List.of();

    /**
     * Непустые Fail или Expired означают провал сборки.
     */
    public boolean isFailing() {
        return !fail.isEmpty() || !expired.isEmpty();
    }

    public int total() {
        return fail.size() + warn.size() + info.size() + accepted.size() + expired.size();
    }
}
