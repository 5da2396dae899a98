package com.vtb.vulnpolicy.severity;

import com.vtb.vulnpolicy.models.SeverityAssessment;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Итог резолвера для одной уязвимости. Оценка есть всегда, failures -
 * упорядоченный список нефатальных ошибок всех опрошенных источников.
 */
@Value
public class SeverityResolution {
    SeverityAssessment assessment;
    List<LookupFailure> failures;

    public SeverityResolution(SeverityAssessment assessment, List<LookupFailure> failures) {
        this.assessment = assessment;
        this.failures = List.copyOf(failures);
    }

    public static SeverityResolution of(SeverityAssessment assessment) {
        return new SeverityResolution(assessment, List.of());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public boolean isCancelled() {
        return failures.stream().anyMatch(f -> f.getKind() == FailureKind.CANCELLED);
    }

    public String describeFailures() {
        return failures.stream()
            .map(LookupFailure::getMessage)
            .collect(Collectors.joining("; "));
    }
}
