package com.vtb.vulnpolicy.severity;

import com.vtb.vulnpolicy.models.SeverityAssessment;
import lombok.Value;

/**
 * Результат поиска по одному идентификатору: оценка и, возможно, ошибка.
 * В кэш попадает именно эта пара, включая отрицательные результаты.
 */
@Value
public class LookupOutcome {
    SeverityAssessment assessment;
    LookupFailure failure;

    public static LookupOutcome success(SeverityAssessment assessment) {
        return new LookupOutcome(assessment, null);
    }

    public static LookupOutcome failed(SeverityAssessment assessment, LookupFailure failure) {
        return new LookupOutcome(assessment, failure);
    }

    public boolean isFailed() {
        return failure != null;
    }

    public boolean isCancelled() {
        return failure != null && failure.getKind() == FailureKind.CANCELLED;
    }
}
