package com.vtb.vulnpolicy.models;

import com.vtb.vulnpolicy.severity.LookupFailure;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Уязвимость после применения политики: либо совпавший override,
 * либо оценка критичности (с необязательными нефатальными ошибками резолвера).
 * Для недостижимых уязвимостей без override не заполнено ни то, ни другое.
 */
@Value
@Builder
public class EvaluatedFinding {
    Finding finding;
    SeverityAssessment severity;
    RiskOverride override;
    String matchedById;
    @Singular
    List<LookupFailure> resolverWarnings;

    public boolean hasResolverWarnings() {
        return !resolverWarnings.isEmpty();
    }

    /**
     * Ранг для сортировки: без оценки все равны.
     */
    public int severityRank() {
        return severity != null ? severity.getSeverity().getPriority() : -1;
    }
}
