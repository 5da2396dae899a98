package com.vtb.vulnpolicy.core;

import com.vtb.vulnpolicy.models.EvaluatedFinding;
import com.vtb.vulnpolicy.models.EvaluationResult;
import com.vtb.vulnpolicy.models.Finding;
import com.vtb.vulnpolicy.severity.SeverityResolution;
import com.vtb.vulnpolicy.severity.SeverityResolver;
import com.vtb.vulnpolicy.util.CancellationSignal;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Применение политики к уязвимостям.
 *
 * Порядок решений: override (действующий - Accepted, просроченный - Expired),
 * затем недостижимые - Info без запроса критичности, затем по критичности:
 * CRITICAL/HIGH/UNKNOWN - Fail, MEDIUM/LOW - Warn.
 */
@Slf4j
public class PolicyEvaluator {

    /**
     * Критичность по убыванию, затем ID по возрастанию
     */
    static final Comparator<EvaluatedFinding> ORDER = Comparator
        .comparingInt(EvaluatedFinding::severityRank).reversed()
        .thenComparing(item -> item.getFinding().getId());

    private final SeverityResolver resolver;

    public PolicyEvaluator(SeverityResolver resolver) {
        this.resolver = resolver;
    }

    public EvaluationResult evaluate(List<Finding> findings, OverrideRegistry overrides, Instant now) {
        return evaluate(findings, overrides, now, CancellationSignal.create());
    }

    public EvaluationResult evaluate(List<Finding> findings, OverrideRegistry overrides, Instant now,
                                     CancellationSignal signal) {
        List<EvaluatedFinding> fail = new ArrayList<>();
        List<EvaluatedFinding> warn = new ArrayList<>();
        List<EvaluatedFinding> info = new ArrayList<>();
        List<EvaluatedFinding> accepted = new ArrayList<>();
        List<EvaluatedFinding> expired = new ArrayList<>();

        for (Finding finding : findings) {
            Optional<OverrideRegistry.Match> match = overrides.match(finding);
            if (match.isPresent()) {
                EvaluatedFinding evaluated = EvaluatedFinding.builder()
                    .finding(finding)
                    .override(match.get().override())
                    .matchedById(match.get().matchedById())
                    .build();
                if (match.get().override().isExpired(now)) {
                    expired.add(evaluated);
                } else {
                    accepted.add(evaluated);
                }
                continue;
            }

            if (!finding.isReachable()) {
                info.add(EvaluatedFinding.builder().finding(finding).build());
                continue;
            }

            SeverityResolution resolution = resolver.resolve(finding, signal);
            EvaluatedFinding evaluated = EvaluatedFinding.builder()
                .finding(finding)
                .severity(resolution.getAssessment())
                .resolverWarnings(resolution.getFailures())
                .build();
            if (resolution.getAssessment().getSeverity().isBlocking()) {
                fail.add(evaluated);
            } else {
                warn.add(evaluated);
            }
        }

        fail.sort(ORDER);
        warn.sort(ORDER);
        info.sort(ORDER);
        accepted.sort(ORDER);
        expired.sort(ORDER);

        log.info("Итог политики: fail={}, warn={}, info={}, accepted={}, expired={}",
            fail.size(), warn.size(), info.size(), accepted.size(), expired.size());

        return EvaluationResult.builder()
            .fail(List.copyOf(fail))
            .warn(List.copyOf(warn))
            .info(List.copyOf(info))
            .accepted(List.copyOf(accepted))
            .expired(List.copyOf(expired))
            .build();
    }
}
