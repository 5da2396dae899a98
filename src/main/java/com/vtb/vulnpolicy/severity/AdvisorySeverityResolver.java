package com.vtb.vulnpolicy.severity;

import com.vtb.vulnpolicy.models.Finding;
import com.vtb.vulnpolicy.models.SeverityAssessment;
import com.vtb.vulnpolicy.models.SeverityMethod;
import com.vtb.vulnpolicy.util.CancellationSignal;
import com.vtb.vulnpolicy.util.Identifiers;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Резолвер критичности по цепочке источников:
 * OSV из вывода сканера, затем GHSA, затем NVD.
 *
 * Из каждого источника берется лучший результат по всем подходящим алиасам.
 * Результаты поиска по ID кэшируются на время прогона (включая ошибки),
 * поэтому экземпляр можно разделять между потоками.
 */
@Slf4j
public class AdvisorySeverityResolver implements SeverityResolver {

    private static final String OSV_UNAVAILABLE = "OSV severity unavailable in scanner input";

    private final List<AdvisorySource> sources;
    private final AdvisoryFetcher fetcher;
    private final SeverityCache cache = new SeverityCache();

    public AdvisorySeverityResolver(ResolverSettings settings) {
        this(settings, new AdvisoryFetcher(settings));
    }

    AdvisorySeverityResolver(ResolverSettings settings, AdvisoryFetcher fetcher) {
        this.sources = List.of(new GhsaAdvisorySource(settings), new NvdAdvisorySource(settings));
        this.fetcher = fetcher;
    }

    @Override
    public SeverityResolution resolve(Finding finding, CancellationSignal signal) {
        SeverityAssessment embedded = finding.getOsvSeverity();
        if (embedded != null && embedded.isKnown()) {
            return SeverityResolution.of(embedded.toBuilder()
                .source(embedded.getSource() == null || embedded.getSource().isEmpty()
                    ? Identifiers.normalize(finding.getId())
                    : embedded.getSource())
                .method(SeverityMethod.OSV)
                .build());
        }

        List<LookupFailure> failures = new ArrayList<>();
        List<SourceSweep> sweeps = new ArrayList<>(sources.size());
        for (AdvisorySource source : sources) {
            SourceSweep sweep = sweep(source, Identifiers.withPrefix(finding, source.candidatePrefix()), signal);
            sweeps.add(sweep);
            failures.addAll(sweep.failures);
            if (sweep.best != null) {
                return new SeverityResolution(sweep.best, failures);
            }
        }

        String reason = unknownReason(sweeps);
        log.debug("{}: критичность не определена ({})", finding.getId(), reason);
        return new SeverityResolution(SeverityAssessment.unknown(unknownSource(finding, sweeps), reason), failures);
    }

    /**
     * Количество закэшированных идентификаторов
     */
    public int cachedLookups() {
        return cache.size();
    }

    private SourceSweep sweep(AdvisorySource source, List<String> candidates, CancellationSignal signal) {
        SourceSweep sweep = new SourceSweep(source, candidates);
        for (String candidate : candidates) {
            LookupOutcome outcome = lookup(source, candidate, signal);
            if (outcome.isFailed()) {
                sweep.failures.add(outcome.getFailure());
                if (outcome.getFailure().getKind() == FailureKind.NO_DATA) {
                    sweep.noData++;
                }
                continue;
            }
            if (!outcome.getAssessment().isKnown()) {
                sweep.noData++;
                continue;
            }
            if (sweep.best == null || outcome.getAssessment().isBetterThan(sweep.best)) {
                sweep.best = outcome.getAssessment();
            }
        }
        return sweep;
    }

    /**
     * Кэш, затем снапшот/офлайн, затем сеть. Отмененный поиск не кэшируется.
     */
    LookupOutcome lookup(AdvisorySource source, String id, CancellationSignal signal) {
        String key = Identifiers.normalize(id);
        Optional<LookupOutcome> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        Optional<LookupOutcome> local = source.resolveLocally(key);
        if (local.isPresent()) {
            cache.put(key, local.get());
            return local.get();
        }

        if (signal.isCancelled()) {
            return LookupOutcome.failed(SeverityAssessment.unknown(key),
                source.failure(key, FailureKind.CANCELLED, source.name() + " lookup for " + key + " cancelled"));
        }

        LookupOutcome outcome = fetcher.fetch(source, key, signal);
        if (!outcome.isCancelled()) {
            cache.put(key, outcome);
        }
        return outcome;
    }

    private static String unknownReason(List<SourceSweep> sweeps) {
        if (sweeps.stream().noneMatch(SourceSweep::hasCandidates)) {
            return OSV_UNAVAILABLE + ", no CVE/GHSA aliases found";
        }
        List<String> clauses = new ArrayList<>();
        clauses.add(OSV_UNAVAILABLE);
        for (SourceSweep sweep : sweeps) {
            clauses.add(sweep.describe());
        }
        return String.join(", ", clauses);
    }

    private static String unknownSource(Finding finding, List<SourceSweep> sweeps) {
        for (SourceSweep sweep : sweeps) {
            if (sweep.hasCandidates()) {
                return sweep.candidates.get(0);
            }
        }
        return Identifiers.normalize(finding.getId());
    }

    /**
     * Итог опроса одного источника по всем кандидатам
     */
    private static final class SourceSweep {
        private final AdvisorySource source;
        private final List<String> candidates;
        private final List<LookupFailure> failures = new ArrayList<>();
        private SeverityAssessment best;
        private int noData;

        private SourceSweep(AdvisorySource source, List<String> candidates) {
            this.source = source;
            this.candidates = candidates;
        }

        private boolean hasCandidates() {
            return !candidates.isEmpty();
        }

        private String describe() {
            if (!hasCandidates()) {
                return "no " + source.aliasLabel() + " aliases found";
            }
            if (noData == candidates.size()) {
                return source.name() + " lookup returned no severity data";
            }
            return source.name() + " lookup failed";
        }
    }
}
