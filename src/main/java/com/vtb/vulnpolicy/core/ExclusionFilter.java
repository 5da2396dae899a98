package com.vtb.vulnpolicy.core;

import com.vtb.vulnpolicy.models.ExclusionSet;
import com.vtb.vulnpolicy.models.Finding;
import com.vtb.vulnpolicy.models.ScanMode;
import com.vtb.vulnpolicy.util.Identifiers;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Исключение уязвимостей, уже известных по базовому прогону сканера.
 *
 * Уязвимость удаляется, если совпала с reachable базового прогона, либо
 * совпала с all и сама недостижима. Ставшая достижимой уязвимость остается.
 */
@Slf4j
public final class ExclusionFilter {

    private ExclusionFilter() {
    }

    /**
     * Построить набор исключений из второго вывода сканера.
     * Базовый прогон всегда разбирается в режиме source.
     */
    public static ExclusionSet load(Path baselinePath) throws IOException {
        List<Finding> baseline = new FindingAggregator(ScanMode.SOURCE).aggregate(baselinePath);
        return fromFindings(baseline);
    }

    public static ExclusionSet fromFindings(List<Finding> baseline) {
        Set<String> all = new HashSet<>();
        Set<String> reachable = new HashSet<>();
        for (Finding finding : baseline) {
            for (String candidate : Identifiers.candidates(finding)) {
                String normalized = Identifiers.normalize(candidate);
                if (normalized.isEmpty()) {
                    continue;
                }
                all.add(normalized);
                if (finding.isReachable()) {
                    reachable.add(normalized);
                }
            }
        }
        log.debug("Набор исключений: {} идентификаторов, из них достижимых {}", all.size(), reachable.size());
        return new ExclusionSet(all, reachable);
    }

    public static List<Finding> filter(List<Finding> findings, ExclusionSet exclusions) {
        if (exclusions == null || exclusions.isEmpty()) {
            return findings;
        }

        List<Finding> kept = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            boolean matchedAll = false;
            boolean matchedReachable = false;
            for (String candidate : Identifiers.candidates(finding)) {
                String normalized = Identifiers.normalize(candidate);
                if (normalized.isEmpty()) {
                    continue;
                }
                matchedAll |= exclusions.getAll().contains(normalized);
                matchedReachable |= exclusions.getReachable().contains(normalized);
            }
            if (matchedReachable || (matchedAll && !finding.isReachable())) {
                continue;
            }
            kept.add(finding);
        }

        log.info("Исключено по базовому прогону: {} из {}", findings.size() - kept.size(), findings.size());
        return kept;
    }
}
