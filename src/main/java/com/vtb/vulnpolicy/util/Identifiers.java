package com.vtb.vulnpolicy.util;

import com.vtb.vulnpolicy.models.Finding;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Работа с идентификаторами уязвимостей (GO-, CVE-, GHSA-).
 * Сравнение всегда точное, по каноническому виду.
 */
public final class Identifiers {

    public static final String CVE_PREFIX = "CVE-";
    public static final String GHSA_PREFIX = "GHSA-";

    private Identifiers() {
    }

    public static String normalize(String value) {
        return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * ID уязвимости и затем ее алиасы в сохраненном порядке.
     */
    public static List<String> candidates(Finding finding) {
        List<String> candidates = new ArrayList<>(finding.getAliases().size() + 1);
        candidates.add(finding.getId());
        candidates.addAll(finding.getAliases());
        return candidates;
    }

    /**
     * Канонические ID с заданным префиксом: без дубликатов, по возрастанию.
     */
    public static List<String> withPrefix(Finding finding, String prefix) {
        Set<String> result = new TreeSet<>();
        for (String candidate : candidates(finding)) {
            String normalized = normalize(candidate);
            if (normalized.startsWith(prefix)) {
                result.add(normalized);
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * Trim, удаление пустых и дубликатов с сохранением порядка первого появления.
     */
    public static List<String> unique(Collection<String> values) {
        Set<String> seen = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null) continue;
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                seen.add(trimmed);
            }
        }
        return new ArrayList<>(seen);
    }
}
