package com.vtb.vulnpolicy.models;

import java.util.Collections;
import java.util.Set;

/**
 * Идентификаторы из базового (второго) прогона сканера.
 * all - все ID и алиасы, reachable - только достижимых в том прогоне.
 */
public final class ExclusionSet {

    private static final ExclusionSet EMPTY = new ExclusionSet(Set.of(), Set.of());

    private final Set<String> all;
    private final Set<String> reachable;

    public ExclusionSet(Set<String> all, Set<String> reachable) {
        this.all = Collections.unmodifiableSet(all);
        this.reachable = Collections.unmodifiableSet(reachable);
    }

    public static ExclusionSet empty() {
        return EMPTY;
    }

    public Set<String> getAll() {
        return all;
    }

    public Set<String> getReachable() {
        return reachable;
    }

    public boolean isEmpty() {
        return all.isEmpty();
    }
}
