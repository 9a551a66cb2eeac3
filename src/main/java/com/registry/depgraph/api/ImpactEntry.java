package com.registry.depgraph.api;

import java.util.Comparator;

/**
 * A version affected by a change, with the minimum number of reverse hops from
 * the origin.
 */
public record ImpactEntry(ContractVersion version, int depth) {

    public static final Comparator<ImpactEntry> ORDER = Comparator
            .comparingInt(ImpactEntry::depth)
            .thenComparing(ImpactEntry::version, ContractVersion.BY_ID);
}
