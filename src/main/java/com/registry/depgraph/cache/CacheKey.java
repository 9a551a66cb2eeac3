package com.registry.depgraph.cache;

import java.util.Objects;

import com.registry.depgraph.api.ContractVersion;

/**
 * Identifies one memoized query. Contract and version subjects live in
 * separate fields, so a contract id that happens to contain {@code @} never
 * collides with a version id. Whole-graph queries leave both null.
 */
public record CacheKey(QueryKind kind, String contractId, String versionLabel) {
    public CacheKey {
        Objects.requireNonNull(kind, "kind must not be null");
        if (versionLabel != null && contractId == null)
            throw new IllegalArgumentException("versionLabel requires a contractId");
    }

    /** Query about a contract as a whole. */
    public static CacheKey forContract(QueryKind kind, String contractId) {
        return new CacheKey(kind, Objects.requireNonNull(contractId, "contractId must not be null"), null);
    }

    /** Query about one version. */
    public static CacheKey forVersion(QueryKind kind, ContractVersion version) {
        return new CacheKey(kind, version.contractId(), version.versionLabel());
    }

    /** Query over the whole graph. */
    public static CacheKey forGraph(QueryKind kind) {
        return new CacheKey(kind, null, null);
    }
}
