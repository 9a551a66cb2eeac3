package com.registry.depgraph.cache;

/** Read operations whose results are memoized. */
public enum QueryKind {
    DEPENDENCIES,
    DEPENDENTS,
    IMPACT,
    DEPENDENCY_TREE,
    UNRESOLVED,
    EXPORT
}
