package com.registry.depgraph.api;

import java.util.List;

/**
 * One node of a forward dependency tree.
 *
 * <p>
 * The root has a null {@code kind}. Targets without any published version are
 * leaves with {@code resolved == false} and a null {@code versionLabel}.
 * {@code truncated} is set when the depth cap stopped the walk below a
 * resolved node that still has dependencies.
 */
public record DependencyTreeNode(String contractId, String versionLabel, ReferenceKind kind,
        boolean resolved, boolean truncated, List<DependencyTreeNode> dependencies) {

    public DependencyTreeNode {
        dependencies = List.copyOf(dependencies);
    }

    public static DependencyTreeNode unresolved(String contractId, ReferenceKind kind) {
        return new DependencyTreeNode(contractId, null, kind, false, false, List.of());
    }
}
