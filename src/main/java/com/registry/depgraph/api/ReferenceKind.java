package com.registry.depgraph.api;

import java.util.Locale;

/**
 * Closed set of ways one contract can declare a reference to another.
 *
 * <p>
 * Declaration order is the sort order used by dependency queries.
 */
public enum ReferenceKind {
    INTERFACE("interface"),
    CLIENT("client"),
    IMPORT("import");

    private final String label;

    ReferenceKind(String label) {
        this.label = label;
    }

    /** Wire name used in interface descriptions and exports. */
    public String label() {
        return label;
    }

    /**
     * Resolves a wire name, case-insensitively.
     *
     * @throws MalformedInterfaceException if the name is not one of the known
     *                                     kinds.
     */
    public static ReferenceKind fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (ReferenceKind kind : values())
                if (kind.label.equals(normalized))
                    return kind;
        }
        throw new MalformedInterfaceException("Unknown reference kind: " + label);
    }
}
