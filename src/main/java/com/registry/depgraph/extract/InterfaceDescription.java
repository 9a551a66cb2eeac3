package com.registry.depgraph.extract;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a contract's published interface, already parsed from
 * the artifact's interface document.
 *
 * <p>
 * Only the reference-bearing sections are modelled; anything else in the
 * document (functions, types, events) is ignored.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class InterfaceDescription {
    /** The declaring contract. Optional; when present it must match the publish. */
    private String contractId;
    private String name;
    private List<ReferenceDeclaration> interfaces;
    private List<ReferenceDeclaration> clients;
    private List<ReferenceDeclaration> imports;
    /** Bindings that name their kind explicitly. */
    private List<Binding> bindings;

    /** A reference whose kind is given by the section it appears in. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ReferenceDeclaration {
        private String contractId, name;

        public static ReferenceDeclaration of(String contractId) {
            ReferenceDeclaration d = new ReferenceDeclaration();
            d.setContractId(contractId);
            return d;
        }
    }

    /** A reference carrying its kind as a string, validated on extraction. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class Binding {
        private String contractId, kind;

        public static Binding of(String contractId, String kind) {
            Binding b = new Binding();
            b.setContractId(contractId);
            b.setKind(kind);
            return b;
        }
    }
}
