package com.registry.depgraph;

import java.util.ArrayList;
import java.util.List;

import com.registry.depgraph.extract.InterfaceDescription;
import com.registry.depgraph.extract.InterfaceDescription.ReferenceDeclaration;

/** Test helpers for building interface descriptions. */
public final class Interfaces {
    private Interfaces() {
    }

    /** An interface with no references. */
    public static InterfaceDescription plain(String contractId) {
        InterfaceDescription d = new InterfaceDescription();
        d.setContractId(contractId);
        d.setName(contractId);
        return d;
    }

    public static InterfaceDescription clients(String contractId, String... targets) {
        InterfaceDescription d = plain(contractId);
        d.setClients(decls(targets));
        return d;
    }

    public static InterfaceDescription imports(String contractId, String... targets) {
        InterfaceDescription d = plain(contractId);
        d.setImports(decls(targets));
        return d;
    }

    public static InterfaceDescription interfaces(String contractId, String... targets) {
        InterfaceDescription d = plain(contractId);
        d.setInterfaces(decls(targets));
        return d;
    }

    private static List<ReferenceDeclaration> decls(String... targets) {
        List<ReferenceDeclaration> out = new ArrayList<>();
        for (String t : targets)
            out.add(ReferenceDeclaration.of(t));
        return out;
    }
}
