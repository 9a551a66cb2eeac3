package com.registry.depgraph.extract;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.registry.depgraph.api.ContractReference;
import com.registry.depgraph.api.MalformedInterfaceException;
import com.registry.depgraph.api.ReferenceKind;

/**
 * Turns an {@link InterfaceDescription} into the set of contracts it references.
 *
 * <p>
 * Sections are walked in the order interfaces, clients, imports, bindings, and
 * the returned set keeps that encounter order; edges built from it are visited
 * in the same order by the cycle detector. Each (target, kind) pair appears
 * once and references to the declaring contract itself are dropped.
 *
 * <p>
 * Stateless: one instance may be shared by any number of threads.
 */
public final class ReferenceExtractor {

    /**
     * Extracts references using the description's own {@code contractId} as the
     * declaring contract.
     *
     * @throws MalformedInterfaceException if the description or its
     *                                     {@code contractId} is missing, or any
     *                                     declaration is malformed.
     */
    public Set<ContractReference> extract(InterfaceDescription description) {
        if (description == null)
            throw new MalformedInterfaceException("Interface description is missing");
        return extract(description.getContractId(), description);
    }

    /**
     * Extracts references declared by {@code declaringContractId}.
     *
     * @throws MalformedInterfaceException if a declaration lacks its target
     *                                     identifier, a binding names an
     *                                     unknown kind, or the description
     *                                     declares a different contract.
     */
    public Set<ContractReference> extract(String declaringContractId, InterfaceDescription description) {
        if (description == null)
            throw new MalformedInterfaceException("Interface description is missing");
        String self = trimToNull(declaringContractId);
        if (self == null)
            throw new MalformedInterfaceException("Interface description does not identify its contract");
        String declared = trimToNull(description.getContractId());
        if (declared != null && !declared.equals(self))
            throw new MalformedInterfaceException(
                    "Interface description declares contract " + declared + " but was published as " + self);

        Set<ContractReference> refs = new LinkedHashSet<>();
        collect(self, description.getInterfaces(), ReferenceKind.INTERFACE, "interfaces", refs);
        collect(self, description.getClients(), ReferenceKind.CLIENT, "clients", refs);
        collect(self, description.getImports(), ReferenceKind.IMPORT, "imports", refs);

        List<InterfaceDescription.Binding> bindings = description.getBindings();
        if (bindings != null) {
            for (int i = 0; i < bindings.size(); i++) {
                InterfaceDescription.Binding b = bindings.get(i);
                if (b == null)
                    throw new MalformedInterfaceException("bindings[" + i + "] is null");
                String target = requireTarget(b.getContractId(), "bindings", i);
                ReferenceKind kind = ReferenceKind.fromLabel(b.getKind());
                add(self, target, kind, refs);
            }
        }
        return Collections.unmodifiableSet(refs);
    }

    private static void collect(String self, List<InterfaceDescription.ReferenceDeclaration> decls,
            ReferenceKind kind, String section, Set<ContractReference> out) {
        if (decls == null)
            return;
        for (int i = 0; i < decls.size(); i++) {
            InterfaceDescription.ReferenceDeclaration d = decls.get(i);
            if (d == null)
                throw new MalformedInterfaceException(section + "[" + i + "] is null");
            add(self, requireTarget(d.getContractId(), section, i), kind, out);
        }
    }

    private static void add(String self, String target, ReferenceKind kind, Set<ContractReference> out) {
        if (!target.equals(self))
            out.add(new ContractReference(target, kind));
    }

    private static String requireTarget(String contractId, String section, int index) {
        String target = trimToNull(contractId);
        if (target == null)
            throw new MalformedInterfaceException(section + "[" + index + "] is missing contractId");
        return target;
    }

    private static String trimToNull(String s) {
        if (s == null)
            return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
