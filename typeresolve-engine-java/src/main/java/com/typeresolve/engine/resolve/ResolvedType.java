package com.typeresolve.engine.resolve;

import com.typeresolve.engine.graph.Symbol;
import com.typeresolve.engine.graph.SymbolRef;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Effective structure of one class symbol.
 *
 * @param canonicalSuperclassChain nearest first; ends at a root or at an opaque symbol, never contains aliases
 * @param effectiveProtocols       transitive closure of required protocols, first-seen order
 * @param terminatedAtOpaque       true if the chain's last element is opaque rather than a known root
 */
public record ResolvedType(
        Symbol symbol,
        List<Symbol> canonicalSuperclassChain,
        Set<Symbol> effectiveProtocols,
        boolean terminatedAtOpaque
) {

    public ResolvedType {
        canonicalSuperclassChain = List.copyOf(canonicalSuperclassChain);
        effectiveProtocols = Collections.unmodifiableSet(new LinkedHashSet<>(effectiveProtocols));
    }

    public boolean hasAncestor(SymbolRef ref) {
        for (Symbol ancestor : canonicalSuperclassChain) {
            if (ancestor.ref().equals(ref)) return true;
        }
        return false;
    }

    public boolean requiresProtocol(SymbolRef ref) {
        for (Symbol protocol : effectiveProtocols) {
            if (protocol.ref().equals(ref)) return true;
        }
        return false;
    }

    /** True if some required protocol is opaque, so its own requirements are unknown. */
    public boolean hasOpaqueProtocol() {
        return effectiveProtocols.stream().anyMatch(Symbol::isOpaque);
    }

    public List<String> chainIds() {
        return canonicalSuperclassChain.stream().map(Symbol::id).collect(Collectors.toList());
    }

    public List<String> protocolIds() {
        return effectiveProtocols.stream().map(Symbol::id).collect(Collectors.toList());
    }
}
