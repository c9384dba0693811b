package com.typeresolve.engine.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A named declaration in the graph. Relationships are kept raw (unresolved): a superclass or
 * protocol reference may point at an alias, and alias targets may point at further aliases.
 *
 * @param declaredSuperclass nullable; CLASS only
 * @param declaredProtocols  CLASS or PROTOCOL only, duplicates removed, declaration order kept
 * @param aliasTarget        ALIAS only; one element, or the members of a composition
 * @param composition        ALIAS only; true when {@code aliasTarget} is a protocol composition
 */
public record Symbol(
        String module,
        String name,
        SymbolKind kind,
        SymbolRef declaredSuperclass,
        List<SymbolRef> declaredProtocols,
        List<SymbolRef> aliasTarget,
        boolean composition
) {

    public Symbol {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        declaredProtocols = declaredProtocols == null
                ? Collections.emptyList()
                : List.copyOf(new LinkedHashSet<>(declaredProtocols));
        aliasTarget = aliasTarget == null ? Collections.emptyList() : List.copyOf(aliasTarget);

        switch (kind) {
            case OPAQUE -> {
                if (declaredSuperclass != null || !declaredProtocols.isEmpty() || !aliasTarget.isEmpty()) {
                    throw new IllegalArgumentException("Opaque symbol " + module + "::" + name
                            + " cannot declare a superclass, protocols or an alias target");
                }
            }
            case ALIAS -> {
                if (aliasTarget.isEmpty()) {
                    throw new IllegalArgumentException("Alias " + module + "::" + name + " has no target");
                }
                if (declaredSuperclass != null || !declaredProtocols.isEmpty()) {
                    throw new IllegalArgumentException("Alias " + module + "::" + name
                            + " cannot declare a superclass or protocols");
                }
                if (!composition && aliasTarget.size() > 1) {
                    throw new IllegalArgumentException("Alias " + module + "::" + name
                            + " has several targets but is not a composition");
                }
            }
            case PROTOCOL -> {
                if (declaredSuperclass != null || !aliasTarget.isEmpty()) {
                    throw new IllegalArgumentException("Protocol " + module + "::" + name
                            + " cannot declare a superclass or an alias target");
                }
            }
            case CLASS -> {
                if (!aliasTarget.isEmpty()) {
                    throw new IllegalArgumentException("Class " + module + "::" + name
                            + " cannot declare an alias target");
                }
            }
        }
        if (kind != SymbolKind.ALIAS && composition) {
            throw new IllegalArgumentException("Only aliases can be compositions: " + module + "::" + name);
        }
    }

    // --- Factories ---

    public static Symbol classSymbol(String module, String name, SymbolRef superclass, List<SymbolRef> protocols) {
        return new Symbol(module, name, SymbolKind.CLASS, superclass, protocols, null, false);
    }

    public static Symbol protocol(String module, String name, List<SymbolRef> refinedProtocols) {
        return new Symbol(module, name, SymbolKind.PROTOCOL, null, refinedProtocols, null, false);
    }

    public static Symbol alias(String module, String name, SymbolRef target) {
        return new Symbol(module, name, SymbolKind.ALIAS, null, null, List.of(target), false);
    }

    public static Symbol composition(String module, String name, List<SymbolRef> members) {
        return new Symbol(module, name, SymbolKind.ALIAS, null, null, new ArrayList<>(members), true);
    }

    public static Symbol opaque(String module, String name) {
        return new Symbol(module, name, SymbolKind.OPAQUE, null, null, null, false);
    }

    public SymbolRef ref() {
        return new SymbolRef(module, name);
    }

    public String id() {
        return module + "::" + name;
    }

    public boolean isOpaque() {
        return kind == SymbolKind.OPAQUE;
    }

    @Override
    public String toString() {
        return isOpaque() ? id() + "(opaque)" : id();
    }
}
