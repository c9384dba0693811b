package com.typeresolve.engine.graph;

import java.util.Objects;

/**
 * Key of a declaration: (module, name). Symbols reference each other through these keys
 * so a reference may be written before its target is registered.
 *
 * ID format: {@code <module>::<name>}
 */
public record SymbolRef(String module, String name) implements Comparable<SymbolRef> {

    public SymbolRef {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(name, "name");
    }

    public static SymbolRef of(String module, String name) {
        return new SymbolRef(module, name);
    }

    public String id() {
        return module + "::" + name;
    }

    @Override
    public int compareTo(SymbolRef other) {
        int byModule = module.compareTo(other.module);
        return byModule != 0 ? byModule : name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return id();
    }
}
