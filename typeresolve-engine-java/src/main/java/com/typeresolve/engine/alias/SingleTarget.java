package com.typeresolve.engine.alias;

import com.typeresolve.engine.graph.Symbol;
import com.typeresolve.engine.graph.SymbolKind;

import java.util.List;
import java.util.Objects;

public record SingleTarget(Symbol target) implements AliasResolution {

    public SingleTarget {
        Objects.requireNonNull(target, "target");
        if (target.kind() == SymbolKind.ALIAS) {
            throw new IllegalArgumentException("Unresolved alias as target: " + target.id());
        }
    }

    @Override
    public List<Symbol> members() {
        return List.of(target);
    }

    @Override
    public boolean isComposition() {
        return false;
    }
}
