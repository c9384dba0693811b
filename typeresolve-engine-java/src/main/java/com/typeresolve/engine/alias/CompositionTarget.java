package com.typeresolve.engine.alias;

import com.typeresolve.engine.graph.Symbol;
import com.typeresolve.engine.graph.SymbolKind;

import java.util.List;

/**
 * Flattened members of a protocol composition, first-seen order, no duplicates.
 */
public record CompositionTarget(List<Symbol> members) implements AliasResolution {

    public CompositionTarget {
        members = List.copyOf(members);
        for (Symbol member : members) {
            if (member.kind() == SymbolKind.ALIAS) {
                throw new IllegalArgumentException("Unresolved alias in composition: " + member.id());
            }
        }
    }

    @Override
    public boolean isComposition() {
        return true;
    }
}
