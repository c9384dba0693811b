package com.typeresolve.engine.alias;

import com.typeresolve.engine.graph.Symbol;

import java.util.List;

/**
 * Canonical target of a symbol after alias expansion: either a {@link SingleTarget}
 * or a flattened {@link CompositionTarget}.
 */
public interface AliasResolution {

    /** Resolved symbols, never aliases. One element for a single target. */
    List<Symbol> members();

    boolean isComposition();
}
