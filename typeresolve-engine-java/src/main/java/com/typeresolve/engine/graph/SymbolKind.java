package com.typeresolve.engine.graph;

public enum SymbolKind {
    CLASS,
    PROTOCOL,
    ALIAS,
    /** Declared outside inspectable source; nothing is known beyond module and name. */
    OPAQUE
}
