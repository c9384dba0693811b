package com.typeresolve.engine.dynamic;

public enum ResolutionKind {
    RESOLVED,
    AMBIGUOUS,
    UNRESOLVABLE
}
