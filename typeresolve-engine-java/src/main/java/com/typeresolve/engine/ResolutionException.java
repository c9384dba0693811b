package com.typeresolve.engine;

/**
 * Base type for schema-integrity failures raised while building or querying a declaration graph.
 * Fatal to the request that raised it; the engine stays usable for other symbols.
 */
public class ResolutionException extends RuntimeException {
    public ResolutionException(String message) { super(message); }
}
