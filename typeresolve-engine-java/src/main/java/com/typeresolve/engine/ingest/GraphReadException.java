package com.typeresolve.engine.ingest;

/**
 * Raised when graph.json or bindings.json is missing, unreadable or structurally invalid.
 */
public class GraphReadException extends RuntimeException {
    public GraphReadException(String message) { super(message); }
    public GraphReadException(String message, Throwable cause) { super(message, cause); }
}
