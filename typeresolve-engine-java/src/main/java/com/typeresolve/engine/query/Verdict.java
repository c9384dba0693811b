package com.typeresolve.engine.query;

/**
 * Open-world answer. {@link #UNKNOWN} means an opaque symbol hid the answer; it must not be read as false.
 */
public enum Verdict {
    TRUE,
    FALSE,
    UNKNOWN
}
