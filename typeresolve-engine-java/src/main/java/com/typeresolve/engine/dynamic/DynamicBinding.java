package com.typeresolve.engine.dynamic;

import java.util.Objects;
import java.util.Optional;

/**
 * A statically observed assignment of a string value to a configuration key at one call site.
 *
 * @param literalValue nullable; null when the value could not be proven to be a compile-time literal
 * @param siteId       identifies the call site in diagnostics
 */
public record DynamicBinding(String key, String literalValue, String siteId) {

    public DynamicBinding {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(siteId, "siteId");
    }

    public static DynamicBinding literal(String key, String value, String siteId) {
        return new DynamicBinding(key, Objects.requireNonNull(value, "value"), siteId);
    }

    /** A binding whose value is computed at runtime. */
    public static DynamicBinding computed(String key, String siteId) {
        return new DynamicBinding(key, null, siteId);
    }

    public Optional<String> literal() {
        return Optional.ofNullable(literalValue);
    }
}
