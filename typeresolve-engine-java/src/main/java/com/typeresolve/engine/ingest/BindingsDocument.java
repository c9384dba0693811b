package com.typeresolve.engine.ingest;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of bindings.json, written by the static data-flow step.
 */
public class BindingsDocument {

    @SerializedName("bindings")
    public List<BindingDoc> bindings;

    public List<BindingDoc> getBindings() {
        return bindings != null ? bindings : Collections.emptyList();
    }

    public static class BindingDoc {
        @SerializedName("key")           public String key;
        @SerializedName("literal_value") public String literalValue;  // absent when not proven static
        @SerializedName("site_id")       public String siteId;
    }
}
