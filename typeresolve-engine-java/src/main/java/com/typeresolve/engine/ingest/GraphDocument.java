package com.typeresolve.engine.ingest;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * POJOs matching graph.json, the declaration graph written by the ingestion step.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class GraphDocument {

    @SerializedName("graph_name") public String graphName;
    @SerializedName("symbols")    public List<SymbolDoc> symbols;

    public List<SymbolDoc> getSymbols() {
        return symbols != null ? symbols : Collections.emptyList();
    }

    public static class SymbolDoc {
        @SerializedName("name")         public String name;
        @SerializedName("module")       public String module;       // nullable: local module
        @SerializedName("kind")         public String kind;         // class, protocol, alias, opaque
        @SerializedName("superclass")   public RefDoc superclass;   // nullable
        @SerializedName("protocols")    public List<RefDoc> protocols;
        @SerializedName("alias_target") public List<RefDoc> aliasTarget;
        @SerializedName("composition")  public boolean composition;
    }

    public static class RefDoc {
        @SerializedName("module") public String module;             // nullable: local module
        @SerializedName("name")   public String name;

        public RefDoc() {}

        public RefDoc(String module, String name) {
            this.module = module;
            this.name = name;
        }
    }
}
