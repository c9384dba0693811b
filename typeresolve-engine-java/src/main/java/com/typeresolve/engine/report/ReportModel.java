package com.typeresolve.engine.report;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs matching classification report schema v0.1.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class ReportModel {

    private ReportModel() {}

    public static class ReportRoot {
        @SerializedName("report_version")    public String reportVersion;
        @SerializedName("engine_version")    public String engineVersion;
        @SerializedName("graph_name")        public String graphName;
        @SerializedName("graph_revision")    public long graphRevision;
        @SerializedName("local_module")      public String localModule;
        @SerializedName("types")             public List<TypeEntry> types;
        @SerializedName("dynamic_references") public List<DynamicEntry> dynamicReferences;
    }

    public static class TypeEntry {
        @SerializedName("id")                   public String id;
        @SerializedName("module")               public String module;
        @SerializedName("name")                 public String name;
        @SerializedName("superclass_chain")     public List<String> superclassChain;
        @SerializedName("terminated_at_opaque") public boolean terminatedAtOpaque;
        @SerializedName("effective_protocols")  public List<String> effectiveProtocols;
        @SerializedName("error")                public String error;  // nullable
    }

    public static class DynamicEntry {
        @SerializedName("site_id")       public String siteId;
        @SerializedName("key")           public String key;
        @SerializedName("literal_value") public String literalValue;  // nullable
        @SerializedName("status")        public String status;        // resolved, ambiguous, unresolvable
        @SerializedName("candidates")    public List<String> candidates;
        @SerializedName("reason")        public String reason;        // nullable
    }
}
