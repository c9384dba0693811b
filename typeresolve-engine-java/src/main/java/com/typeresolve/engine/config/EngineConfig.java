package com.typeresolve.engine.config;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of engine.json. Every field is optional.
 */
public class EngineConfig {

    /** Module name that marks known, inspectable source (default: "local"). */
    @SerializedName("local_module")
    private String localModule;

    /** Modules searched by dynamic class lookups (default: empty, meaning all modules). */
    @SerializedName("module_scope")
    private List<String> moduleScope;

    /** Whether query results are memoized per graph revision (default: true). */
    @SerializedName("cache_enabled")
    private Boolean cacheEnabled;

    public EngineConfig() {}

    public EngineConfig(String localModule, List<String> moduleScope, Boolean cacheEnabled) {
        this.localModule = localModule;
        this.moduleScope = moduleScope;
        this.cacheEnabled = cacheEnabled;
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /** Copy with the local module replaced; used for command-line overrides. */
    public EngineConfig withLocalModule(String module) {
        return new EngineConfig(module, moduleScope, cacheEnabled);
    }

    public String getLocalModule()       { return localModule != null ? localModule : "local"; }
    public List<String> getModuleScope() { return moduleScope != null ? moduleScope : Collections.emptyList(); }
    public boolean isCacheEnabled()      { return cacheEnabled == null || cacheEnabled; }
}
