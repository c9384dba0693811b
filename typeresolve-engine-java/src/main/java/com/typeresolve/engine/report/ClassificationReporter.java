package com.typeresolve.engine.report;

import com.typeresolve.engine.ResolutionException;
import com.typeresolve.engine.dynamic.DynamicBinding;
import com.typeresolve.engine.dynamic.Resolution;
import com.typeresolve.engine.graph.Symbol;
import com.typeresolve.engine.query.ClassificationEngine;
import com.typeresolve.engine.resolve.ResolvedType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Runs the classification queries over every class symbol and every ingested binding
 * and assembles a {@link ReportModel.ReportRoot}.
 *
 * A schema error on one type is recorded on that type's entry; the remaining types are still reported.
 */
public class ClassificationReporter {

    static final String REPORT_VERSION = "0.1";
    static final String ENGINE_VERSION = "0.1.0";

    /**
     * @param engine    query engine over the loaded graph
     * @param graphName name recorded in the report (nullable)
     * @return assembled, ready-to-serialize report
     */
    public ReportModel.ReportRoot report(ClassificationEngine engine, String graphName) {
        List<ReportModel.TypeEntry> types = new ArrayList<>();
        int failures = 0;
        for (Symbol symbol : engine.graph().allClassSymbols()) {
            ReportModel.TypeEntry entry = new ReportModel.TypeEntry();
            entry.id = symbol.id();
            entry.module = symbol.module();
            entry.name = symbol.name();
            try {
                ResolvedType resolved = engine.resolveType(symbol);
                entry.superclassChain = resolved.chainIds();
                entry.terminatedAtOpaque = resolved.terminatedAtOpaque();
                entry.effectiveProtocols = resolved.protocolIds();
            } catch (ResolutionException e) {
                failures++;
                System.err.println("[typeresolve] WARNING: could not resolve " + symbol.id() + ": " + e.getMessage());
                entry.superclassChain = Collections.emptyList();
                entry.effectiveProtocols = Collections.emptyList();
                entry.error = e.getMessage();
            }
            types.add(entry);
        }

        List<ReportModel.DynamicEntry> dynamicReferences = new ArrayList<>();
        for (DynamicBinding binding : engine.bindings()) {
            Resolution resolution = engine.resolveDynamicName(binding);
            ReportModel.DynamicEntry entry = new ReportModel.DynamicEntry();
            entry.siteId = binding.siteId();
            entry.key = binding.key();
            entry.literalValue = binding.literalValue();
            entry.status = resolution.kind().name().toLowerCase(Locale.ROOT);
            entry.candidates = resolution.candidates().stream().map(Symbol::id).collect(Collectors.toList());
            if (resolution instanceof Resolution.Unresolvable) {
                entry.reason = ((Resolution.Unresolvable) resolution).reason().name();
            }
            dynamicReferences.add(entry);
        }

        if (failures > 0) {
            System.err.println("[typeresolve] " + failures + " of " + types.size() + " types failed to resolve");
        }

        ReportModel.ReportRoot root = new ReportModel.ReportRoot();
        root.reportVersion = REPORT_VERSION;
        root.engineVersion = ENGINE_VERSION;
        root.graphName = graphName;
        root.graphRevision = engine.graph().revision();
        root.localModule = engine.config().getLocalModule();
        root.types = types;
        root.dynamicReferences = dynamicReferences;
        return root;
    }
}
