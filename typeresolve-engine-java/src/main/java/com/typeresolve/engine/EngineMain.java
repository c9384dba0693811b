package com.typeresolve.engine;

import com.typeresolve.engine.config.EngineConfig;
import com.typeresolve.engine.config.EngineConfigReader;
import com.typeresolve.engine.dynamic.DynamicBinding;
import com.typeresolve.engine.graph.DeclarationGraph;
import com.typeresolve.engine.ingest.BindingsReader;
import com.typeresolve.engine.ingest.GraphDocument;
import com.typeresolve.engine.ingest.GraphLoader;
import com.typeresolve.engine.ingest.GraphReader;
import com.typeresolve.engine.query.ClassificationEngine;
import com.typeresolve.engine.report.ClassificationReporter;
import com.typeresolve.engine.report.ReportModel;
import com.typeresolve.engine.report.ReportSerializer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar typeresolve-engine-java.jar report \
 *     --graph    <path-to-graph.json> \
 *     --output   <output-dir> \
 *     [--bindings <path-to-bindings.json>] \
 *     [--config   <path-to-engine.json>] \
 *     [--local-module <name>]
 */
public class EngineMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[typeresolve] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar typeresolve-engine-java.jar report " +
                               "--graph <path> --output <dir> [--bindings <path>] [--config <path>] [--local-module <name>]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[typeresolve] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("report")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        // Parse flags
        String graphPath = null;
        String outputDir = null;
        String bindingsPath = null;
        String configPath = null;
        String localModule = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--graph"        -> graphPath    = requireNext(args, i++, "--graph");
                case "--output"       -> outputDir    = requireNext(args, i++, "--output");
                case "--bindings"     -> bindingsPath = requireNext(args, i++, "--bindings");
                case "--config"       -> configPath   = requireNext(args, i++, "--config");
                case "--local-module" -> localModule  = requireNext(args, i++, "--local-module");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (graphPath == null) throw new UsageException("--graph is required");
        if (outputDir == null) throw new UsageException("--output is required");

        // 1. Configuration; the flag wins over the config file
        EngineConfig config = configPath != null
                ? new EngineConfigReader().read(Paths.get(configPath))
                : EngineConfig.defaults();
        if (localModule != null) {
            config = config.withLocalModule(localModule);
        }

        // 2. Declaration graph
        Path graphFile = Paths.get(graphPath);
        System.err.println("[typeresolve] Reading declaration graph: " + graphFile);
        GraphDocument document = new GraphReader().read(graphFile);
        DeclarationGraph graph = new GraphLoader(config.getLocalModule()).load(document);
        System.err.println("[typeresolve] Loaded " + graph.size() + " symbols (revision " + graph.revision() + ")");

        // 3. Dynamic bindings
        List<DynamicBinding> bindings = Collections.emptyList();
        if (bindingsPath != null) {
            bindings = new BindingsReader().read(Paths.get(bindingsPath));
            System.err.println("[typeresolve] Loaded " + bindings.size() + " dynamic bindings");
        }

        // 4. Classify
        ClassificationEngine engine = new ClassificationEngine(graph, config, bindings);
        String graphName = document.graphName != null ? document.graphName : graphFile.getFileName().toString();
        ReportModel.ReportRoot report = new ClassificationReporter().report(engine, graphName);

        // 5. Serialize
        Path output = Paths.get(outputDir);
        System.err.println("[typeresolve] Writing output to: " + output);
        new ReportSerializer().write(report, output);

        System.err.println("[typeresolve] Done.");
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
