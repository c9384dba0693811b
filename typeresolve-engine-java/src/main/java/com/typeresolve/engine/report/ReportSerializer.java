package com.typeresolve.engine.report;

import com.google.gson.GsonBuilder;

import java.io.*;
import java.nio.file.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;

/**
 * Sorts and serializes a ReportRoot to classification_report.json.
 * Produces deterministic output by sorting all arrays before writing.
 */
public class ReportSerializer {

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code root} to {@code outputDir/classification_report.json} with arrays sorted for determinism.
     * Also writes {@code outputDir/metadata.json} with graph and engine info.
     *
     * @param root      report to write
     * @param outputDir directory to write into (created if absent)
     */
    public void write(ReportModel.ReportRoot root, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }

        // Copy to mutable lists and sort for determinism
        if (root.types != null) {
            root.types = new ArrayList<>(root.types);
            root.types.sort(Comparator.comparing(t -> t.id));
        }
        if (root.dynamicReferences != null) {
            root.dynamicReferences = new ArrayList<>(root.dynamicReferences);
            root.dynamicReferences.sort(Comparator.comparing((ReportModel.DynamicEntry d) -> d.siteId)
                    .thenComparing(d -> d.key));
        }

        var gson = new GsonBuilder().setPrettyPrinting().create();

        Path reportPath = outputDir.resolve("classification_report.json");
        try (Writer w = Files.newBufferedWriter(reportPath)) {
            gson.toJson(root, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write classification_report.json: " + e.getMessage(), e);
        }
        System.err.println("[typeresolve] classification_report.json written: " + reportPath);

        var meta = new Metadata(root.graphName, root.engineVersion,
                root.types != null ? root.types.size() : 0, Instant.now().toString());
        Path metaPath = outputDir.resolve("metadata.json");
        try (Writer w = Files.newBufferedWriter(metaPath)) {
            gson.toJson(meta, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write metadata.json: " + e.getMessage(), e);
        }
        System.err.println("[typeresolve] metadata.json written: " + metaPath);
    }

    /** Simple metadata record for Gson serialization. */
    private record Metadata(
            String graphName,
            String engineVersion,
            int typeCount,
            String timestamp
    ) {}
}
