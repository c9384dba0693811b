package com.typeresolve.engine.ingest;

import java.nio.file.Path;

public class GraphReader {

    /**
     * Reads and deserializes graph.json (UTF-8) from the given path.
     *
     * @throws GraphReadException if the file is missing or malformed
     */
    public GraphDocument read(Path graphPath) {
        return JsonFileReader.read(graphPath, GraphDocument.class, "Graph file", GraphReadException::new);
    }
}
