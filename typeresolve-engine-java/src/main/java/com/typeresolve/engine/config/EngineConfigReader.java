package com.typeresolve.engine.config;

import com.typeresolve.engine.ingest.JsonFileReader;

import java.nio.file.Path;

public class EngineConfigReader {

    /**
     * Reads and deserializes engine.json (UTF-8) from the given path.
     *
     * @throws ConfigReadException if the file is missing or malformed
     */
    public EngineConfig read(Path configPath) {
        return JsonFileReader.read(configPath, EngineConfig.class, "Config file", ConfigReadException::new);
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
