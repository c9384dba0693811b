package com.typeresolve.engine.ingest;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.function.BiFunction;

/**
 * Opens a UTF-8 JSON input file and deserializes it with Gson, mapping every failure
 * (missing, unreadable, malformed or empty file) to the caller's exception type.
 */
public final class JsonFileReader {

    private static final Gson GSON = new Gson();

    private JsonFileReader() {}

    /**
     * @param label  names the file in error messages, e.g. "Graph file"
     * @param errors builds the exception to throw from a message and an optional cause
     */
    public static <T> T read(Path path, Class<T> type, String label,
                             BiFunction<String, Throwable, ? extends RuntimeException> errors) {
        if (!Files.exists(path)) {
            throw errors.apply(label + " not found: " + path, null);
        }
        T document;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            document = GSON.fromJson(reader, type);
        } catch (NoSuchFileException e) {
            throw errors.apply(label + " not found: " + path, e);
        } catch (JsonParseException e) {
            throw errors.apply(label + " is malformed: " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw errors.apply(label + " could not be read: " + path + ": " + e.getMessage(), e);
        }
        if (document == null) {
            throw errors.apply(label + " is empty or invalid JSON: " + path, null);
        }
        return document;
    }
}
