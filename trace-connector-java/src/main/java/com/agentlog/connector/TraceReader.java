package com.agentlog.connector;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads a trace file into the JSON object the connector consumes.
 */
public class TraceReader {

    /**
     * @throws TraceReadException if the file is missing, unreadable, or its top level is not an object
     */
    public JsonObject read(Path tracePath) {
        if (!Files.isRegularFile(tracePath)) {
            throw new TraceReadException("Trace file not found: " + tracePath);
        }
        JsonElement parsed;
        try (Reader reader = Files.newBufferedReader(tracePath, StandardCharsets.UTF_8)) {
            parsed = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new TraceReadException("Trace file is not valid JSON: " + tracePath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new TraceReadException("Failed to read trace: " + tracePath + ": " + e.getMessage(), e);
        }
        if (!parsed.isJsonObject()) {
            throw new TraceReadException("Trace file must hold a JSON object: " + tracePath);
        }
        return parsed.getAsJsonObject();
    }

    public static class TraceReadException extends RuntimeException {
        public TraceReadException(String message) { super(message); }
        public TraceReadException(String message, Throwable cause) { super(message, cause); }
    }
}
