package com.agentlog.connector;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TraceReaderTest {

    @Test
    void traceReaderReturnsObject(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("trace.json");
        Files.writeString(file, "{\"id\": \"r\", \"steps\": []}");

        JsonObject trace = new TraceReader().read(file);

        assertEquals("r", trace.get("id").getAsString());
    }

    @Test
    void traceReaderRejectsNonObject(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("trace.json");
        Files.writeString(file, "[]");
        assertThrows(TraceReader.TraceReadException.class, () -> new TraceReader().read(file));
    }

    @Test
    void traceReaderRejectsMalformedJson(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("trace.json");
        Files.writeString(file, "{\"id\": ");
        assertThrows(TraceReader.TraceReadException.class, () -> new TraceReader().read(file));
    }
}
