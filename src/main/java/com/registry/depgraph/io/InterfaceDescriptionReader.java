package com.registry.depgraph.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.registry.depgraph.api.MalformedInterfaceException;
import com.registry.depgraph.extract.InterfaceDescription;

/**
 * Reads {@link InterfaceDescription}s from JSON.
 *
 * <p>
 * Syntax errors are reported as {@link MalformedInterfaceException}, the same
 * failure the extractor raises for structurally incomplete input. Errors
 * reading the file itself stay {@link IOException}s.
 */
public final class InterfaceDescriptionReader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private InterfaceDescriptionReader() {
        // Utility class
    }

    public static InterfaceDescription parse(String json) {
        if (json == null || json.isBlank())
            throw new MalformedInterfaceException("Interface document is empty");
        try {
            InterfaceDescription description = MAPPER.readValue(json, InterfaceDescription.class);
            if (description == null)
                throw new MalformedInterfaceException("Interface document is null");
            return description;
        } catch (JsonProcessingException e) {
            throw new MalformedInterfaceException("Interface document is not valid JSON: "
                    + e.getOriginalMessage(), e);
        }
    }

    public static InterfaceDescription parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Reads a classpath resource, e.g. a bundled fixture. */
    public static InterfaceDescription parseResource(String resource) throws IOException {
        try (InputStream in = InterfaceDescriptionReader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Resource not found: " + resource);
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }
}
