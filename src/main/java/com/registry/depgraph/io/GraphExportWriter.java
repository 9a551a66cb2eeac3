package com.registry.depgraph.io;

import java.io.IOException;
import java.io.OutputStream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.registry.depgraph.api.GraphExport;

/**
 * Serializes a {@link GraphExport} to JSON for visualization consumers.
 *
 * <pre>
 * {"epoch":3,
 *  "nodes":[{"id":"a@1","contractId":"a","versionLabel":"1"}],
 *  "edges":[{"from":"b@1","to":"a","kind":"client"}]}
 * </pre>
 *
 * The export keeps insertion order, so equal exports serialize to identical
 * bytes.
 */
public final class GraphExportWriter {
    private final ObjectMapper mapper;

    public GraphExportWriter() {
        this(false);
    }

    public GraphExportWriter(boolean pretty) {
        this.mapper = new ObjectMapper().configure(SerializationFeature.INDENT_OUTPUT, pretty);
    }

    public String toJson(GraphExport export) {
        try {
            return mapper.writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Graph export is not serializable", e);
        }
    }

    public void write(GraphExport export, OutputStream out) throws IOException {
        mapper.writeValue(out, export);
    }
}
