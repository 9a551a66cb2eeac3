package com.registry.depgraph.io;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.registry.depgraph.api.MalformedInterfaceException;
import com.registry.depgraph.extract.InterfaceDescription;

/**
 * Computes the {@code interfaceHash} of a contract version: lowercase hex
 * SHA-256 over a canonical JSON rendering (sorted properties, empty sections
 * omitted), so two descriptions that differ only in formatting or key order
 * hash the same.
 */
public final class InterfaceHasher {
    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private InterfaceHasher() {
        // Utility class
    }

    public static String hash(InterfaceDescription description) {
        try {
            return sha256(CANONICAL.writeValueAsBytes(description));
        } catch (JsonProcessingException e) {
            throw new MalformedInterfaceException("Interface description cannot be serialized", e);
        }
    }

    static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256.
            throw new IllegalStateException(e);
        }
    }
}
