package com.leadharvest.scrape.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Canonical JSON and SHA-256 helpers shared by the upsert engine and the CRM sync.
 * <p>
 * Canonical form: object keys sorted at every depth, no insignificant whitespace,
 * non-ASCII characters written as-is.
 */
public final class HashUtils {
    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private HashUtils() {
    }

    public static String canonicalJson(Object value) {
        try {
            // JsonNode trees keep insertion order, so route everything through plain maps first.
            Object plain = CANONICAL.convertValue(value, Object.class);
            return CANONICAL.writeValueAsString(plain);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalStateException("Unable to serialize value for hashing", e);
        }
    }

    public static String sha256OfObject(Object value) {
        return sha256Hex(canonicalJson(value));
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
