package com.huntql.service.core.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cache key of a query: SHA-256 over the canonical JSON of the normalized query text, the organization and the
 * effective bindings. Queries that differ only in whitespace, comments or keyword case share a fingerprint.
 */
public final class QueryFingerprint {

    private static final ObjectMapper CANONICAL_JSON =
            new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private QueryFingerprint() {}

    /**
     * @param normalizedQuery token stream re-joined by {@code KqlLexer.normalize}
     * @param bindings values that change the result for the same text, e.g. the row cap
     */
    public static String of(String normalizedQuery, String orgId, Map<String, ?> bindings) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("query", normalizedQuery);
        node.put("orgId", orgId);
        node.set("bindings", CANONICAL_JSON.valueToTree(new TreeMap<>(bindings)));
        try {
            return sha256(CANONICAL_JSON.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonically encode query fingerprint", e);
        }
    }

    private static String sha256(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hashBytes.length * 2);
            for (byte b : hashBytes) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    sb.append('0');
                }
                sb.append(hex);
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
