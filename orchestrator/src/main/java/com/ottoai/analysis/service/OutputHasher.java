package com.ottoai.analysis.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Content hash of a job output, used to recognise a completion that carries
 * the same result twice.
 *
 * SHA-256 over canonical JSON: object keys sorted at every level, top-level
 * timestamps the service restamps on every delivery removed.
 */
@Component
public class OutputHasher {

    static final Set<String> VOLATILE_KEYS = Set.of("processed_at", "created_at", "analyzed_at", "timestamp");

    private final ObjectMapper canonical;

    public OutputHasher(ObjectMapper objectMapper) {
        this.canonical = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    /** Lowercase hex SHA-256 of the canonical form. A null output hashes like JSON null. */
    public String hash(JsonNode output) {
        Object value = output == null ? null : canonical.convertValue(output, Object.class);
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> stable = new LinkedHashMap<>(map);
            stable.keySet().removeIf(VOLATILE_KEYS::contains);
            value = stable;
        }
        try {
            byte[] bytes = canonical.writeValueAsBytes(value);
            return HexFormat.of().formatHex(sha256().digest(bytes));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Output is not serializable", e);
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
