package com.hybridrag.store;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import com.hybridrag.error.ValidationException;

/**
 * Deterministic point ids. File-anchored chunks are keyed by {@code (path, lineStart)},
 * everything else by its normalised content. The {@code v1} prefix versions the scheme.
 */
public final class PointIds {
    private static final String SCHEME = "v1";

    private PointIds() {
    }

    public static long forFile(String filePath, int lineStart) {
        return fingerprint(SCHEME + "|file|" + PayloadFields.normalizePath(filePath) + ":" + lineStart);
    }

    public static long forContent(String content) {
        String normalized = content == null ? "" : content.strip().replaceAll("\\s+", " ");
        return fingerprint(SCHEME + "|content|" + normalized);
    }

    public static long forChunk(Chunk chunk) {
        if (chunk.isFileAnchored()) {
            return forFile(chunk.filePath(), chunk.lineStart());
        }
        return forContent(chunk.content());
    }

    public static long parse(Object raw) {
        if (raw instanceof Number number) {
            long id = exactLong(number);
            if (id < 0) {
                throw new ValidationException("vector_id must be non-negative: " + raw);
            }
            return id;
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return parse(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                throw new ValidationException("vector_id must be an integer or a decimal string: " + text);
            }
        }
        throw new ValidationException("vector_id is required");
    }

    private static long exactLong(Number number) {
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        try {
            return new BigDecimal(number.toString()).longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new ValidationException("vector_id must be an integer within the signed 64-bit range: " + number);
        }
    }

    static long fingerprint(String key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(key.getBytes(StandardCharsets.UTF_8));
            long value = 0L;
            for (int i = 0; i < 8; i++) {
                value = (value << 8) | (hash[i] & 0xFFL);
            }
            return value & Long.MAX_VALUE;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
