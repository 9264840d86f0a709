package com.hybridrag.store;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.hybridrag.embedding.ContentCategory;

/**
 * A contiguous slice of a corpus file. The typed fields are the ones retrieval logic
 * reads; {@code metadata} is the open extension bag written alongside them.
 */
public record Chunk(
        String content,
        String filePath,
        int lineStart,
        int lineEnd,
        String section,
        ContentType contentType,
        String docType,
        String codeType,
        String language,
        Map<String, Object> metadata,
        boolean deleted) {

    public Chunk {
        filePath = PayloadFields.normalizePath(filePath);
        contentType = contentType == null ? ContentType.TEXT : contentType;
        metadata = metadata == null ? Map.of() : Map.copyOf(withoutNulls(metadata));
    }

    public static Chunk doc(String filePath, int lineStart, int lineEnd, String section, ContentType contentType,
            String content) {
        return new Chunk(content, filePath, lineStart, lineEnd, section, contentType, null, null, null, Map.of(), false);
    }

    public static Chunk code(String filePath, int lineStart, int lineEnd, String language, String codeType,
            String content) {
        return new Chunk(content, filePath, lineStart, lineEnd, null, ContentType.CODE, null, codeType, language,
                Map.of(), false);
    }

    public boolean isFileAnchored() {
        return filePath != null && !filePath.isBlank();
    }

    public ContentCategory category() {
        return language != null && !language.isBlank() ? ContentCategory.CODE : ContentCategory.DOC;
    }

    public Chunk withContent(String newContent) {
        return new Chunk(newContent, filePath, lineStart, lineEnd, section, contentType, docType, codeType, language,
                metadata, deleted);
    }

    public Chunk withFilePath(String newFilePath) {
        return new Chunk(content, newFilePath, lineStart, lineEnd, section, contentType, docType, codeType, language,
                metadata, deleted);
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>(metadata);
        payload.put(PayloadFields.CONTENT, content);
        payload.put(PayloadFields.FILE_PATH, filePath);
        payload.put(PayloadFields.LINE_START, lineStart);
        payload.put(PayloadFields.LINE_END, lineEnd);
        payload.put(PayloadFields.CONTENT_TYPE, contentType.label());
        putIfPresent(payload, PayloadFields.SECTION, section);
        putIfPresent(payload, PayloadFields.DOC_TYPE, docType);
        putIfPresent(payload, PayloadFields.CODE_TYPE, codeType);
        putIfPresent(payload, PayloadFields.LANGUAGE, language);
        payload.put(PayloadFields.IS_DELETED, deleted);
        return payload;
    }

    public static Chunk fromPayload(Map<String, Object> payload) {
        Map<String, Object> extra = new HashMap<>(payload);
        extra.keySet().removeAll(PayloadFields.CORE_FIELDS);
        return new Chunk(
                PayloadFields.string(payload, PayloadFields.CONTENT),
                PayloadFields.string(payload, PayloadFields.FILE_PATH),
                PayloadFields.integer(payload, PayloadFields.LINE_START),
                PayloadFields.integer(payload, PayloadFields.LINE_END),
                nullIfBlank(PayloadFields.string(payload, PayloadFields.SECTION)),
                ContentType.fromLabel(payload.get(PayloadFields.CONTENT_TYPE)),
                nullIfBlank(PayloadFields.string(payload, PayloadFields.DOC_TYPE)),
                nullIfBlank(PayloadFields.string(payload, PayloadFields.CODE_TYPE)),
                nullIfBlank(PayloadFields.string(payload, PayloadFields.LANGUAGE)),
                extra,
                PayloadFields.isDeleted(payload));
    }

    private static void putIfPresent(Map<String, Object> payload, String key, String value) {
        if (value != null && !value.isBlank()) {
            payload.put(key, value);
        }
    }

    private static String nullIfBlank(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> source) {
        Map<String, Object> copy = new HashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }
}
