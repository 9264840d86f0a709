package com.hybridrag.store;

import java.util.Map;
import java.util.Set;

/**
 * Payload keys shared by the write path (indexer, CRUD) and the read path (search, lifecycle).
 */
public final class PayloadFields {
    public static final String CONTENT = "content";
    public static final String FILE_PATH = "file_path";
    public static final String LINE_START = "line_start";
    public static final String LINE_END = "line_end";
    public static final String SECTION = "section";
    public static final String CONTENT_TYPE = "content_type";
    public static final String DOC_TYPE = "doc_type";
    public static final String CODE_TYPE = "code_type";
    public static final String LANGUAGE = "language";
    public static final String IS_DELETED = "is_deleted";
    public static final String RERANK_SCORE = "rerank_score";

    /** Keyword-indexed on the remote backend. */
    public static final Set<String> INDEXED_FIELDS = Set.of(FILE_PATH, SECTION, LANGUAGE, CONTENT_TYPE);

    static final Set<String> CORE_FIELDS = Set.of(CONTENT, FILE_PATH, LINE_START, LINE_END, SECTION,
            CONTENT_TYPE, DOC_TYPE, CODE_TYPE, LANGUAGE, IS_DELETED);

    private PayloadFields() {
    }

    public static String normalizePath(String path) {
        return path == null ? "" : path.replace('\\', '/');
    }

    public static String string(Map<String, Object> payload, String key) {
        Object value = payload == null ? null : payload.get(key);
        return value == null ? "" : value.toString();
    }

    public static int integer(Map<String, Object> payload, String key) {
        Object value = payload == null ? null : payload.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    public static boolean isDeleted(Map<String, Object> payload) {
        Object value = payload == null ? null : payload.get(IS_DELETED);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public static String mergeKey(long id, Map<String, Object> payload) {
        String filePath = normalizePath(string(payload, FILE_PATH));
        if (filePath.isBlank()) {
            return "id:" + id;
        }
        return filePath + ":" + integer(payload, LINE_START);
    }
}
