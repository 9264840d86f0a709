package com.hybridrag.ingest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import com.hybridrag.store.Chunk;
import com.hybridrag.store.ContentType;
import com.hybridrag.store.PayloadFields;

/**
 * Splits Markdown by {@code ## } sections, then by size. Numbered lists and tables get
 * twice the size budget so they usually stay in one chunk.
 */
public class MarkdownChunker {
    static final String DEFAULT_SECTION = "Introduction";
    private static final Pattern NUMBERED_ITEM = Pattern.compile("^\\d+\\.\\s+.*");

    private final int chunkSize;
    private final int overlapLines;

    public MarkdownChunker(int chunkSize, int overlapLines) {
        this.chunkSize = chunkSize;
        this.overlapLines = overlapLines;
    }

    public List<Chunk> chunk(String filePath, String content) {
        String[] lines = content.split("\\R", -1);
        String docType = docType(filePath);
        List<Chunk> chunks = new ArrayList<>();

        List<String> current = new ArrayList<>();
        int currentChars = 0;
        String section = DEFAULT_SECTION;
        int lineStart = 1;

        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i];
            if (line.startsWith("## ")) {
                emit(chunks, current, lineStart, section, filePath, docType);
                current = new ArrayList<>();
                current.add(line);
                currentChars = line.length();
                section = line.substring(3).trim();
                lineStart = lineNumber;
                continue;
            }
            current.add(line);
            currentChars += line.length() + 1;
            int budget = isStructured(current) ? chunkSize * 2 : chunkSize;
            if (currentChars > budget && current.size() > overlapLines + 1) {
                int keep = Math.max(overlapLines, 0);
                List<String> head = new ArrayList<>(current.subList(0, current.size() - keep));
                emit(chunks, head, lineStart, section, filePath, docType);
                current = new ArrayList<>(current.subList(current.size() - keep, current.size()));
                currentChars = current.stream().mapToInt(text -> text.length() + 1).sum();
                lineStart = lineNumber - keep + 1;
            }
        }
        emit(chunks, current, lineStart, section, filePath, docType);
        return chunks;
    }

    private void emit(List<Chunk> chunks, List<String> lines, int lineStart, String section, String filePath,
            String docType) {
        String text = String.join("\n", lines);
        if (text.isBlank()) {
            return;
        }
        int lineEnd = lineStart + lines.size() - 1;
        Map<String, Object> metadata = new HashMap<>();
        ContentType contentType;
        int listStart = firstBodyLine(lines);
        if (listStart >= 0 && isNumberedItem(lines.get(listStart))) {
            contentType = ContentType.LIST;
            metadata.put("list_length", listLength(lines, listStart));
        } else if (lines.stream().anyMatch(line -> line.contains("|"))) {
            contentType = ContentType.TABLE;
        } else if (lines.stream().anyMatch(line -> line.strip().startsWith("```"))) {
            contentType = ContentType.CODE;
        } else {
            contentType = ContentType.TEXT;
        }
        metadata.put("is_complete", contentType != ContentType.TEXT);
        chunks.add(new Chunk(text, filePath, lineStart, lineEnd, section, contentType, docType, null, null,
                metadata, false));
    }

    private static boolean isStructured(List<String> lines) {
        int start = firstBodyLine(lines);
        if (start >= 0 && isNumberedItem(lines.get(start))) {
            return true;
        }
        return lines.stream().anyMatch(line -> line.contains("|"));
    }

    private static int firstBodyLine(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (!line.isEmpty() && !line.startsWith("#")) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isNumberedItem(String line) {
        return NUMBERED_ITEM.matcher(line.strip()).matches();
    }

    private static int listLength(List<String> lines, int start) {
        int count = 0;
        for (int i = start; i < lines.size() && isNumberedItem(lines.get(i)); i++) {
            count++;
        }
        return count;
    }

    static String docType(String filePath) {
        String path = PayloadFields.normalizePath(filePath).toLowerCase(Locale.ROOT);
        if (path.contains("policy") || path.contains("policies")) {
            return "policy";
        }
        if (path.contains("sdlc") || path.contains("software-development-life-cycle")) {
            return "sdlc";
        }
        if (path.contains("flow")) {
            return "flow";
        }
        if (path.contains("infrastructure") || path.contains("/infra/")) {
            return "infrastructure";
        }
        if (path.contains("decision") || path.contains("adr") || path.contains("discussion")) {
            return "decision";
        }
        return "other";
    }
}
