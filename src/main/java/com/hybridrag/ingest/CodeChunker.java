package com.hybridrag.ingest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hybridrag.store.Chunk;
import com.hybridrag.store.ContentType;

public class CodeChunker {
    private static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry("java", "java"),
            Map.entry("kt", "kotlin"),
            Map.entry("py", "python"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("go", "go"),
            Map.entry("rs", "rust"),
            Map.entry("cs", "csharp"),
            Map.entry("rb", "ruby"));
    private static final Pattern DECLARATION = Pattern.compile(
            "\\b(class|interface|enum|record|def|function|fun|func|fn|struct|trait)\\s+([A-Za-z_][A-Za-z0-9_]*)");
    private static final int MAX_IMPORTS = 10;

    private final int maxLines;
    private final int overlapLines;

    public CodeChunker(int maxLines, int overlapLines) {
        this.maxLines = maxLines;
        this.overlapLines = overlapLines;
    }

    public List<Chunk> chunk(String filePath, String content) {
        String[] lines = content.split("\\R", -1);
        String language = languageOf(filePath);
        List<String> imports = imports(lines);
        List<Chunk> chunks = new ArrayList<>();

        int start = 0;
        while (start < lines.length) {
            int endExclusive = Math.min(lines.length, start + maxLines);
            String text = String.join("\n", Arrays.copyOfRange(lines, start, endExclusive));
            if (!text.isBlank()) {
                Map<String, Object> metadata = new HashMap<>();
                String codeType = "block";
                Matcher declaration = DECLARATION.matcher(text);
                if (declaration.find()) {
                    codeType = codeType(declaration.group(1));
                    metadata.put("name", declaration.group(2));
                }
                if (!imports.isEmpty()) {
                    metadata.put("imports", imports);
                }
                chunks.add(new Chunk(text, filePath, start + 1, endExclusive, null, ContentType.CODE, null, codeType,
                        language, metadata, false));
            }
            if (endExclusive == lines.length) {
                break;
            }
            start = Math.max(endExclusive - overlapLines, start + 1);
        }
        return chunks;
    }

    static String languageOf(String filePath) {
        int dot = filePath.lastIndexOf('.');
        if (dot < 0) {
            return "unknown";
        }
        return LANGUAGES.getOrDefault(filePath.substring(dot + 1).toLowerCase(Locale.ROOT), "unknown");
    }

    private static String codeType(String keyword) {
        switch (keyword) {
            case "def":
            case "function":
            case "fun":
            case "func":
            case "fn":
                return "function";
            default:
                return keyword;
        }
    }

    private static List<String> imports(String[] lines) {
        List<String> imports = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.strip();
            if (trimmed.startsWith("import ") || trimmed.startsWith("from ") || trimmed.startsWith("require(")
                    || trimmed.startsWith("using ")) {
                imports.add(trimmed);
                if (imports.size() == MAX_IMPORTS) {
                    break;
                }
            }
        }
        return imports;
    }
}
