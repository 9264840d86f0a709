package com.hybridrag.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.error.SynthesisException;
import com.hybridrag.error.ValidationException;
import com.hybridrag.store.SearchResult;

/**
 * Builds an answer body from retrieved chunks, shaped by the query intent.
 */
public class AnswerSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(AnswerSynthesizer.class);
    private static final Pattern NUMBERED_ITEM = Pattern.compile("^(\\d+)\\.\\s+(.+)$", Pattern.MULTILINE);
    private static final int OVERLAP_WINDOW = 100;

    public String synthesize(List<SearchResult> chunks, QueryIntent intent, String query) {
        if (chunks == null || chunks.isEmpty()) {
            throw new ValidationException("Cannot synthesize answer from empty chunks");
        }
        try {
            switch (intent) {
                case ENUMERATION:
                    return enumeration(chunks);
                case EXPLANATION:
                    return explanation(chunks);
                case CODE_SEARCH:
                    return codeSearch(chunks);
                case COMPARISON:
                    return comparison(chunks);
                default:
                    return chunks.get(0).content();
            }
        } catch (RuntimeException e) {
            log.error("Synthesis failed for intent {}: {}", intent, e.getMessage());
            throw new SynthesisException("Answer synthesis failed: " + e.getMessage(), e);
        }
    }

    private String enumeration(List<SearchResult> chunks) {
        TreeMap<Long, String> items = new TreeMap<>();
        for (SearchResult chunk : chunks) {
            Matcher matcher = NUMBERED_ITEM.matcher(chunk.content());
            while (matcher.find()) {
                try {
                    items.put(Long.parseLong(matcher.group(1)), matcher.group(2).strip());
                } catch (NumberFormatException e) {
                    log.debug("Ignoring list number {}", matcher.group(1));
                }
            }
        }
        if (items.isEmpty()) {
            log.warn("No numbered items found, returning full content");
            return chunks.stream().map(SearchResult::content).collect(Collectors.joining("\n\n"));
        }
        if (items.lastKey() > items.size()) {
            log.warn("List may be incomplete: max number is {}, but only {} items found", items.lastKey(), items.size());
        }
        return items.entrySet().stream()
                .map(entry -> entry.getKey() + ". " + entry.getValue())
                .collect(Collectors.joining("\n"));
    }

    private String explanation(List<SearchResult> chunks) {
        List<SearchResult> ordered = chunks.stream()
                .sorted(Comparator.comparing(SearchResult::filePath).thenComparingInt(SearchResult::lineNumber))
                .toList();
        List<String> parts = new ArrayList<>();
        String last = "";
        for (SearchResult chunk : ordered) {
            String content = chunk.content();
            if (!last.isEmpty()) {
                String tail = last.substring(Math.max(0, last.length() - OVERLAP_WINDOW));
                if (content.startsWith(tail)) {
                    content = content.substring(Math.min(OVERLAP_WINDOW, last.length()));
                }
            }
            parts.add(content);
            last = content;
        }
        return parts.stream()
                .map(String::strip)
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining("\n\n"));
    }

    private String codeSearch(List<SearchResult> chunks) {
        Map<String, List<SearchResult>> byFile = new TreeMap<>();
        for (SearchResult chunk : chunks) {
            byFile.computeIfAbsent(chunk.filePath(), unused -> new ArrayList<>()).add(chunk);
        }
        List<String> sections = new ArrayList<>();
        byFile.forEach((file, fileChunks) -> {
            sections.add("**File: " + file + "**\n");
            fileChunks.stream()
                    .sorted(Comparator.comparingInt(SearchResult::lineNumber))
                    .forEach(chunk -> {
                        sections.add("Lines " + chunk.lineNumber() + ":");
                        sections.add("```\n" + chunk.content() + "\n```\n");
                    });
        });
        return String.join("\n", sections);
    }

    private String comparison(List<SearchResult> chunks) {
        Map<String, List<SearchResult>> bySection = new TreeMap<>();
        for (SearchResult chunk : chunks) {
            String section = chunk.section() == null ? "Other" : chunk.section();
            bySection.computeIfAbsent(section, unused -> new ArrayList<>()).add(chunk);
        }
        List<String> parts = new ArrayList<>();
        bySection.forEach((section, sectionChunks) -> {
            parts.add("## " + section + "\n");
            for (SearchResult chunk : sectionChunks) {
                parts.add(chunk.content());
                parts.add("");
            }
        });
        return String.join("\n", parts);
    }
}
