package com.hybridrag.retrieval;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.embedding.ContentCategory;
import com.hybridrag.error.ValidationException;

/**
 * Rule-based intent classifier. Pattern groups are tried in priority order
 * enumeration, code search, comparison, explanation; anything else is factual.
 */
public class QueryAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(QueryAnalyzer.class);

    static final List<Pattern> ENUMERATION_PATTERNS = compile(
            "\\blist\\s+all\\b",
            "\\bhow\\s+many\\b",
            "\\bwhat\\s+are\\s+all\\b",
            "\\benumerate\\b",
            "\\bshow\\s+me\\s+all\\b",
            "\\bcomplete\\s+list\\b",
            "\\ball\\s+of\\s+the\\b",
            "\\bgive\\s+me\\s+all\\b");

    static final List<Pattern> CODE_SEARCH_PATTERNS = compile(
            "\\bshow\\s+me.*code\\b",
            "\\bfind.*function\\b",
            "\\bwhere\\s+is.*implementation\\b",
            "\\bcode\\s+for\\b",
            "\\bfind.*method\\b",
            "\\bimplementation\\s+of\\b",
            "\\bhow\\s+.*is.*implemented\\b",
            "\\bclass.*definition\\b",
            "\\bfunction.*signature\\b");

    static final List<Pattern> COMPARISON_PATTERNS = compile(
            "\\bdifference\\s+between\\b",
            "\\bcompare\\b",
            "\\bvs\\.",
            "\\bversus\\b",
            "\\bvs\\b",
            "\\bwhat\\s+is\\s+different\\b",
            "\\bsimilarities\\s+and\\s+differences\\b");

    static final List<Pattern> EXPLANATION_PATTERNS = compile(
            "\\bwhat\\s+is\\b",
            "\\bexplain\\b",
            "\\bhow\\s+does\\b",
            "\\bwhy\\b",
            "\\bdescribe\\b",
            "\\bwhat\\s+does\\b",
            "\\btell\\s+me\\s+about\\b",
            "\\bwhat\\s+are\\s+the\\b");

    public QueryAnalysis analyze(String query) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Query cannot be empty");
        }
        String lower = query.toLowerCase(Locale.ROOT);

        int matches = countMatches(lower, ENUMERATION_PATTERNS);
        if (matches > 0) {
            return create(QueryIntent.ENUMERATION, 0.9 + matches * 0.05, keywords(lower, ENUMERATION_PATTERNS),
                    List.of(ContentCategory.DOC), true);
        }
        matches = countMatches(lower, CODE_SEARCH_PATTERNS);
        if (matches > 0) {
            return create(QueryIntent.CODE_SEARCH, 0.9 + matches * 0.05, keywords(lower, CODE_SEARCH_PATTERNS),
                    List.of(ContentCategory.CODE, ContentCategory.DOC), false);
        }
        matches = countMatches(lower, COMPARISON_PATTERNS);
        if (matches > 0) {
            return create(QueryIntent.COMPARISON, 0.85 + matches * 0.05, keywords(lower, COMPARISON_PATTERNS),
                    List.of(ContentCategory.DOC, ContentCategory.CODE), true);
        }
        matches = countMatches(lower, EXPLANATION_PATTERNS);
        if (matches > 0) {
            return create(QueryIntent.EXPLANATION, 0.8 + matches * 0.05, keywords(lower, EXPLANATION_PATTERNS),
                    List.of(ContentCategory.DOC), true);
        }
        return create(QueryIntent.FACTUAL, 0.5, List.of(),
                List.of(ContentCategory.DOC, ContentCategory.CODE), false);
    }

    private QueryAnalysis create(QueryIntent intent, double confidence, List<String> keywords,
            List<ContentCategory> contentTypes, boolean needsExpansion) {
        QueryAnalysis analysis = new QueryAnalysis(intent, Math.min(1.0, confidence), keywords, contentTypes,
                needsExpansion, true);
        log.debug("Query intent={} confidence={} keywords={}", intent.label(),
                String.format(Locale.ROOT, "%.2f", analysis.confidence()), keywords);
        return analysis;
    }

    private static int countMatches(String text, List<Pattern> patterns) {
        int count = 0;
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                count++;
            }
        }
        return count;
    }

    private static List<String> keywords(String text, List<Pattern> patterns) {
        Set<String> found = new LinkedHashSet<>();
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                found.add(matcher.group());
            }
        }
        return new ArrayList<>(found);
    }

    private static List<Pattern> compile(String... expressions) {
        List<Pattern> patterns = new ArrayList<>();
        for (String expression : expressions) {
            patterns.add(Pattern.compile(expression, Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(patterns);
    }
}
