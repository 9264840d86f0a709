package com.hybridrag.retrieval;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Fraction of distinct query terms that occur in a chunk. Used as the lexical half of
 * the hybrid score.
 */
public final class KeywordScorer {
    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "do", "does", "for", "from", "how", "in", "is", "it",
            "me", "of", "on", "or", "the", "this", "to", "what", "when", "where", "which", "who", "why", "with");

    private KeywordScorer() {
    }

    public static float score(String query, String content) {
        Set<String> terms = terms(query);
        if (terms.isEmpty() || content == null || content.isBlank()) {
            return 0f;
        }
        Set<String> contentTokens = new HashSet<>(tokens(content));
        long hits = terms.stream().filter(contentTokens::contains).count();
        return (float) hits / terms.size();
    }

    public static Set<String> terms(String query) {
        Set<String> terms = new LinkedHashSet<>();
        for (String token : tokens(query)) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                terms.add(token);
            }
        }
        return terms;
    }

    private static Set<String> tokens(String text) {
        Set<String> out = new LinkedHashSet<>();
        if (text == null) {
            return out;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9_]+")) {
            if (!token.isBlank()) {
                out.add(token);
            }
        }
        return out;
    }
}
