package com.hybridrag.retrieval;

import java.util.Locale;

public enum QueryIntent {
    ENUMERATION,
    EXPLANATION,
    CODE_SEARCH,
    COMPARISON,
    FACTUAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
