package com.hybridrag.embedding;

public interface TextEncoder {
    float[] encode(String text);

    int dimension();

    default String version() {
        return "unversioned";
    }
}
