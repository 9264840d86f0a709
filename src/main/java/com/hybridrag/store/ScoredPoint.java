package com.hybridrag.store;

public record ScoredPoint(Point point, float score) {
}
