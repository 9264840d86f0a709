package com.hybridrag.store;

import java.util.List;

/**
 * One page of a filtered scan. {@code nextOffset} is the cursor for the following page,
 * or null when the scan is exhausted.
 */
public record ScanPage(List<Point> points, Long nextOffset) {
}
