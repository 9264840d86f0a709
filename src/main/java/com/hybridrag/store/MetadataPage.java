package com.hybridrag.store;

import java.util.List;

public record MetadataPage(List<StoredPoint> results, int limit, long offset, boolean filteredInProcess) {
}
