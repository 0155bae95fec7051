package insight.engine.storage;

import insight.engine.catalog.DatasetKind;

// Listing entry for a held dataset.
public record DatasetInfo(String id, DatasetKind kind, int numRows) {}
