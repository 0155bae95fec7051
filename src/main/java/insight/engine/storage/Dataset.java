package insight.engine.storage;

import java.util.List;

import insight.engine.catalog.DatasetKind;

// Immutable data carrier for a loaded dataset: id, kind and records in ingestion order.
public record Dataset(String id, DatasetKind kind, List<Record> records) {
    public Dataset {
        records = List.copyOf(records);
    }
}
