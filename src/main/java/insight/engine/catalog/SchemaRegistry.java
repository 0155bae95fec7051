package insight.engine.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps dataset ids to their kind. In-memory only; the owning store
 * serializes mutation against reads.
 */
public class SchemaRegistry {
    private final Map<String, DatasetKind> kinds = new LinkedHashMap<>();

    /** Returns false if the id is already registered. */
    public boolean register(String datasetId, DatasetKind kind) {
        if (datasetId == null || kind == null) throw new IllegalArgumentException("datasetId and kind must not be null");
        if (kinds.containsKey(datasetId)) return false;
        kinds.put(datasetId, kind);
        return true;
    }

    public boolean unregister(String datasetId) {
        return kinds.remove(datasetId) != null;
    }

    /** Kind of the dataset, or null when the id is not registered. */
    public DatasetKind kindOf(String datasetId) {
        return kinds.get(datasetId);
    }

    public boolean contains(String datasetId) { return kinds.containsKey(datasetId); }

    public Set<String> datasetIds() { return Collections.unmodifiableSet(kinds.keySet()); }
}
