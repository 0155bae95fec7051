package insight.engine.storage;

import java.util.List;

/**
 * Read access to dataset records by id.
 */
public interface DatasetSource {
    /** Records of the dataset in ingestion order, or null if no such dataset exists. */
    List<Record> recordsOf(String datasetId);
}
