package insight.engine.storage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import insight.engine.catalog.DatasetKind;
import insight.engine.catalog.SchemaRegistry;

/**
 * In-memory holder of datasets. Keeps the {@link SchemaRegistry} in step with
 * the held datasets. Add/remove take the write lock; queries run through
 * {@link #read(Supplier)} under the read lock, so many queries may run at once
 * but never alongside a mutation.
 */
public class DatasetStore implements DatasetSource {
    private static final Logger log = LoggerFactory.getLogger(DatasetStore.class);

    private final SchemaRegistry registry;
    private final Map<String, Dataset> datasets = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public DatasetStore() {
        this(new SchemaRegistry());
    }

    public DatasetStore(SchemaRegistry registry) {
        this.registry = registry;
    }

    /**
     * Adds a dataset and returns the ids of all held datasets.
     * Rejects blank ids, ids containing the qualifier separator, duplicates and empty record lists.
     */
    public List<String> addDataset(String id, DatasetKind kind, List<? extends Record> records) {
        checkId(id);
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        if (records == null || records.isEmpty()) throw new IllegalArgumentException("Dataset '" + id + "' has no records");
        for (Record r : records) {
            if (r.kind() != kind) throw new IllegalArgumentException("Dataset '" + id + "' of kind " + kind + " contains a " + r.kind() + " record");
        }
        lock.writeLock().lock();
        try {
            if (datasets.containsKey(id)) throw new IllegalArgumentException("Dataset already exists: " + id);
            datasets.put(id, new Dataset(id, kind, new ArrayList<>(records)));
            registry.register(id, kind);
            log.info("Added dataset '{}' ({}, {} records)", id, kind.label(), records.size());
            return new ArrayList<>(datasets.keySet());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<String> addDataset(Dataset dataset) {
        return addDataset(dataset.id(), dataset.kind(), dataset.records());
    }

    /** Removes a dataset and returns its id. */
    public String removeDataset(String id) {
        checkId(id);
        lock.writeLock().lock();
        try {
            if (datasets.remove(id) == null) throw new DatasetNotFoundException("Dataset not found: " + id);
            registry.unregister(id);
            log.info("Removed dataset '{}'", id);
            return id;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<DatasetInfo> listDatasets() {
        lock.readLock().lock();
        try {
            List<DatasetInfo> out = new ArrayList<>(datasets.size());
            for (Dataset d : datasets.values()) out.add(new DatasetInfo(d.id(), d.kind(), d.records().size()));
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Record> recordsOf(String datasetId) {
        lock.readLock().lock();
        try {
            Dataset d = datasets.get(datasetId);
            return d == null ? null : d.records();
        } finally {
            lock.readLock().unlock();
        }
    }

    public SchemaRegistry registry() { return registry; }

    /** Runs the action under the read lock; mutations wait until it returns. */
    public <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static void checkId(String id) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Dataset id must not be blank");
        if (id.contains("_")) throw new IllegalArgumentException("Dataset id must not contain '_': " + id);
    }
}
