package insight.engine.exec;

import java.util.Iterator;
import java.util.List;

import insight.engine.catalog.DatasetKind;
import insight.engine.storage.Record;

/**
 * Physical operator that performs a full scan of a dataset's records in ingestion order.
 * Produced rows carry the kind's unqualified field names.
 */
public class SeqScanOperator implements Operator {
    private final List<Record> records;
    private final List<String> columns;

    private Iterator<Record> iter;
    private boolean opened;

    public SeqScanOperator(List<Record> records, DatasetKind kind) {
        this.records = records;
        this.columns = List.copyOf(kind.fieldNames());
    }

    @Override
    public void open() {
        iter = records.iterator();
        opened = true;
    }

    @Override
    public Row next() {
        if (!opened) throw new IllegalStateException("Operator not opened");
        if (!iter.hasNext()) return null;
        return Row.of(columns, iter.next().values());
    }

    @Override
    public void close() {
        iter = null;
        opened = false;
    }

    @Override
    public List<String> columns() { return columns; }
}
