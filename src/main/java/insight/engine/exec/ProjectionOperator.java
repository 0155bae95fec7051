package insight.engine.exec;

import java.util.ArrayList;
import java.util.List;

/**
 * Projection operator: selects a subset of child columns and renames them to output names.
 * Column selection is by resolved source column name into the child's values list.
 */
public class ProjectionOperator implements Operator {
    private final Operator child;
    private final List<String> outputColumns;
    private final int[] columnIndexes; // indices to keep in output order

    public ProjectionOperator(Operator child, List<String> outputColumns, int[] columnIndexes) {
        if (outputColumns.size() != columnIndexes.length) throw new IllegalArgumentException("output names and indexes differ in size");
        this.child = child;
        this.outputColumns = List.copyOf(outputColumns);
        this.columnIndexes = columnIndexes;
    }

    /**
     * Build a ProjectionOperator by resolving source column names against the child's columns.
     * outputColumns.get(i) is the name under which sourceColumns.get(i) is emitted.
     */
    public static ProjectionOperator forColumnNames(Operator child, List<String> outputColumns, List<String> sourceColumns) {
        if (sourceColumns == null || sourceColumns.isEmpty()) throw new IllegalArgumentException("sourceColumns must be non-empty");
        List<String> childColumns = child.columns();
        int[] idxs = new int[sourceColumns.size()];
        for (int i = 0; i < sourceColumns.size(); i++) {
            int found = childColumns.indexOf(sourceColumns.get(i));
            if (found == -1) throw new IllegalArgumentException("Column not found in child: " + sourceColumns.get(i));
            idxs[i] = found;
        }
        return new ProjectionOperator(child, outputColumns, idxs);
    }

    @Override
    public void open() { child.open(); }

    @Override
    public Row next() {
        Row r = child.next();
        if (r == null) return null;
        List<Object> src = r.values();
        List<Object> projected = new ArrayList<>(columnIndexes.length);
        for (int idx : columnIndexes) {
            projected.add(src.get(idx));
        }
        return Row.of(outputColumns, projected);
    }

    @Override
    public void close() { child.close(); }

    @Override
    public List<String> columns() { return outputColumns; }
}
