package insight.engine.exec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row is the execution pipeline unit: column names plus values in the same order.
 * Scan rows carry the dataset's unqualified field names; projected and grouped rows
 * carry the query's output column names.
 */
public class Row {
    private final List<String> columns;
    private final List<Object> values;

    public static Row of(List<String> columns, List<Object> values) { return new Row(columns, values); }

    public Row(List<String> columns, List<Object> values) {
        if (columns.size() != values.size()) {
            throw new IllegalArgumentException("Row has " + columns.size() + " columns but " + values.size() + " values");
        }
        this.columns = columns;
        this.values = values;
    }

    public List<String> columns() { return columns; }
    public List<Object> values() { return values; }

    public int indexOf(String column) { return columns.indexOf(column); }

    public Object get(String column) {
        int idx = columns.indexOf(column);
        if (idx < 0) throw new IllegalArgumentException("Column not in row: " + column);
        return values.get(idx);
    }

    /** Column name to value, in column order. */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) m.put(columns.get(i), values.get(i));
        return m;
    }

    @Override
    public String toString() {
        return "Row" + toMap();
    }
}
