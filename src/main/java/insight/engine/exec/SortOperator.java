package insight.engine.exec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Blocking sort on a priority list of columns with one shared direction.
 * Numbers compare numerically, strings lexicographically; later keys break ties.
 * The sort is stable, so fully tied rows keep their input order in both directions.
 */
public class SortOperator implements Operator {
    private final Operator child;
    private final List<String> keys;
    private final boolean descending;

    private Iterator<Row> sorted;

    public SortOperator(Operator child, List<String> keys, boolean descending) {
        if (keys == null || keys.isEmpty()) throw new IllegalArgumentException("sort keys must be non-empty");
        this.child = child;
        this.keys = List.copyOf(keys);
        this.descending = descending;
    }

    @Override
    public void open() {
        child.open();
        List<Row> rows = new ArrayList<>();
        Row r;
        while ((r = child.next()) != null) rows.add(r);
        rows.sort(comparator(child.columns()));
        sorted = rows.iterator();
    }

    @Override
    public Row next() {
        return sorted.hasNext() ? sorted.next() : null;
    }

    @Override
    public void close() {
        sorted = null;
        child.close();
    }

    @Override
    public List<String> columns() { return child.columns(); }

    private Comparator<Row> comparator(List<String> columns) {
        int[] idxs = new int[keys.size()];
        for (int i = 0; i < keys.size(); i++) {
            idxs[i] = columns.indexOf(keys.get(i));
            if (idxs[i] < 0) throw new IllegalArgumentException("Sort key not in columns: " + keys.get(i));
        }
        Comparator<Row> cmp = (a, b) -> {
            for (int idx : idxs) {
                int c = compareValues(a.values().get(idx), b.values().get(idx));
                if (c != 0) return c;
            }
            return 0;
        };
        return descending ? cmp.reversed() : cmp;
    }

    static int compareValues(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) return Double.compare(x.doubleValue(), y.doubleValue());
        if (a instanceof String x && b instanceof String y) return x.compareTo(y);
        return String.valueOf(a).compareTo(String.valueOf(b));
    }
}
