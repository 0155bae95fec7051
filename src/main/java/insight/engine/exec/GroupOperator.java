package insight.engine.exec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Blocking operator that partitions child rows by their group-field values and emits one
 * row per group, in order of each group's first appearance.
 * <p>
 * Group identity is the list of group-field values itself, so groups such as
 * ("ab","c") and ("a","bc") stay distinct.
 */
public class GroupOperator implements Operator {

    /**
     * One output column: either a group field echoed from the group key (accumulator == null)
     * or an aggregate of a source field.
     */
    public record Output(String name, String field, Supplier<Accumulator> accumulator) {
        public static Output key(String name, String field) { return new Output(name, field, null); }

        public static Output aggregate(String name, String field, Supplier<Accumulator> accumulator) {
            return new Output(name, field, accumulator);
        }

        public boolean isAggregate() { return accumulator != null; }
    }

    private final Operator child;
    private final List<String> groupFields;
    private final List<Output> outputs;
    private final List<String> outputColumns;

    private Iterator<Row> results;

    public GroupOperator(Operator child, List<String> groupFields, List<Output> outputs) {
        if (groupFields == null || groupFields.isEmpty()) throw new IllegalArgumentException("groupFields must be non-empty");
        for (Output o : outputs) {
            if (!o.isAggregate() && !groupFields.contains(o.field())) {
                throw new IllegalArgumentException("Output '" + o.name() + "' is neither a group field nor an aggregate");
            }
        }
        this.child = child;
        this.groupFields = List.copyOf(groupFields);
        this.outputs = List.copyOf(outputs);
        List<String> names = new ArrayList<>(outputs.size());
        for (Output o : outputs) names.add(o.name());
        this.outputColumns = List.copyOf(names);
    }

    @Override
    public void open() {
        child.open();
        List<String> childColumns = child.columns();
        int[] keyIdx = indexesOf(groupFields, childColumns);
        int[] srcIdx = new int[outputs.size()];
        for (int i = 0; i < outputs.size(); i++) {
            srcIdx[i] = indexOf(outputs.get(i).field(), childColumns);
        }

        Map<List<Object>, Accumulator[]> groups = new LinkedHashMap<>();
        Row r;
        while ((r = child.next()) != null) {
            List<Object> vals = r.values();
            List<Object> key = new ArrayList<>(keyIdx.length);
            for (int idx : keyIdx) key.add(vals.get(idx));
            Accumulator[] accs = groups.computeIfAbsent(key, k -> newAccumulators());
            for (int i = 0; i < outputs.size(); i++) {
                if (accs[i] != null) accs[i].add(vals.get(srcIdx[i]));
            }
        }

        List<Row> out = new ArrayList<>(groups.size());
        for (Map.Entry<List<Object>, Accumulator[]> e : groups.entrySet()) {
            List<Object> values = new ArrayList<>(outputs.size());
            for (int i = 0; i < outputs.size(); i++) {
                Output o = outputs.get(i);
                values.add(o.isAggregate() ? e.getValue()[i].result() : e.getKey().get(groupFields.indexOf(o.field())));
            }
            out.add(Row.of(outputColumns, values));
        }
        results = out.iterator();
    }

    @Override
    public Row next() {
        return results.hasNext() ? results.next() : null;
    }

    @Override
    public void close() {
        results = null;
        child.close();
    }

    @Override
    public List<String> columns() { return outputColumns; }

    private Accumulator[] newAccumulators() {
        Accumulator[] accs = new Accumulator[outputs.size()];
        for (int i = 0; i < outputs.size(); i++) {
            Output o = outputs.get(i);
            if (o.isAggregate()) accs[i] = o.accumulator().get();
        }
        return accs;
    }

    private static int[] indexesOf(List<String> names, List<String> columns) {
        int[] idxs = new int[names.size()];
        for (int i = 0; i < names.size(); i++) idxs[i] = indexOf(names.get(i), columns);
        return idxs;
    }

    private static int indexOf(String name, List<String> columns) {
        int idx = columns.indexOf(name);
        if (idx < 0) throw new IllegalArgumentException("Column not found in child: " + name);
        return idx;
    }
}
