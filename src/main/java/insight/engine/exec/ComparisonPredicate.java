package insight.engine.exec;

import java.util.List;

/**
 * Numeric comparison of one column against a literal.
 * GT and LT are strict; EQ is exact numeric equality.
 */
public class ComparisonPredicate implements Predicate {
    public enum Op { GT, LT, EQ }

    private final int columnIndex;
    private final Op op;
    private final double value;

    public ComparisonPredicate(int columnIndex, Op op, double value) {
        this.columnIndex = columnIndex;
        this.op = op;
        this.value = value;
    }

    public static ComparisonPredicate forColumnName(List<String> columns, String columnName, Op op, double value) {
        int idx = columns.indexOf(columnName);
        if (idx < 0) throw new IllegalArgumentException("Column not found: " + columnName);
        return new ComparisonPredicate(idx, op, value);
    }

    @Override
    public boolean test(Row row) {
        double v = ((Number) row.values().get(columnIndex)).doubleValue();
        return switch (op) {
            case GT -> v > value;
            case LT -> v < value;
            case EQ -> v == value;
        };
    }

    // For debugging
    @Override
    public String toString() { return "col[" + columnIndex + "] " + op + " " + value; }
}
