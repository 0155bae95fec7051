package insight.engine.exec;

import java.util.List;

/**
 * Wildcard match of one string column against a {@link WildcardPattern}.
 */
public class StringMatchPredicate implements Predicate {
    private final int columnIndex;
    private final WildcardPattern pattern;

    public StringMatchPredicate(int columnIndex, WildcardPattern pattern) {
        this.columnIndex = columnIndex;
        this.pattern = pattern;
    }

    public static StringMatchPredicate forColumnName(List<String> columns, String columnName, WildcardPattern pattern) {
        int idx = columns.indexOf(columnName);
        if (idx < 0) throw new IllegalArgumentException("Column not found: " + columnName);
        return new StringMatchPredicate(idx, pattern);
    }

    @Override
    public boolean test(Row row) {
        Object v = row.values().get(columnIndex);
        return v instanceof String s && pattern.matches(s);
    }

    // For debugging
    @Override
    public String toString() { return "col[" + columnIndex + "] IS '" + pattern + "'"; }
}
