package insight.engine.storage;

import java.util.List;

import insight.engine.catalog.DatasetKind;

/**
 * Immutable dataset row with a fixed schema.
 * {@link #values()} is ordered by {@link DatasetKind#fields()} of {@link #kind()};
 * numeric fields hold {@link Number}s, string fields hold {@link String}s.
 */
public interface Record {
    DatasetKind kind();

    List<Object> values();

    default Object get(String field) {
        int idx = kind().indexOf(field);
        if (idx < 0) throw new IllegalArgumentException("Field '" + field + "' not declared for " + kind());
        return values().get(idx);
    }

    /** Narrows a numeric value to int; fractional or out-of-range values are rejected. */
    static int toInt(Object value) {
        double d = ((Number) value).doubleValue();
        if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Expected an integer but got " + value);
        }
        return (int) d;
    }
}
