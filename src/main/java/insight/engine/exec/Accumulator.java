package insight.engine.exec;

/**
 * Per-group aggregation state. One instance per (group, output column).
 */
public interface Accumulator {
    void add(Object value);

    Object result();
}
