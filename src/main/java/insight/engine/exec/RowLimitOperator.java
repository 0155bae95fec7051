package insight.engine.exec;

import java.util.List;

import insight.engine.query.ResultTooLargeException;

/**
 * Pass-through operator that fails once its child produces more than maxRows rows.
 */
public class RowLimitOperator implements Operator {
    private final Operator child;
    private final int maxRows;
    private int produced;

    public RowLimitOperator(Operator child, int maxRows) {
        if (maxRows <= 0) throw new IllegalArgumentException("maxRows must be positive");
        this.child = child;
        this.maxRows = maxRows;
    }

    @Override
    public void open() {
        produced = 0;
        child.open();
    }

    @Override
    public Row next() {
        Row r = child.next();
        if (r != null && ++produced > maxRows) throw new ResultTooLargeException(maxRows);
        return r;
    }

    @Override
    public void close() { child.close(); }

    @Override
    public List<String> columns() { return child.columns(); }
}
