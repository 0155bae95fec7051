package insight.engine.exec;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator that filters rows from its child based on a Predicate.
 * Pulls rows until one matches or child is exhausted; counts what it saw for diagnostics.
 */
public class FilterOperator implements Operator {
    private static final Logger log = LoggerFactory.getLogger(FilterOperator.class);

    private final Operator child;
    private final Predicate predicate;
    private long examined;
    private long accepted;

    public FilterOperator(Operator child, Predicate predicate) {
        if (predicate == null) throw new IllegalArgumentException("predicate must not be null");
        this.child = child;
        this.predicate = predicate;
    }

    @Override
    public void open() {
        examined = 0;
        accepted = 0;
        child.open();
    }

    @Override
    public Row next() {
        Row r;
        while ((r = child.next()) != null) {
            examined++;
            if (predicate.test(r)) {
                accepted++;
                return r;
            }
        }
        return null;
    }

    @Override
    public void close() {
        log.debug("Filter {} examined {} rows, accepted {}", predicate, examined, accepted);
        child.close();
    }

    @Override
    public List<String> columns() { return child.columns(); }

    public long examined() { return examined; }
    public long accepted() { return accepted; }
}
