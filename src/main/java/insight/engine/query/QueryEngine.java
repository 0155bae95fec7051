package insight.engine.query;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import insight.engine.exec.Operator;
import insight.engine.exec.Row;
import insight.engine.storage.DatasetSource;
import insight.engine.storage.Record;

/**
 * Executes a validated QueryPlan against a dataset source.
 * Holds no per-query state: each call binds, plans and drains a fresh pipeline.
 */
public class QueryEngine {
    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    public static final int DEFAULT_MAX_ROWS = 5000;

    private final QueryPlanner planner = new QueryPlanner(new PredicateCompiler());
    private final QueryExecutor executor = new QueryExecutor();
    private final int maxRows;

    public QueryEngine() {
        this(DEFAULT_MAX_ROWS);
    }

    public QueryEngine(int maxRows) {
        if (maxRows <= 0) throw new IllegalArgumentException("maxRows must be positive");
        this.maxRows = maxRows;
    }

    /**
     * @throws QueryValidationException if the plan's dataset is not held by the source
     * @throws ResultTooLargeException if more than maxRows rows are produced before sorting
     */
    public List<Row> execute(QueryPlan plan, DatasetSource source) {
        List<Record> records = source.recordsOf(plan.datasetId());
        if (records == null) throw new QueryValidationException("Dataset not found: '" + plan.datasetId() + "'");
        Operator root = planner.plan(plan, records, maxRows);
        List<Row> rows = executor.collect(root);
        log.debug("Query on '{}' scanned {} records, returned {} rows", plan.datasetId(), records.size(), rows.size());
        return rows;
    }

    public int maxRows() { return maxRows; }
}
