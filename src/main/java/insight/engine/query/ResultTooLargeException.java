package insight.engine.query;

/**
 * Raised when a query produces more rows than the engine's limit.
 * Checked after grouping and before sorting; no rows are returned.
 */
public class ResultTooLargeException extends QueryException {
    private final int limit;

    public ResultTooLargeException(int limit) {
        super("Query result exceeds " + limit + " rows");
        this.limit = limit;
    }

    public int limit() { return limit; }
}
