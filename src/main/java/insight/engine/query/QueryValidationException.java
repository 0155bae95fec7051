package insight.engine.query;

/**
 * Raised when a query document is structurally or semantically invalid,
 * including references to datasets that are not registered.
 */
public class QueryValidationException extends QueryException {
    public QueryValidationException(String message) {
        super(message);
    }

    public QueryValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
