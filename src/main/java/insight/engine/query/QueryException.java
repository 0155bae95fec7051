package insight.engine.query;

/**
 * Base type for query failures. Callers branch on the concrete subtype
 * ({@link QueryValidationException} or {@link ResultTooLargeException}), not on the message.
 */
public abstract class QueryException extends RuntimeException {
    protected QueryException(String message) {
        super(message);
    }

    protected QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
