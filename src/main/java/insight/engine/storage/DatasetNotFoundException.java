package insight.engine.storage;

/**
 * Raised when an operation names a dataset id the store does not hold.
 */
public class DatasetNotFoundException extends RuntimeException {
    public DatasetNotFoundException(String message) {
        super(message);
    }
}
