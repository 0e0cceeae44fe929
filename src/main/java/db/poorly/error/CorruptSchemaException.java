package db.poorly.error;

/**
 * Persisted schema could not be read back. There is no partial recovery: the database
 * holding this schema cannot be opened.
 */
public class CorruptSchemaException extends IllegalStateException {
    private static final long serialVersionUID = -3409571320884617361L;

    public CorruptSchemaException(String message) {
        super(message);
    }

    public CorruptSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
