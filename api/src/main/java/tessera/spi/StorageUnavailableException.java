package tessera.spi;

/**
 * Storage backend could not be reached or did not answer in time.
 *
 * <p>Transient. A caller may retry a whole login, but a refresh must not be
 * replayed automatically: the first attempt may already have rotated the token,
 * and a replay would then be treated as reuse.
 */
public class StorageUnavailableException extends RuntimeException {

    private final String operation;

    public StorageUnavailableException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public StorageUnavailableException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /** Returns the storage operation that failed. */
    public String getOperation() {
        return operation;
    }
}
