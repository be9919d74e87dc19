package turkey.spi;

/**
 * Exception thrown when a storage backend cannot be initialized or fails an operation
 * in a way the caller cannot recover from.
 */
public class StorageProviderException extends RuntimeException {

    public StorageProviderException(String message) {
        super(message);
    }

    public StorageProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
