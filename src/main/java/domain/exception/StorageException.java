package domain.exception;

/** Writing the backing file failed. Fatal for the request, answered with 500. */
public class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
