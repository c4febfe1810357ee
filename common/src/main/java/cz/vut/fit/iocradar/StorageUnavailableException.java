package cz.vut.fit.iocradar;

/**
 * Signals that the persistence backend could not be reached or failed to complete an operation.
 */
public class StorageUnavailableException extends Exception {
    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
