package io.tierkeeper.storage;

/**
 * The metadata store could not be reached, timed out on a lock, or has an unusable schema.
 * Callers abort the current step and retry on the next cycle.
 */
public final class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
