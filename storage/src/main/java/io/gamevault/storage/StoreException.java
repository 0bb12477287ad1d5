package io.gamevault.storage;

/**
 * Failure while reading from or writing to a durable store.
 * <p>
 * Propagated to callers unchanged: this layer never retries.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
