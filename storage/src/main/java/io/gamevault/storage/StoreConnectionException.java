package io.gamevault.storage;

/** The store could not be opened or authenticated at connect time. */
public class StoreConnectionException extends StoreException {

    public StoreConnectionException(String message) {
        super(message);
    }

    public StoreConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
