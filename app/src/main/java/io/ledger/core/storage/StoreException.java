package io.ledger.core.storage;

/** Any failure raised by a {@link KeyValueStore} backend. */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
