package io.ledger.core.storage;

import java.util.Optional;

/**
 * Atomic unit of work against a {@link KeyValueStore}.
 *
 * Reads see committed data plus this transaction's own writes. Nothing written here is visible
 * to other readers until {@link #commit()} returns. Closing a transaction that was not committed
 * rolls it back.
 */
public interface StoreTransaction extends AutoCloseable {

    Optional<byte[]> get(Table table, byte[] key);

    /**
     * Read a key and hold an exclusive lock on it until this transaction ends. Concurrent
     * transactions asking for the same key wait (up to the store's lock timeout).
     */
    Optional<byte[]> getForUpdate(Table table, byte[] key);

    void put(Table table, byte[] key, byte[] value);

    void delete(Table table, byte[] key);

    void commit();

    void rollback();

    /** True once commit or rollback has run. */
    boolean isFinished();

    @Override
    default void close() {
        if (!isFinished()) {
            rollback();
        }
    }
}
