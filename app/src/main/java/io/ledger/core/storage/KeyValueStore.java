package io.ledger.core.storage;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;

/**
 * Minimal transactional key-value API so we can swap implementations (RocksDB, in-memory).
 * Keys/values are raw bytes; callers handle encoding (see {@link LedgerSchema}).
 *
 * Reads on the store itself only ever see committed data. All writes go through a
 * {@link StoreTransaction} obtained from {@link #begin()}.
 */
public interface KeyValueStore extends Closeable {

    /** Start a read-write transaction. The caller must close it on every path. */
    StoreTransaction begin();

    /** Committed value for a key. */
    Optional<byte[]> get(Table table, byte[] key);

    /** Committed values of every key starting with {@code prefix}, in key order. */
    List<byte[]> valuesWithPrefix(Table table, byte[] prefix);

    @Override
    void close();
}
