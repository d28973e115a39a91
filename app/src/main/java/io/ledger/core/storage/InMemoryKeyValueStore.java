package io.ledger.core.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Simple, fast in-memory store. Good for tests and throwaway local nodes.
 *
 * One writer at a time: {@link #begin()} takes a fair writer lock (waiting at most the
 * configured lock timeout), and the transaction buffers its writes until commit publishes them
 * in one step. Committed reads synchronize on the table map, so they never observe half of a
 * commit.
 *
 * Keys are byte[]; we wrap them in a small BytesKey so they can be used in sorted maps
 * (byte[] doesn't implement value-based equals/compareTo).
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<Table, NavigableMap<BytesKey, byte[]>> tables = new EnumMap<>(Table.class);
    private final ReentrantLock writer = new ReentrantLock(true);
    private final long lockTimeoutMillis;
    private volatile boolean closed;

    public InMemoryKeyValueStore() {
        this(5_000L);
    }

    public InMemoryKeyValueStore(long lockTimeoutMillis) {
        this.lockTimeoutMillis = lockTimeoutMillis;
        for (Table table : Table.values()) {
            tables.put(table, new TreeMap<>());
        }
    }

    @Override
    public StoreTransaction begin() {
        ensureOpen();
        try {
            if (!writer.tryLock(lockTimeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new StoreException("Timed out after " + lockTimeoutMillis + " ms waiting for the write lock");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted while waiting for the write lock", e);
        }
        return new MemoryTransaction();
    }

    @Override
    public Optional<byte[]> get(Table table, byte[] key) {
        ensureOpen();
        synchronized (tables) {
            return copyOf(tables.get(table).get(new BytesKey(key)));
        }
    }

    @Override
    public List<byte[]> valuesWithPrefix(Table table, byte[] prefix) {
        ensureOpen();
        List<byte[]> out = new ArrayList<>();
        synchronized (tables) {
            for (Map.Entry<BytesKey, byte[]> e : tables.get(table).tailMap(new BytesKey(prefix), true).entrySet()) {
                if (!LedgerSchema.startsWith(e.getKey().bytes, prefix)) {
                    break;
                }
                out.add(e.getValue().clone());
            }
        }
        return out;
    }

    /** Number of committed keys in a table (debug/tests). */
    public int size(Table table) {
        synchronized (tables) {
            return tables.get(table).size();
        }
    }

    @Override
    public void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new StoreException("Store is closed");
        }
    }

    private static Optional<byte[]> copyOf(byte[] value) {
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    private final class MemoryTransaction implements StoreTransaction {
        /** Pending writes per table; a null value marks a delete. */
        private final Map<Table, Map<BytesKey, byte[]>> pending = new EnumMap<>(Table.class);
        private boolean finished;

        @Override
        public Optional<byte[]> get(Table table, byte[] key) {
            ensureActive();
            BytesKey k = new BytesKey(key);
            Map<BytesKey, byte[]> writes = pending.get(table);
            if (writes != null && writes.containsKey(k)) {
                return copyOf(writes.get(k));
            }
            return InMemoryKeyValueStore.this.get(table, key);
        }

        @Override
        public Optional<byte[]> getForUpdate(Table table, byte[] key) {
            // the writer lock already makes this transaction exclusive
            return get(table, key);
        }

        @Override
        public void put(Table table, byte[] key, byte[] value) {
            ensureActive();
            pending.computeIfAbsent(table, t -> new HashMap<>()).put(new BytesKey(key), value.clone());
        }

        @Override
        public void delete(Table table, byte[] key) {
            ensureActive();
            pending.computeIfAbsent(table, t -> new HashMap<>()).put(new BytesKey(key), null);
        }

        @Override
        public void commit() {
            ensureActive();
            try {
                ensureOpen();
                synchronized (tables) {
                    for (Map.Entry<Table, Map<BytesKey, byte[]>> t : pending.entrySet()) {
                        NavigableMap<BytesKey, byte[]> target = tables.get(t.getKey());
                        for (Map.Entry<BytesKey, byte[]> w : t.getValue().entrySet()) {
                            if (w.getValue() == null) {
                                target.remove(w.getKey());
                            } else {
                                target.put(w.getKey(), w.getValue());
                            }
                        }
                    }
                }
            } finally {
                finish();
            }
        }

        @Override
        public void rollback() {
            if (finished) {
                return;
            }
            finish();
        }

        @Override
        public boolean isFinished() {
            return finished;
        }

        private void finish() {
            finished = true;
            pending.clear();
            if (writer.isHeldByCurrentThread()) {
                writer.unlock();
            }
        }

        private void ensureActive() {
            if (finished) {
                throw new StoreException("Transaction already finished");
            }
        }
    }

    /** Value-based, unsigned-lexicographic key wrapper around byte[]. */
    private static final class BytesKey implements Comparable<BytesKey> {
        private final byte[] bytes;
        private final int hash; // cache hashCode

        BytesKey(byte[] src) {
            if (src == null) throw new IllegalArgumentException("null key");
            this.bytes = src.clone();
            this.hash = Arrays.hashCode(this.bytes);
        }

        @Override public int compareTo(BytesKey other) {
            return Arrays.compareUnsigned(this.bytes, other.bytes);
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BytesKey)) return false;
            BytesKey other = (BytesKey) o;
            return Arrays.equals(this.bytes, other.bytes);
        }

        @Override public int hashCode() {
            return hash;
        }
    }
}
