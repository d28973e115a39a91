package io.ledger.core.node;

import io.ledger.core.ledger.LedgerEngine;
import io.ledger.core.storage.InMemoryKeyValueStore;
import io.ledger.core.storage.KeyValueStore;
import io.ledger.core.storage.RocksDBKeyValueStore;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires the store and the ledger engine for one process.
 */
public final class Node implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final KeyValueStore store;
    private final LedgerEngine engine;

    public Node(KeyValueStore store, NodeConfig config) {
        this.store = store;
        this.engine = new LedgerEngine(store, config);
    }

    /** Convenience factory for an in-memory local node. */
    public static Node inMemory(NodeConfig config) {
        return new Node(new InMemoryKeyValueStore(config.lockTimeoutMillis), config);
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static Node rocks(NodeConfig config, String dataDir) {
        Node node = new Node(RocksDBKeyValueStore.open(dataDir, config.lockTimeoutMillis), config);
        LOG.info(() -> "Opened ledger at " + dataDir + " (height " + node.engine.getCurrentHeight() + ")");
        return node;
    }

    /** Close the underlying store; failures are logged, not rethrown. */
    @Override
    public void close() {
        try {
            store.close();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Failed to close ledger store", e);
        }
    }

    public LedgerEngine engine() { return engine; }
}
