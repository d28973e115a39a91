package io.ledger.core.node;

/** Simple config holder for a ledger node. */
public final class NodeConfig {
    public static final long DEFAULT_MAX_ROLLBACK_BLOCKS = 2000L;
    public static final long DEFAULT_LOCK_TIMEOUT_MILLIS = 5_000L;

    /** Deepest rollback accepted, counted in blocks below the current height. */
    public final long maxRollbackBlocks;
    /** How long a mutating operation may wait for the store's write locks. */
    public final long lockTimeoutMillis;

    public NodeConfig(long maxRollbackBlocks, long lockTimeoutMillis) {
        if (maxRollbackBlocks < 0) {
            throw new IllegalArgumentException("maxRollbackBlocks must be >= 0");
        }
        if (lockTimeoutMillis <= 0) {
            throw new IllegalArgumentException("lockTimeoutMillis must be > 0");
        }
        this.maxRollbackBlocks = maxRollbackBlocks;
        this.lockTimeoutMillis = lockTimeoutMillis;
    }

    public static NodeConfig defaultLocal() {
        return new NodeConfig(DEFAULT_MAX_ROLLBACK_BLOCKS, DEFAULT_LOCK_TIMEOUT_MILLIS);
    }

    public NodeConfig withMaxRollbackBlocks(long maxRollbackBlocks) {
        return new NodeConfig(maxRollbackBlocks, this.lockTimeoutMillis);
    }

    public NodeConfig withLockTimeoutMillis(long lockTimeoutMillis) {
        return new NodeConfig(this.maxRollbackBlocks, lockTimeoutMillis);
    }
}
