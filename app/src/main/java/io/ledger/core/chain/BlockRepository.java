package io.ledger.core.chain;

import io.ledger.core.protocol.Block;
import io.ledger.core.storage.JsonCodec;
import io.ledger.core.storage.KeyValueStore;
import io.ledger.core.storage.LedgerSchema;
import io.ledger.core.storage.StoreTransaction;
import io.ledger.core.storage.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Block ledger keyed by height. Heights are contiguous from 1, so the current height (kept in
 * {@code meta}) is also the block count, and "blocks above h" is the range h+1..current.
 */
public final class BlockRepository {
    private final KeyValueStore store;
    private final TransactionRepository transactions;

    public BlockRepository(KeyValueStore store, TransactionRepository transactions) {
        this.store = store;
        this.transactions = transactions;
    }

    /** Committed height, 0 for an empty ledger. */
    public long currentHeight() {
        return store.get(Table.META, LedgerSchema.HEIGHT_KEY)
                .map(LedgerSchema::bytesToLong)
                .orElse(0L);
    }

    /**
     * Height as seen by {@code tx}, locking the height row until {@code tx} ends. Every
     * mutating ledger operation calls this first, which serializes them.
     */
    public long lockCurrentHeight(StoreTransaction tx) {
        return tx.getForUpdate(Table.META, LedgerSchema.HEIGHT_KEY)
                .map(LedgerSchema::bytesToLong)
                .orElse(0L);
    }

    public void create(StoreTransaction tx, Block block) {
        BlockRecord record = new BlockRecord(block.id(), block.height(), block.transactionIds());
        tx.put(Table.BLOCKS, LedgerSchema.heightKey(block.height()), JsonCodec.encode(record));
        tx.put(Table.META, LedgerSchema.HEIGHT_KEY, LedgerSchema.longToBytes(block.height()));
    }

    public Optional<BlockRecord> findByHeight(long height) {
        return store.get(Table.BLOCKS, LedgerSchema.heightKey(height))
                .map(b -> JsonCodec.decode(b, BlockRecord.class));
    }

    /** Blocks with height > {@code height}, highest first. */
    public List<BlockRecord> findAbove(StoreTransaction tx, long height) {
        long current = lockCurrentHeight(tx);
        List<BlockRecord> out = new ArrayList<>();
        for (long h = current; h > height; h--) {
            tx.get(Table.BLOCKS, LedgerSchema.heightKey(h))
                    .map(b -> JsonCodec.decode(b, BlockRecord.class))
                    .ifPresent(out::add);
        }
        return out;
    }

    /**
     * Delete every block above {@code height}, cascading to their transactions and the outputs
     * those transactions created, and move the height marker down.
     */
    public void deleteAbove(StoreTransaction tx, long height) {
        for (BlockRecord block : findAbove(tx, height)) {
            transactions.deleteByBlock(tx, block);
            tx.delete(Table.BLOCKS, LedgerSchema.heightKey(block.height()));
        }
        if (height == 0) {
            tx.delete(Table.META, LedgerSchema.HEIGHT_KEY);
        } else {
            tx.put(Table.META, LedgerSchema.HEIGHT_KEY, LedgerSchema.longToBytes(height));
        }
    }
}
