package io.ledger.core.ledger;

import io.ledger.core.node.NodeConfig;
import io.ledger.core.protocol.ErrorKind;
import io.ledger.core.protocol.LedgerError;
import io.ledger.core.protocol.ValidationResult;
import io.ledger.core.storage.InMemoryKeyValueStore;
import io.ledger.core.storage.KeyValueStore;
import io.ledger.core.storage.StoreException;
import io.ledger.core.storage.StoreTransaction;
import io.ledger.core.storage.Table;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static io.ledger.core.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LedgerEngineTest extends AbstractLedgerEngineTest {

    @Override
    protected KeyValueStore openStore() {
        return new InMemoryKeyValueStore();
    }

    @Test
    void excessiveRollbackIsRejected() {
        for (long h = 1; h <= 2001; h++) {
            assertOk(engine.submitBlock(block(h)), h);
        }
        ValidationResult<Long> result = engine.rollback(0);
        assertFailure(result, ErrorKind.RANGE, LedgerError.EXCESSIVE_ROLLBACK);
        assertEquals("Cannot rollback more than 2000 blocks. Current: 2001, Target: 0", result.error.message());
        assertEquals(2001, engine.getCurrentHeight());

        // exactly the maximum depth is allowed
        assertOk(engine.rollback(1), 1);
    }

    @Test
    void configuredRollbackLimitApplies() {
        LedgerEngine shallow = new LedgerEngine(store, NodeConfig.defaultLocal().withMaxRollbackBlocks(2));
        for (long h = 1; h <= 4; h++) {
            assertOk(shallow.submitBlock(block(h)), h);
        }
        assertFailure(shallow.rollback(1), ErrorKind.RANGE, LedgerError.EXCESSIVE_ROLLBACK);
        assertOk(shallow.rollback(2), 2);
    }

    @Test
    void storeFailureIsReportedAsInternalAndRolledBack() {
        FailingCommitStore failing = new FailingCommitStore(store);
        LedgerEngine broken = new LedgerEngine(failing, NodeConfig.defaultLocal());

        ValidationResult<Long> result = broken.submitBlock(genesis());
        assertFailure(result, ErrorKind.INTERNAL, LedgerError.INTERNAL_ERROR);
        assertEquals("Internal server error", result.error.message());
        assertEquals(0, engine.getCurrentHeight());

        // the writer lock was released by the aborted transaction
        assertOk(engine.submitBlock(genesis()), 1);
        assertFailure(broken.rollback(0), ErrorKind.INTERNAL, LedgerError.INTERNAL_ERROR);
        assertEquals(1, engine.getCurrentHeight());
        assertBalance("100", "addr1");
    }

    @Test
    void lockTimeoutSurfacesAsInternal() throws Exception {
        InMemoryKeyValueStore slow = new InMemoryKeyValueStore(50);
        LedgerEngine contended = new LedgerEngine(slow, NodeConfig.defaultLocal());
        try (StoreTransaction held = slow.begin()) {
            ValidationResult<Long> result = CompletableFuture
                    .supplyAsync(() -> contended.submitBlock(genesis()))
                    .get();
            assertFailure(result, ErrorKind.INTERNAL, LedgerError.INTERNAL_ERROR);
        }
        assertOk(contended.submitBlock(genesis()), 1);
    }

    @Test
    void rejectedBlockLeavesBalancesAndHeightUntouched() {
        assertOk(engine.submitBlock(genesis()), 1);
        // second input is unknown, so the valid first input must not be consumed
        assertFailure(engine.submitBlock(block(2,
                        tx("tx2", List.of(in("tx1", 0), in("tx9", 0)), List.of(out("addr2", "100"))))),
                ErrorKind.REFERENTIAL, LedgerError.INVALID_INPUT);
        assertFalse(engine.getOutput("tx1", 0).orElseThrow().spent());
        assertTrue(engine.getOutput("tx2", 0).isEmpty());
    }

    /** Delegates everything but refuses to commit. */
    private static final class FailingCommitStore implements KeyValueStore {
        private final KeyValueStore delegate;

        FailingCommitStore(KeyValueStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public StoreTransaction begin() {
            StoreTransaction inner = delegate.begin();
            return new StoreTransaction() {
                @Override
                public Optional<byte[]> get(Table table, byte[] key) {
                    return inner.get(table, key);
                }

                @Override
                public Optional<byte[]> getForUpdate(Table table, byte[] key) {
                    return inner.getForUpdate(table, key);
                }

                @Override
                public void put(Table table, byte[] key, byte[] value) {
                    inner.put(table, key, value);
                }

                @Override
                public void delete(Table table, byte[] key) {
                    inner.delete(table, key);
                }

                @Override
                public void commit() {
                    throw new StoreException("disk full");
                }

                @Override
                public void rollback() {
                    inner.rollback();
                }

                @Override
                public boolean isFinished() {
                    return inner.isFinished();
                }
            };
        }

        @Override
        public Optional<byte[]> get(Table table, byte[] key) {
            return delegate.get(table, key);
        }

        @Override
        public List<byte[]> valuesWithPrefix(Table table, byte[] prefix) {
            return delegate.valuesWithPrefix(table, prefix);
        }

        @Override
        public void close() {
            delegate.close();
        }
    }

    @Test
    void outOfRangeOutputValueIsStructuralAndLeavesNoTrace() {
        assertFailure(engine.submitBlock(block(1, mint("tx1", out("a", "1e999999999")))),
                ErrorKind.STRUCTURAL, LedgerError.INVALID_BLOCK);
        assertFailure(engine.submitBlock(block(1, mint("tx1", out("a", "1e1000000")))),
                ErrorKind.STRUCTURAL, LedgerError.INVALID_BLOCK);
        assertEquals(0, engine.getCurrentHeight());
        assertTrue(engine.getOutput("tx1", 0).isEmpty());

        assertOk(engine.submitBlock(block(1, mint("tx1", out("a", "10")))), 1);
        assertFailure(engine.submitBlock(block(2, tx("tx2", List.of(in("tx1", 0)),
                        List.of(out("b", "10"), out("c", "0.0000000000000000001"))))),
                ErrorKind.STRUCTURAL, LedgerError.INVALID_BLOCK);
        assertEquals(1, engine.getCurrentHeight());
        assertEquals(0, amount("10").compareTo(engine.getBalance("a")));
    }

    @Test
    void zeroWithLargeScaleIsStoredAsPlainZero() {
        assertOk(engine.submitBlock(block(1, mint("tx1", out("a", "0E-999999"), out("a", "1")))), 1);
        assertEquals("1", engine.getBalance("a").toPlainString());
        assertEquals(0, engine.getOutput("tx1", 0).orElseThrow().value().scale());
    }
}
