package io.ledger.core.state;

import io.ledger.core.protocol.Output;
import io.ledger.core.storage.InMemoryKeyValueStore;
import io.ledger.core.storage.StoreTransaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class OutputRepositoryTest {

    private InMemoryKeyValueStore store;
    private OutputRepository outputs;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        outputs = new OutputRepository(store);
        try (StoreTransaction tx = store.begin()) {
            outputs.create(tx, "tx1", 0, new Output("alice", new BigDecimal("10")));
            outputs.create(tx, "tx1", 1, new Output("alice", new BigDecimal("2.5")));
            outputs.create(tx, "tx1", 2, new Output("bob", new BigDecimal("1")));
            tx.commit();
        }
    }

    @Test
    void balanceSumsUnspentOutputsPerAddress() {
        assertEquals(0, new BigDecimal("12.5").compareTo(outputs.balanceOf("alice")));
        assertEquals(0, BigDecimal.ONE.compareTo(outputs.balanceOf("bob")));
        assertEquals(0, BigDecimal.ZERO.compareTo(outputs.balanceOf("nobody")));
    }

    @Test
    void markSpentSucceedsOnceOnly() {
        try (StoreTransaction tx = store.begin()) {
            assertTrue(outputs.markSpent(tx, "tx1", 0, "tx2", 0));
            assertFalse(outputs.markSpent(tx, "tx1", 0, "tx3", 0), "second spend of the same output must fail");
            assertFalse(outputs.markSpent(tx, "missing", 0, "tx2", 1));
            tx.commit();
        }
        OutputRecord spent = outputs.find("tx1", 0).orElseThrow();
        assertTrue(spent.spent());
        assertEquals("tx2", spent.spentByTx());
        assertEquals(0, spent.spentByIndex());
        assertEquals(0, new BigDecimal("2.5").compareTo(outputs.balanceOf("alice")));
    }

    @Test
    void uncommittedSpendIsInvisible() {
        try (StoreTransaction tx = store.begin()) {
            assertTrue(outputs.markSpent(tx, "tx1", 0, "tx2", 0));
            assertTrue(outputs.find(tx, "tx1", 0).orElseThrow().spent());
            assertFalse(outputs.find("tx1", 0).orElseThrow().spent());
        }
        assertFalse(outputs.find("tx1", 0).orElseThrow().spent());
    }

    @Test
    void unspendRestoresOutputsOfTheGivenSpender() {
        try (StoreTransaction tx = store.begin()) {
            outputs.markSpent(tx, "tx1", 0, "tx2", 0);
            outputs.markSpent(tx, "tx1", 1, "tx2", 1);
            outputs.markSpent(tx, "tx1", 2, "tx9", 0);
            tx.commit();
        }
        try (StoreTransaction tx = store.begin()) {
            assertEquals(2, outputs.unspendBySpender(tx, "tx2", 2));
            tx.commit();
        }
        assertFalse(outputs.find("tx1", 0).orElseThrow().spent());
        assertNull(outputs.find("tx1", 1).orElseThrow().spentByTx());
        assertTrue(outputs.find("tx1", 2).orElseThrow().spent());
        assertEquals(0, new BigDecimal("12.5").compareTo(outputs.balanceOf("alice")));
        assertEquals(0, BigDecimal.ZERO.compareTo(outputs.balanceOf("bob")));
    }

    @Test
    void deleteByTransactionRemovesOutputsAndBalanceEntries() {
        try (StoreTransaction tx = store.begin()) {
            outputs.deleteByTransaction(tx, "tx1", 3);
            tx.commit();
        }
        assertTrue(outputs.find("tx1", 0).isEmpty());
        assertTrue(outputs.find("tx1", 2).isEmpty());
        assertEquals(0, BigDecimal.ZERO.compareTo(outputs.balanceOf("alice")));
    }

    @Test
    void preservesDecimalValuesExactly() {
        try (StoreTransaction tx = store.begin()) {
            outputs.create(tx, "tx5", 0, new Output("carol", new BigDecimal("0.1")));
            outputs.create(tx, "tx5", 1, new Output("carol", new BigDecimal("0.2")));
            tx.commit();
        }
        assertEquals(new BigDecimal("0.3"), outputs.balanceOf("carol"));
        assertEquals(new BigDecimal("0.1"), outputs.find("tx5", 0).orElseThrow().value());
    }
}
