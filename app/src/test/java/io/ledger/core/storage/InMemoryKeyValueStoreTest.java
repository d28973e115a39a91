package io.ledger.core.storage;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryKeyValueStoreTest {

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String s(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }

    @Test
    void commitPublishesWrites() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        try (StoreTransaction tx = store.begin()) {
            tx.put(Table.BLOCKS, b("k1"), b("v1"));
            tx.put(Table.BLOCKS, b("k2"), b("v2"));
            // own writes are visible inside the transaction only
            assertEquals("v1", s(tx.get(Table.BLOCKS, b("k1")).orElseThrow()));
            assertTrue(store.get(Table.BLOCKS, b("k1")).isEmpty());
            tx.commit();
        }
        assertEquals("v1", s(store.get(Table.BLOCKS, b("k1")).orElseThrow()));
        assertEquals(2, store.size(Table.BLOCKS));
        assertEquals(0, store.size(Table.OUTPUTS));
    }

    @Test
    void closeWithoutCommitDiscardsWrites() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        try (StoreTransaction tx = store.begin()) {
            tx.put(Table.META, b("height"), b("x"));
        }
        assertTrue(store.get(Table.META, b("height")).isEmpty());

        // the writer lock was released, so a new transaction can start immediately
        try (StoreTransaction tx = store.begin()) {
            tx.put(Table.META, b("height"), b("y"));
            tx.commit();
        }
        assertEquals("y", s(store.get(Table.META, b("height")).orElseThrow()));
    }

    @Test
    void deleteInsideTransactionHidesCommittedValue() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        try (StoreTransaction tx = store.begin()) {
            tx.put(Table.OUTPUTS, b("o"), b("1"));
            tx.commit();
        }
        try (StoreTransaction tx = store.begin()) {
            tx.delete(Table.OUTPUTS, b("o"));
            assertTrue(tx.get(Table.OUTPUTS, b("o")).isEmpty());
            assertTrue(store.get(Table.OUTPUTS, b("o")).isPresent());
            tx.commit();
        }
        assertTrue(store.get(Table.OUTPUTS, b("o")).isEmpty());
    }

    @Test
    void prefixScanReturnsOnlyMatchingKeysInOrder() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        try (StoreTransaction tx = store.begin()) {
            tx.put(Table.UNSPENT_BY_ADDRESS, b("ab2"), b("2"));
            tx.put(Table.UNSPENT_BY_ADDRESS, b("ab1"), b("1"));
            tx.put(Table.UNSPENT_BY_ADDRESS, b("ac1"), b("x"));
            tx.put(Table.UNSPENT_BY_ADDRESS, b("a"), b("y"));
            tx.commit();
        }
        List<byte[]> values = store.valuesWithPrefix(Table.UNSPENT_BY_ADDRESS, b("ab"));
        assertEquals(2, values.size());
        assertEquals("1", s(values.get(0)));
        assertEquals("2", s(values.get(1)));
    }

    @Test
    void finishedTransactionRejectsFurtherUse() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        StoreTransaction tx = store.begin();
        tx.commit();
        assertTrue(tx.isFinished());
        assertThrows(StoreException.class, () -> tx.put(Table.META, b("k"), b("v")));
        tx.close();
    }

    @Test
    void secondWriterTimesOutWhileFirstHoldsTheLock() throws Exception {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore(100);
        try (StoreTransaction first = store.begin()) {
            CompletableFuture<Throwable> second = CompletableFuture.supplyAsync(() -> {
                try (StoreTransaction tx = store.begin()) {
                    return null;
                } catch (StoreException e) {
                    return e;
                }
            });
            Throwable failure = second.get(5, TimeUnit.SECONDS);
            assertNotNull(failure);
            assertTrue(failure.getMessage().contains("Timed out"));
            first.commit();
        }
    }

    @Test
    void closedStoreRejectsAccess() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.close();
        assertThrows(StoreException.class, store::begin);
        assertThrows(StoreException.class, () -> store.get(Table.META, b("height")));
    }
}
