package io.ledger.core.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RocksDBKeyValueStoreTest {

    @TempDir
    Path tempDir;

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String s(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }

    @Test
    void committedDataSurvivesReopen() {
        String dir = tempDir.resolve("db").toString();
        try (RocksDBKeyValueStore store = RocksDBKeyValueStore.open(dir, 1_000)) {
            try (StoreTransaction tx = store.begin()) {
                tx.put(Table.META, LedgerSchema.HEIGHT_KEY, LedgerSchema.longToBytes(3));
                tx.put(Table.BLOCKS, LedgerSchema.heightKey(3), b("block-3"));
                tx.commit();
            }
            try (StoreTransaction tx = store.begin()) {
                tx.put(Table.BLOCKS, LedgerSchema.heightKey(4), b("never"));
            }
        }
        try (RocksDBKeyValueStore store = RocksDBKeyValueStore.open(dir, 1_000)) {
            assertEquals(3L, LedgerSchema.bytesToLong(store.get(Table.META, LedgerSchema.HEIGHT_KEY).orElseThrow()));
            assertEquals("block-3", s(store.get(Table.BLOCKS, LedgerSchema.heightKey(3)).orElseThrow()));
            assertTrue(store.get(Table.BLOCKS, LedgerSchema.heightKey(4)).isEmpty());
        }
    }

    @Test
    void transactionSeesOwnWritesOthersDoNot() {
        try (RocksDBKeyValueStore store = RocksDBKeyValueStore.open(tempDir.toString(), 1_000)) {
            try (StoreTransaction tx = store.begin()) {
                tx.put(Table.OUTPUTS, b("o1"), b("v"));
                assertEquals("v", s(tx.get(Table.OUTPUTS, b("o1")).orElseThrow()));
                assertTrue(store.get(Table.OUTPUTS, b("o1")).isEmpty());
                tx.delete(Table.OUTPUTS, b("o1"));
                assertTrue(tx.get(Table.OUTPUTS, b("o1")).isEmpty());
                tx.commit();
            }
            assertTrue(store.get(Table.OUTPUTS, b("o1")).isEmpty());
        }
    }

    @Test
    void prefixScanStopsAtFirstNonMatchingKey() {
        try (RocksDBKeyValueStore store = RocksDBKeyValueStore.open(tempDir.toString(), 1_000)) {
            try (StoreTransaction tx = store.begin()) {
                tx.put(Table.UNSPENT_BY_ADDRESS, LedgerSchema.unspentKey("alice", "t1", 0), b("10"));
                tx.put(Table.UNSPENT_BY_ADDRESS, LedgerSchema.unspentKey("alice", "t2", 1), b("5"));
                tx.put(Table.UNSPENT_BY_ADDRESS, LedgerSchema.unspentKey("alicex", "t3", 0), b("99"));
                tx.put(Table.UNSPENT_BY_ADDRESS, LedgerSchema.unspentKey("bob", "t4", 0), b("7"));
                tx.commit();
            }
            List<byte[]> alice = store.valuesWithPrefix(Table.UNSPENT_BY_ADDRESS, LedgerSchema.addressPrefix("alice"));
            assertEquals(2, alice.size());
            assertEquals("10", s(alice.get(0)));
            assertEquals("5", s(alice.get(1)));
            assertTrue(store.valuesWithPrefix(Table.UNSPENT_BY_ADDRESS, LedgerSchema.addressPrefix("carol")).isEmpty());
        }
    }

    @Test
    void lockedRowBlocksSecondWriterUntilTimeout() throws Exception {
        try (RocksDBKeyValueStore store = RocksDBKeyValueStore.open(tempDir.toString(), 200)) {
            try (StoreTransaction first = store.begin()) {
                first.getForUpdate(Table.META, LedgerSchema.HEIGHT_KEY);
                CompletableFuture<Throwable> second = CompletableFuture.supplyAsync(() -> {
                    try (StoreTransaction tx = store.begin()) {
                        tx.getForUpdate(Table.META, LedgerSchema.HEIGHT_KEY);
                        return null;
                    } catch (StoreException e) {
                        return e;
                    }
                });
                Throwable failure = second.get(10, TimeUnit.SECONDS);
                assertNotNull(failure, "second writer should not get the row lock");
                first.commit();
            }
        }
    }
}
