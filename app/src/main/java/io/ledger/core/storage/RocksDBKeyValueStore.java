package io.ledger.core.storage;

import org.rocksdb.*;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent store on a RocksDB pessimistic {@link TransactionDB}.
 *
 * Layout: one column family per {@link Table} (see {@link LedgerSchema} for the keys).
 * {@link StoreTransaction#getForUpdate} takes a RocksDB row lock; a transaction waiting longer than
 * the configured lock timeout fails with a {@link StoreException}. Plain reads on the store go
 * straight to the DB and see committed data only.
 */
public final class RocksDBKeyValueStore implements KeyValueStore {

    static {
        RocksDB.loadLibrary();
    }

    private final TransactionDB db;
    private final Map<Table, ColumnFamilyHandle> handles;
    private final List<ColumnFamilyHandle> allHandles;
    private final DBOptions dbOptions;
    private final TransactionDBOptions txDbOptions;
    private final WriteOptions writeOptions;
    private final ReadOptions readOptions;

    private RocksDBKeyValueStore(TransactionDB db,
                                 Map<Table, ColumnFamilyHandle> handles,
                                 List<ColumnFamilyHandle> allHandles,
                                 DBOptions dbOptions,
                                 TransactionDBOptions txDbOptions) {
        this.db = db;
        this.handles = handles;
        this.allHandles = allHandles;
        this.dbOptions = dbOptions;
        this.txDbOptions = txDbOptions;
        this.writeOptions = new WriteOptions();
        this.readOptions = new ReadOptions();
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBKeyValueStore open(String dataDir, long lockTimeoutMillis) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        TransactionDBOptions txOpts = new TransactionDBOptions()
                .setTransactionLockTimeout(lockTimeoutMillis);

        List<ColumnFamilyDescriptor> cfDescs = new ArrayList<>();
        cfDescs.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY));
        for (Table table : Table.values()) {
            cfDescs.add(new ColumnFamilyDescriptor(table.columnFamilyBytes()));
        }
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();

        try {
            TransactionDB db = TransactionDB.open(dbOpts, txOpts, dataDir, cfDescs, cfHandles);
            // index 0 is the default CF; the rest follow Table order
            Map<Table, ColumnFamilyHandle> byTable = new EnumMap<>(Table.class);
            Table[] tables = Table.values();
            for (int i = 0; i < tables.length; i++) {
                byTable.put(tables[i], cfHandles.get(i + 1));
            }
            return new RocksDBKeyValueStore(db, byTable, cfHandles, dbOpts, txOpts);
        } catch (RocksDBException e) {
            for (ColumnFamilyHandle handle : cfHandles) {
                handle.close();
            }
            txOpts.close();
            dbOpts.close();
            throw new StoreException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    public StoreTransaction begin() {
        return new RocksTransaction(db.beginTransaction(writeOptions));
    }

    @Override
    public Optional<byte[]> get(Table table, byte[] key) {
        try {
            return Optional.ofNullable(db.get(handle(table), key));
        } catch (RocksDBException e) {
            throw new StoreException("get failed on " + table.columnFamily(), e);
        }
    }

    @Override
    public List<byte[]> valuesWithPrefix(Table table, byte[] prefix) {
        List<byte[]> out = new ArrayList<>();
        // iterators read from an implicit snapshot, so a concurrent commit is seen whole or not at all
        try (RocksIterator it = db.newIterator(handle(table))) {
            for (it.seek(prefix); it.isValid(); it.next()) {
                if (!LedgerSchema.startsWith(it.key(), prefix)) {
                    break;
                }
                out.add(it.value());
            }
        }
        return out;
    }

    @Override
    public void close() {
        // Close CF handles first, then DB/options
        for (ColumnFamilyHandle handle : allHandles) {
            handle.close();
        }
        db.close();
        readOptions.close();
        writeOptions.close();
        txDbOptions.close();
        dbOptions.close();
    }

    private ColumnFamilyHandle handle(Table table) {
        return handles.get(table);
    }

    private final class RocksTransaction implements StoreTransaction {
        private final Transaction txn;
        private boolean finished;

        RocksTransaction(Transaction txn) {
            this.txn = txn;
        }

        @Override
        public Optional<byte[]> get(Table table, byte[] key) {
            try {
                return Optional.ofNullable(txn.get(handle(table), readOptions, key));
            } catch (RocksDBException e) {
                throw new StoreException("get failed on " + table.columnFamily(), e);
            }
        }

        @Override
        public Optional<byte[]> getForUpdate(Table table, byte[] key) {
            try {
                return Optional.ofNullable(txn.getForUpdate(readOptions, handle(table), key, true));
            } catch (RocksDBException e) {
                throw new StoreException("getForUpdate failed on " + table.columnFamily() + " (" + describe(e) + ")", e);
            }
        }

        @Override
        public void put(Table table, byte[] key, byte[] value) {
            try {
                txn.put(handle(table), key, value);
            } catch (RocksDBException e) {
                throw new StoreException("put failed on " + table.columnFamily(), e);
            }
        }

        @Override
        public void delete(Table table, byte[] key) {
            try {
                txn.delete(handle(table), key);
            } catch (RocksDBException e) {
                throw new StoreException("delete failed on " + table.columnFamily(), e);
            }
        }

        @Override
        public void commit() {
            try {
                txn.commit();
            } catch (RocksDBException e) {
                throw new StoreException("commit failed (" + describe(e) + ")", e);
            } finally {
                finished = true;
                txn.close();
            }
        }

        @Override
        public void rollback() {
            if (finished) {
                return;
            }
            try {
                txn.rollback();
            } catch (RocksDBException e) {
                throw new StoreException("rollback failed", e);
            } finally {
                finished = true;
                txn.close();
            }
        }

        @Override
        public boolean isFinished() {
            return finished;
        }
    }

    private static String describe(RocksDBException e) {
        Status status = e.getStatus();
        if (status == null) {
            return String.valueOf(e.getMessage());
        }
        return status.getCode() + (status.getState() != null ? ": " + status.getState() : "");
    }
}
