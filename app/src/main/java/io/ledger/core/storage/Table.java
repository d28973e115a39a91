package io.ledger.core.storage;

import java.nio.charset.StandardCharsets;

/**
 * Logical tables of the ledger. The RocksDB store maps each one to a column family of the same name.
 */
public enum Table {
    META("meta"),
    BLOCKS("blocks"),
    TRANSACTIONS("transactions"),
    OUTPUTS("outputs"),
    UNSPENT_BY_ADDRESS("unspent_by_address"),
    SPENDERS("spenders");

    private final String columnFamily;

    Table(String columnFamily) {
        this.columnFamily = columnFamily;
    }

    public String columnFamily() {
        return columnFamily;
    }

    public byte[] columnFamilyBytes() {
        return columnFamily.getBytes(StandardCharsets.UTF_8);
    }
}
