package io.ledger.core.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Block = claimed id + height + ordered transactions.
 * Instances are produced by the structural validator; the id is not trusted until the engine
 * recomputes it.
 */
public record Block(String id, long height, List<Transaction> transactions) {

    public Block {
        transactions = transactions != null ? List.copyOf(transactions) : List.of();
    }

    public List<String> transactionIds() {
        List<String> ids = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) {
            ids.add(tx.id());
        }
        return ids;
    }

    @Override
    public String toString() {
        return "Block{height=" + height + ", txs=" + transactions.size() + "}";
    }
}
