package io.ledger.core.chain;

import java.util.List;

/** Stored block: identity, height and the ids of the transactions it owns, in order. */
public record BlockRecord(String id, long height, List<String> transactionIds) {

    public BlockRecord {
        transactionIds = transactionIds != null ? List.copyOf(transactionIds) : List.of();
    }
}
