package io.ledger.core;

import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.BlockHash;
import io.ledger.core.protocol.Input;
import io.ledger.core.protocol.Output;
import io.ledger.core.protocol.Transaction;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/** Builders for well-formed blocks whose id matches their content. */
public final class LedgerFixtures {
    private LedgerFixtures() {}

    public static Block block(long height, Transaction... transactions) {
        List<Transaction> txs = List.of(transactions);
        List<String> ids = new ArrayList<>();
        for (Transaction tx : txs) {
            ids.add(tx.id());
        }
        return new Block(BlockHash.compute(height, ids), height, txs);
    }

    public static Transaction tx(String id, List<Input> inputs, List<Output> outputs) {
        return new Transaction(id, inputs, outputs);
    }

    /** Transaction without inputs, as found in the genesis block. */
    public static Transaction mint(String id, Output... outputs) {
        return new Transaction(id, List.of(), List.of(outputs));
    }

    public static Input in(String txId, int index) {
        return new Input(txId, index);
    }

    public static Output out(String address, String value) {
        return new Output(address, new BigDecimal(value));
    }

    public static BigDecimal amount(String value) {
        return new BigDecimal(value);
    }
}
