package io.ledger.core.chain;

import io.ledger.core.protocol.Transaction;
import io.ledger.core.state.OutputRepository;
import io.ledger.core.storage.JsonCodec;
import io.ledger.core.storage.LedgerSchema;
import io.ledger.core.storage.StoreTransaction;
import io.ledger.core.storage.Table;

import java.util.ArrayList;
import java.util.List;

public final class TransactionRepository {
    private final OutputRepository outputs;

    public TransactionRepository(OutputRepository outputs) {
        this.outputs = outputs;
    }

    /**
     * Insert the transaction record unless the id is already taken.
     *
     * @return false if a transaction with this id already exists
     */
    public boolean create(StoreTransaction tx, Transaction transaction, String blockId, long height) {
        byte[] key = LedgerSchema.transactionKey(transaction.id());
        if (tx.getForUpdate(Table.TRANSACTIONS, key).isPresent()) {
            return false;
        }
        TransactionRecord record = new TransactionRecord(
                transaction.id(), blockId, height, transaction.inputs().size(), transaction.outputs().size());
        tx.put(Table.TRANSACTIONS, key, JsonCodec.encode(record));
        return true;
    }

    public List<TransactionRecord> findByBlock(StoreTransaction tx, BlockRecord block) {
        List<TransactionRecord> out = new ArrayList<>(block.transactionIds().size());
        for (String txId : block.transactionIds()) {
            tx.get(Table.TRANSACTIONS, LedgerSchema.transactionKey(txId))
                    .map(b -> JsonCodec.decode(b, TransactionRecord.class))
                    .ifPresent(out::add);
        }
        return out;
    }

    /** Delete a block's transactions together with the outputs they created. */
    public void deleteByBlock(StoreTransaction tx, BlockRecord block) {
        for (TransactionRecord record : findByBlock(tx, block)) {
            outputs.deleteByTransaction(tx, record.id(), record.outputCount());
            tx.delete(Table.TRANSACTIONS, LedgerSchema.transactionKey(record.id()));
        }
    }
}
