package io.ledger.core.state;

import io.ledger.core.protocol.Output;
import io.ledger.core.storage.JsonCodec;
import io.ledger.core.storage.KeyValueStore;
import io.ledger.core.storage.LedgerSchema;
import io.ledger.core.storage.StoreTransaction;
import io.ledger.core.storage.Table;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Output ledger: every output ever created (and not rolled back), its spent flag and spender.
 *
 * Three tables move together:
 * <ul>
 *   <li>{@code outputs}: the record itself</li>
 *   <li>{@code unspent_by_address}: one entry per unspent output, scanned for balances</li>
 *   <li>{@code spenders}: (spender tx, input index) → spent outpoint, used to undo spends</li>
 * </ul>
 * Writes take the caller's {@link StoreTransaction}; lookups without one read committed state.
 */
public final class OutputRepository {
    private final KeyValueStore store;

    public OutputRepository(KeyValueStore store) {
        this.store = store;
    }

    public void create(StoreTransaction tx, String txId, int index, Output output) {
        OutputRecord record = OutputRecord.unspent(txId, index, output.address(), output.value());
        tx.put(Table.OUTPUTS, LedgerSchema.outPointKey(txId, index), JsonCodec.encode(record));
        tx.put(Table.UNSPENT_BY_ADDRESS, LedgerSchema.unspentKey(output.address(), txId, index), valueBytes(output.value()));
    }

    /** Committed output, if any. */
    public Optional<OutputRecord> find(String txId, int index) {
        return store.get(Table.OUTPUTS, LedgerSchema.outPointKey(txId, index))
                .map(b -> JsonCodec.decode(b, OutputRecord.class));
    }

    /** Output as seen by {@code tx} (committed state plus the transaction's own writes). */
    public Optional<OutputRecord> find(StoreTransaction tx, String txId, int index) {
        return tx.get(Table.OUTPUTS, LedgerSchema.outPointKey(txId, index))
                .map(b -> JsonCodec.decode(b, OutputRecord.class));
    }

    /**
     * Conditionally mark an output spent: only if it exists and {@code spent = false}.
     * The row stays locked until {@code tx} ends, so a concurrent spender either waits or times
     * out.
     *
     * @return false when no unspent row matched (missing, or already spent)
     */
    public boolean markSpent(StoreTransaction tx, String txId, int index, String spentByTx, int spentByIndex) {
        byte[] key = LedgerSchema.outPointKey(txId, index);
        Optional<byte[]> current = tx.getForUpdate(Table.OUTPUTS, key);
        if (current.isEmpty()) {
            return false;
        }
        OutputRecord record = JsonCodec.decode(current.get(), OutputRecord.class);
        if (record.spent()) {
            return false;
        }
        tx.put(Table.OUTPUTS, key, JsonCodec.encode(record.spentBy(spentByTx, spentByIndex)));
        tx.delete(Table.UNSPENT_BY_ADDRESS, LedgerSchema.unspentKey(record.address(), txId, index));
        tx.put(Table.SPENDERS, LedgerSchema.spenderKey(spentByTx, spentByIndex), key);
        return true;
    }

    /**
     * Restore every output whose recorded spender is {@code spenderTxId}.
     *
     * @param inputCount number of inputs the spender had; spender entries are keyed by input index
     * @return number of outputs restored
     */
    public int unspendBySpender(StoreTransaction tx, String spenderTxId, int inputCount) {
        int restored = 0;
        for (int i = 0; i < inputCount; i++) {
            byte[] spenderKey = LedgerSchema.spenderKey(spenderTxId, i);
            Optional<byte[]> outPoint = tx.get(Table.SPENDERS, spenderKey);
            if (outPoint.isEmpty()) {
                continue;
            }
            tx.delete(Table.SPENDERS, spenderKey);
            Optional<byte[]> current = tx.getForUpdate(Table.OUTPUTS, outPoint.get());
            if (current.isEmpty()) {
                continue;
            }
            OutputRecord record = JsonCodec.decode(current.get(), OutputRecord.class);
            if (!record.spent() || !spenderTxId.equals(record.spentByTx())) {
                continue;
            }
            tx.put(Table.OUTPUTS, outPoint.get(), JsonCodec.encode(record.unspend()));
            tx.put(Table.UNSPENT_BY_ADDRESS,
                    LedgerSchema.unspentKey(record.address(), record.txId(), record.index()),
                    valueBytes(record.value()));
            restored++;
        }
        return restored;
    }

    /** Delete the outputs created by a transaction (cascade from transaction delete). */
    public void deleteByTransaction(StoreTransaction tx, String txId, int outputCount) {
        for (int i = 0; i < outputCount; i++) {
            byte[] key = LedgerSchema.outPointKey(txId, i);
            Optional<byte[]> current = tx.get(Table.OUTPUTS, key);
            if (current.isEmpty()) {
                continue;
            }
            OutputRecord record = JsonCodec.decode(current.get(), OutputRecord.class);
            tx.delete(Table.UNSPENT_BY_ADDRESS, LedgerSchema.unspentKey(record.address(), txId, i));
            if (record.spent() && record.spentByTx() != null) {
                tx.delete(Table.SPENDERS, LedgerSchema.spenderKey(record.spentByTx(), record.spentByIndex()));
            }
            tx.delete(Table.OUTPUTS, key);
        }
    }

    /** Sum of committed unspent outputs owned by {@code address}; 0 when there are none. */
    public BigDecimal balanceOf(String address) {
        BigDecimal total = BigDecimal.ZERO;
        for (byte[] value : store.valuesWithPrefix(Table.UNSPENT_BY_ADDRESS, LedgerSchema.addressPrefix(address))) {
            total = total.add(new BigDecimal(new String(value, StandardCharsets.UTF_8)));
        }
        return total;
    }

    private static byte[] valueBytes(BigDecimal value) {
        return value.toString().getBytes(StandardCharsets.UTF_8);
    }
}
