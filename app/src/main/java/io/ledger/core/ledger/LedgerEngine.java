package io.ledger.core.ledger;

import io.ledger.core.chain.BlockRecord;
import io.ledger.core.chain.BlockRepository;
import io.ledger.core.chain.TransactionRecord;
import io.ledger.core.chain.TransactionRepository;
import io.ledger.core.metrics.LedgerMetrics;
import io.ledger.core.node.NodeConfig;
import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.BlockHash;
import io.ledger.core.protocol.ErrorKind;
import io.ledger.core.protocol.Input;
import io.ledger.core.protocol.LedgerError;
import io.ledger.core.protocol.Output;
import io.ledger.core.protocol.Transaction;
import io.ledger.core.protocol.ValidationResult;
import io.ledger.core.state.OutputRecord;
import io.ledger.core.state.OutputRepository;
import io.ledger.core.storage.KeyValueStore;
import io.ledger.core.storage.StoreTransaction;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Admits blocks and rolls the ledger back.
 *
 * Both mutations run read-validate-write inside a single store transaction that starts by
 * locking the height row, so admissions and rollbacks are serialized against each other and a
 * failure at any point leaves nothing behind. Semantic failures come back as
 * {@link ValidationResult} errors; store failures are logged and reported as INTERNAL.
 */
public final class LedgerEngine {
    private static final Logger LOG = Logger.getLogger(LedgerEngine.class.getName());

    /** Slack allowed between input and output totals of a non-genesis block. */
    public static final BigDecimal VALUE_TOLERANCE = new BigDecimal("0.000001");
    public static final long GENESIS_HEIGHT = 1L;

    private final KeyValueStore store;
    private final OutputRepository outputs;
    private final TransactionRepository transactions;
    private final BlockRepository blocks;
    private final long maxRollbackBlocks;

    public LedgerEngine(KeyValueStore store, NodeConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.outputs = new OutputRepository(store);
        this.transactions = new TransactionRepository(outputs);
        this.blocks = new BlockRepository(store, transactions);
        this.maxRollbackBlocks = config.maxRollbackBlocks;
    }

    // -------------------- admission --------------------

    /**
     * Validate and apply a structurally valid block.
     *
     * @return the new current height, or the first failed check
     */
    public ValidationResult<Long> submitBlock(Block block) {
        Objects.requireNonNull(block, "block");
        ValidationResult<Long> result = LedgerMetrics.recordApply(() -> admit(block));
        if (result.ok) {
            LedgerMetrics.blockAccepted();
            LOG.info(() -> "Accepted block " + block.id() + " at height " + block.height()
                    + " (" + block.transactions().size() + " txs)");
        } else {
            LedgerMetrics.blockRejected(result.error.kind());
            LOG.fine(() -> "Rejected block at height " + block.height() + ": " + result.error);
        }
        return result;
    }

    private ValidationResult<Long> admit(Block block) {
        for (Transaction transaction : block.transactions()) {
            for (Output output : transaction.outputs()) {
                if (!Output.isValidValue(output.value())) {
                    return ValidationResult.error(LedgerError.structural(
                            "Output value out of range in transaction " + transaction.id()));
                }
            }
        }
        try (StoreTransaction tx = store.begin()) {
            ValidationResult<Void> valid = validate(tx, block);
            if (!valid.ok) {
                return valid.asError();
            }
            ValidationResult<Void> applied = apply(tx, block);
            if (!applied.ok) {
                return applied.asError();
            }
            tx.commit();
            return ValidationResult.ok(block.height());
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Block admission aborted at height " + block.height(), e);
            return ValidationResult.error(LedgerError.internal());
        }
    }

    /** Height, identity, inputs, conservation, in that order; first failure wins. */
    private ValidationResult<Void> validate(StoreTransaction tx, Block block) {
        long currentHeight = blocks.lockCurrentHeight(tx);
        if (block.height() != currentHeight + 1) {
            return ValidationResult.error(ErrorKind.SEQUENCING, LedgerError.INVALID_HEIGHT,
                    "Invalid height. Expected " + (currentHeight + 1) + ", got " + block.height());
        }

        String expectedId = BlockHash.of(block);
        if (!expectedId.equals(block.id())) {
            return ValidationResult.error(ErrorKind.IDENTITY, LedgerError.INVALID_BLOCK_ID,
                    "Invalid block ID. Expected " + expectedId + ", got " + block.id());
        }

        BigDecimal totalIn = BigDecimal.ZERO;
        BigDecimal totalOut = BigDecimal.ZERO;
        for (Transaction transaction : block.transactions()) {
            for (Input input : transaction.inputs()) {
                Optional<OutputRecord> referenced = outputs.find(tx, input.txId(), input.index());
                if (referenced.isEmpty()) {
                    return ValidationResult.error(ErrorKind.REFERENTIAL, LedgerError.INVALID_INPUT,
                            "Input references non-existent output: " + input);
                }
                if (referenced.get().spent()) {
                    return ValidationResult.error(ErrorKind.CONFLICT, LedgerError.DOUBLE_SPEND,
                            "Output already spent: " + input);
                }
                totalIn = totalIn.add(referenced.get().value());
            }
            for (Output output : transaction.outputs()) {
                totalOut = totalOut.add(output.value());
            }
        }

        // genesis may mint value out of nothing
        if (block.height() > GENESIS_HEIGHT && totalIn.subtract(totalOut).abs().compareTo(VALUE_TOLERANCE) > 0) {
            return ValidationResult.error(ErrorKind.CONSERVATION, LedgerError.VALUE_MISMATCH,
                    "Input/Output value mismatch. Inputs: " + plain(totalIn) + ", Outputs: " + plain(totalOut));
        }
        return ValidationResult.ok(null);
    }

    private ValidationResult<Void> apply(StoreTransaction tx, Block block) {
        blocks.create(tx, block);
        for (Transaction transaction : block.transactions()) {
            if (!transactions.create(tx, transaction, block.id(), block.height())) {
                return ValidationResult.error(ErrorKind.CONFLICT, LedgerError.DUPLICATE_TRANSACTION,
                        "Transaction already exists: " + transaction.id());
            }
            List<Input> inputs = transaction.inputs();
            for (int i = 0; i < inputs.size(); i++) {
                Input input = inputs.get(i);
                if (!outputs.markSpent(tx, input.txId(), input.index(), transaction.id(), i)) {
                    return ValidationResult.error(ErrorKind.CONFLICT, LedgerError.DOUBLE_SPEND,
                            "Output already spent: " + input);
                }
            }
            List<Output> created = transaction.outputs();
            for (int i = 0; i < created.size(); i++) {
                outputs.create(tx, transaction.id(), i, created.get(i));
            }
        }
        return ValidationResult.ok(null);
    }

    // -------------------- rollback --------------------

    /**
     * Undo every block above {@code targetHeight}: restore the outputs their transactions spent,
     * then delete the blocks with their transactions and created outputs.
     *
     * @return the new current height ({@code targetHeight})
     */
    public ValidationResult<Long> rollback(long targetHeight) {
        if (targetHeight < 0) {
            return ValidationResult.error(ErrorKind.RANGE, LedgerError.INVALID_HEIGHT, "Invalid height parameter");
        }
        try (StoreTransaction tx = store.begin()) {
            long currentHeight = blocks.lockCurrentHeight(tx);
            if (targetHeight > currentHeight) {
                return ValidationResult.error(ErrorKind.RANGE, LedgerError.FUTURE_HEIGHT,
                        "Cannot rollback to future height. Current: " + currentHeight + ", Target: " + targetHeight);
            }
            if (currentHeight - targetHeight > maxRollbackBlocks) {
                return ValidationResult.error(ErrorKind.RANGE, LedgerError.EXCESSIVE_ROLLBACK,
                        "Cannot rollback more than " + maxRollbackBlocks + " blocks. Current: "
                                + currentHeight + ", Target: " + targetHeight);
            }

            int restored = 0;
            for (BlockRecord block : blocks.findAbove(tx, targetHeight)) {
                for (TransactionRecord record : transactions.findByBlock(tx, block)) {
                    restored += outputs.unspendBySpender(tx, record.id(), record.inputCount());
                }
            }
            blocks.deleteAbove(tx, targetHeight);
            tx.commit();

            long depth = currentHeight - targetHeight;
            int restoredOutputs = restored;
            LedgerMetrics.rolledBack(depth);
            LOG.info(() -> "Rolled back " + depth + " block(s) from height " + currentHeight + " to "
                    + targetHeight + ", restored " + restoredOutputs + " output(s)");
            return ValidationResult.ok(targetHeight);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Rollback to height " + targetHeight + " aborted", e);
            return ValidationResult.error(LedgerError.internal());
        }
    }

    // -------------------- queries --------------------

    /** Sum of unspent outputs owned by {@code address}; unknown addresses are worth 0. */
    public BigDecimal getBalance(String address) {
        Objects.requireNonNull(address, "address");
        return outputs.balanceOf(address);
    }

    public long getCurrentHeight() {
        return blocks.currentHeight();
    }

    /** Committed output with its spend status. */
    public Optional<OutputRecord> getOutput(String txId, int index) {
        return outputs.find(txId, index);
    }

    public Optional<BlockRecord> getBlock(long height) {
        return blocks.findByHeight(height);
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
