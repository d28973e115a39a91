package io.ledger.core.chain;

/**
 * Stored transaction. Inputs and outputs are not embedded: the counts are enough to address the
 * spender entries and the created outputs, which live in the output ledger.
 */
public record TransactionRecord(String id, String blockId, long height, int inputCount, int outputCount) {
}
