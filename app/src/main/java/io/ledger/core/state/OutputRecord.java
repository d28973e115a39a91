package io.ledger.core.state;

import java.math.BigDecimal;

/**
 * Stored output. {@code spentByTx}/{@code spentByIndex} are set exactly when {@code spent} is.
 */
public record OutputRecord(String txId,
                           int index,
                           String address,
                           BigDecimal value,
                           boolean spent,
                           String spentByTx,
                           Integer spentByIndex) {

    public static OutputRecord unspent(String txId, int index, String address, BigDecimal value) {
        return new OutputRecord(txId, index, address, value, false, null, null);
    }

    public OutputRecord spentBy(String spenderTxId, int inputIndex) {
        return new OutputRecord(txId, index, address, value, true, spenderTxId, inputIndex);
    }

    public OutputRecord unspend() {
        return new OutputRecord(txId, index, address, value, false, null, null);
    }
}
