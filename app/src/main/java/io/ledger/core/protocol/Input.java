package io.ledger.core.protocol;

/** Reference to output {@code index} of transaction {@code txId}. */
public record Input(String txId, int index) {

    @Override
    public String toString() {
        return txId + ":" + index;
    }
}
