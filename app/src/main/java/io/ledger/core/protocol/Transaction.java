package io.ledger.core.protocol;

import java.util.List;

/** Caller-identified transaction: consumes inputs, creates outputs at their list index. */
public record Transaction(String id, List<Input> inputs, List<Output> outputs) {

    public Transaction {
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }
}
