package io.ledger.core.protocol;

import java.util.Objects;

/**
 * A tagged ledger failure. {@code code} is the stable machine-readable identifier returned to
 * clients; {@code message} is for humans.
 */
public record LedgerError(ErrorKind kind, String code, String message) {

    public static final String INVALID_BLOCK = "invalid_block";
    public static final String INVALID_HEIGHT = "invalid_height";
    public static final String INVALID_BLOCK_ID = "invalid_block_id";
    public static final String INVALID_INPUT = "invalid_input";
    public static final String DOUBLE_SPEND = "double_spend";
    public static final String DUPLICATE_TRANSACTION = "duplicate_transaction";
    public static final String VALUE_MISMATCH = "value_mismatch";
    public static final String FUTURE_HEIGHT = "future_height";
    public static final String EXCESSIVE_ROLLBACK = "excessive_rollback";
    public static final String INTERNAL_ERROR = "internal_error";

    public LedgerError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(code, "code");
    }

    public static LedgerError structural(String message) {
        return new LedgerError(ErrorKind.STRUCTURAL, INVALID_BLOCK, message);
    }

    public static LedgerError internal() {
        return new LedgerError(ErrorKind.INTERNAL, INTERNAL_ERROR, "Internal server error");
    }

    @Override
    public String toString() {
        return kind + "[" + code + "]: " + message;
    }
}
