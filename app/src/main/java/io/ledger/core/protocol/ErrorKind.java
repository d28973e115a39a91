package io.ledger.core.protocol;

/**
 * Failure taxonomy shared by the validator, the engine and the HTTP layer.
 */
public enum ErrorKind {
    /** Malformed request shape. */
    STRUCTURAL,
    /** Block height is not current + 1. */
    SEQUENCING,
    /** Block id does not match the recomputed hash. */
    IDENTITY,
    /** Input and output totals differ. */
    CONSERVATION,
    /** Input references an output that does not exist. */
    REFERENTIAL,
    /** Input references an already spent output, or a transaction id is reused. */
    CONFLICT,
    /** Rollback target is negative, in the future, or too deep. */
    RANGE,
    /** Store failure or anything unexpected. */
    INTERNAL;

    public boolean isClientError() {
        return this != CONFLICT && this != INTERNAL;
    }
}
