package io.ledger.core.protocol;

/**
 * Outcome of a validation or ledger operation: either a value or a {@link LedgerError}.
 */
public final class ValidationResult<T> {
    public final boolean ok;
    public final T value;
    public final LedgerError error;

    private ValidationResult(boolean ok, T value, LedgerError error) {
        this.ok = ok;
        this.value = value;
        this.error = error;
    }

    public static <T> ValidationResult<T> ok(T value) {
        return new ValidationResult<>(true, value, null);
    }

    public static <T> ValidationResult<T> error(LedgerError error) {
        return new ValidationResult<>(false, null, error);
    }

    public static <T> ValidationResult<T> error(ErrorKind kind, String code, String message) {
        return error(new LedgerError(kind, code, message));
    }

    /** Re-types a failed result; calling this on a success is a programming error. */
    public <R> ValidationResult<R> asError() {
        if (ok) {
            throw new IllegalStateException("result is not an error");
        }
        return error(error);
    }

    @Override
    public String toString() {
        return ok ? "OK(" + value + ")" : ("ERR[" + error.kind() + "]: " + error.message());
    }
}
