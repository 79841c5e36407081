package com.singularity.trading.ledger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Either the value produced by a ledger operation or the reason it was refused.
 * Failures carry structured details (current vs. expected price, existing vs. maximum quantity)
 * so clients can explain the refusal.
 *
 * @param <T> The success value type.
 */
public final class LedgerResult<T> {

    private final T value;
    private final LedgerError error;
    private final String message;
    private final Map<String, Object> details;

    private LedgerResult(T value, LedgerError error, String message, Map<String, Object> details) {
        this.value = value;
        this.error = error;
        this.message = message;
        this.details = details;
    }

    public static <T> LedgerResult<T> ok(T value) {
        return new LedgerResult<>(value, null, null, Collections.emptyMap());
    }

    public static <T> LedgerResult<T> failure(LedgerError error, String message) {
        return failure(error, message, Collections.emptyMap());
    }

    public static <T> LedgerResult<T> failure(LedgerError error, String message, Map<String, Object> details) {
        return new LedgerResult<>(null, error, message,
                Collections.unmodifiableMap(new LinkedHashMap<>(details)));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on a failed result: " + error);
        }
        return value;
    }

    public LedgerError getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    /**
     * Re-types a failure so it can be returned from an operation with a different value type.
     */
    public <U> LedgerResult<U> failureAs() {
        if (isSuccess()) {
            throw new IllegalStateException("Cannot re-type a successful result");
        }
        return new LedgerResult<>(null, error, message, details);
    }

    @Override
    public String toString() {
        return isSuccess() ? "LedgerResult[ok]" : "LedgerResult[" + error + ": " + message + "]";
    }
}
