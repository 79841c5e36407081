package com.singularity.trading.store;

/**
 * Outcome of a document write.
 *
 * <p>{@link Status#OUTCOME_UNKNOWN} means the request may or may not have been applied
 * (timeout, dropped connection, server error after the request was sent). Callers must
 * re-read before deciding anything; blindly repeating the write is not safe.
 */
public final class WriteResult {

    /**
     * The possible write outcomes.
     */
    public enum Status {
        COMMITTED,
        VERSION_CONFLICT,
        OUTCOME_UNKNOWN
    }

    private static final WriteResult CONFLICT = new WriteResult(Status.VERSION_CONFLICT, null, null);

    private final Status status;
    private final String versionToken;
    private final Throwable cause;

    private WriteResult(Status status, String versionToken, Throwable cause) {
        this.status = status;
        this.versionToken = versionToken;
        this.cause = cause;
    }

    public static WriteResult committed(String newVersionToken) {
        return new WriteResult(Status.COMMITTED, newVersionToken, null);
    }

    public static WriteResult conflict() {
        return CONFLICT;
    }

    public static WriteResult unknown(Throwable cause) {
        return new WriteResult(Status.OUTCOME_UNKNOWN, null, cause);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isCommitted() {
        return status == Status.COMMITTED;
    }

    /**
     * @return The token assigned by the store, only set when committed.
     */
    public String getVersionToken() {
        return versionToken;
    }

    /**
     * @return The failure behind an unknown outcome, if any.
     */
    public Throwable getCause() {
        return cause;
    }
}
