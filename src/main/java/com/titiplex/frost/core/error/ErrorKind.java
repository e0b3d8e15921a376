package com.titiplex.frost.core.error;

public enum ErrorKind {
    /** Bad threshold, participant set or input format; rejected before persistence. */
    VALIDATION,
    NOT_FOUND,
    /** Operation attempted in the wrong lifecycle state; session untouched. */
    STATE,
    /** Nonce reuse. Never retried automatically. */
    SECURITY,
    /** Optimistic-lock conflict; re-read and retry. */
    CONCURRENCY,
    /** Malformed share or commitment; session stays aggregating. */
    AGGREGATION,
    /** Deadline passed; terminal for the session. */
    EXPIRATION;

    public boolean isRetryable() {
        return this == CONCURRENCY || this == AGGREGATION;
    }
}
