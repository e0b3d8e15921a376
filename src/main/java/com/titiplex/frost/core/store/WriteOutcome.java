package com.titiplex.frost.core.store;

public enum WriteOutcome {
    APPLIED,
    /** Conditional write matched no row: the caller's read is out of date. */
    STALE,
    /** Commitment value already present anywhere in the nonce ledger. */
    DUPLICATE_NONCE,
    /** Participant already has a ledger row for this session. */
    DUPLICATE_PARTICIPANT,
    /** Ledger row missing or already consumed. */
    NONCE_ALREADY_USED
}
