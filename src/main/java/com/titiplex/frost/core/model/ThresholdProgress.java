package com.titiplex.frost.core.model;

/**
 * Result of a round submission.
 *
 * @param count        commitments or shares recorded after the submission
 * @param threshold    contributions the session needs
 * @param thresholdMet whether {@code count >= threshold}
 * @param status       session status written by the submission
 */
public record ThresholdProgress(int count, int threshold, boolean thresholdMet, SessionStatus status) {

    /**
     * True only for the single Round-2 submission that moved the session to aggregating.
     */
    public boolean shouldAggregate() {
        return thresholdMet && status == SessionStatus.AGGREGATING;
    }
}
