package com.titiplex.frost.core.model;

public enum ResumeAction {
    AWAITING_COMMITMENTS,
    AWAITING_SIGNATURES,
    COMPLETED,
    ALREADY_COMPLETED,
    AGGREGATION_CLAIMED_ELSEWHERE,
    EXPIRED,
    FAILED
}
