package com.titiplex.frost.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregated Schnorr signature: {@code R} as a compressed secp256k1 point (66 hex chars)
 * and {@code s} as a 32-byte scalar (64 hex chars).
 */
public record FinalSignature(
        @JsonProperty("R") String r,
        @JsonProperty("s") String s
) {
}
