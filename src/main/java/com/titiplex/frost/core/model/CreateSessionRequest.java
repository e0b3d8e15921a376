package com.titiplex.frost.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CreateSessionRequest(
        @JsonProperty("groupId") String groupId,
        @JsonProperty("messageHash") String messageHash,
        @JsonProperty("participants") List<String> participants,
        @JsonProperty("threshold") int threshold,
        @JsonProperty("createdBy") String createdBy,
        @JsonProperty("messageTemplate") String messageTemplate, // unsigned Nostr event JSON, optional
        @JsonProperty("eventType") String eventType,
        @JsonProperty("expirationSeconds") Integer expirationSeconds // null -> configured default
) {
}
