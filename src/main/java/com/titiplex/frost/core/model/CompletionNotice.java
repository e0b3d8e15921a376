package com.titiplex.frost.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompletionNotice(
        @JsonProperty("sessionId") String sessionId,
        @JsonProperty("status") String status, // completed|failed
        @JsonProperty("publicationId") String publicationId,
        @JsonProperty("reason") String reason,
        @JsonProperty("recipients") List<String> recipients
) {
    public static CompletionNotice completed(SigningSession s, String publicationId) {
        return new CompletionNotice(s.sessionId(), SessionStatus.COMPLETED.dbValue(), publicationId, null, s.participants());
    }

    public static CompletionNotice failed(SigningSession s, String reason) {
        return new CompletionNotice(s.sessionId(), SessionStatus.FAILED.dbValue(), null, reason, s.participants());
    }
}
