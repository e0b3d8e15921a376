package com.titiplex.frost.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Tells the participants of a new session that their nonce commitment is wanted.
 */
public record SigningRequestNotice(
        @JsonProperty("type") String type,
        @JsonProperty("sessionId") String sessionId,
        @JsonProperty("groupId") String groupId,
        @JsonProperty("messagePreview") String messagePreview,
        @JsonProperty("expiresAt") long expiresAt,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("recipients") List<String> recipients
) {
    public static final String TYPE = "frost_signing_request";
    static final String DEFAULT_PREVIEW = "FROST signing request";
    static final int PREVIEW_LIMIT = 100;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static SigningRequestNotice of(SigningSession s, long now) {
        return new SigningRequestNotice(TYPE, s.sessionId(), s.groupId(), preview(s.messageTemplate()),
                s.expiresAt(), now, s.participants());
    }

    /**
     * Content of the event template, cut to {@value #PREVIEW_LIMIT} chars; a fixed text when
     * there is no readable content.
     */
    static String preview(String messageTemplate) {
        if (messageTemplate == null || messageTemplate.isBlank()) return DEFAULT_PREVIEW;
        JsonNode content;
        try {
            content = MAPPER.readTree(messageTemplate).path("content");
        } catch (JsonProcessingException e) {
            return DEFAULT_PREVIEW;
        }
        if (!content.isTextual() || content.asText().isEmpty()) return DEFAULT_PREVIEW;
        String text = content.asText();
        return text.length() > PREVIEW_LIMIT ? text.substring(0, PREVIEW_LIMIT - 3) + "..." : text;
    }
}
