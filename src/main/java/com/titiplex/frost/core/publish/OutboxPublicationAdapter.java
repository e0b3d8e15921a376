package com.titiplex.frost.core.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.titiplex.frost.core.model.FinalSignature;
import com.titiplex.frost.core.store.SqliteDatabase;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.time.Clock;

/**
 * Turns the stored event template into a signed Nostr event and queues it in the
 * {@code frost_outbox} table, from which the relay publisher drains. The publication id is
 * the NIP-01 event id.
 */
@Component
public class OutboxPublicationAdapter implements PublicationAdapter {
    private final SqliteDatabase db;
    private final Clock clock;
    private final String relay;
    private final ObjectMapper mapper = new ObjectMapper();

    public OutboxPublicationAdapter(SqliteDatabase db, Clock clock,
                                    @Value("${frost.publication.relay:wss://relay.satnam.pub}") String relay) {
        this.db = db;
        this.clock = clock;
        this.relay = relay;
        db.query(conn -> {
            try (Statement st = conn.createStatement()) {
                st.executeUpdate("""
                        CREATE TABLE IF NOT EXISTS frost_outbox (
                          event_id TEXT PRIMARY KEY,
                          session_id TEXT NOT NULL,
                          relay TEXT,
                          payload TEXT NOT NULL,
                          created_at INTEGER NOT NULL,
                          sent_at INTEGER
                        )
                        """);
            }
            return null;
        });
    }

    @Override
    public String publish(String sessionId, FinalSignature signature, String messageTemplate, String groupPublicKey) {
        ObjectNode event = signedEvent(sessionId, signature, messageTemplate, groupPublicKey);
        String id = event.get("id").asText();
        String payload = write(event);
        db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO frost_outbox(event_id,session_id,relay,payload,created_at) VALUES(?,?,?,?,?) " +
                            "ON CONFLICT(event_id) DO NOTHING")) {
                ps.setString(1, id);
                ps.setString(2, sessionId);
                ps.setString(3, relay);
                ps.setString(4, payload);
                ps.setLong(5, clock.millis());
                ps.executeUpdate();
            }
            return null;
        });
        return id;
    }

    /**
     * Fills {@code pubkey}, {@code sig}, the {@code nonce}/{@code frost} tags and the event id
     * into a copy of the template.
     */
    ObjectNode signedEvent(String sessionId, FinalSignature signature, String messageTemplate, String groupPublicKey) {
        if (messageTemplate == null || messageTemplate.isBlank())
            throw new PublicationException("No event template in session " + sessionId);
        JsonNode parsed;
        try {
            parsed = mapper.readTree(messageTemplate);
        } catch (JsonProcessingException e) {
            throw new PublicationException("Invalid event template JSON: " + e.getOriginalMessage(), e);
        }
        if (!(parsed instanceof ObjectNode event)
                || !event.path("kind").isIntegralNumber()
                || !event.path("content").isTextual()
                || !event.path("tags").isArray()
                || !event.path("created_at").isIntegralNumber())
            throw new PublicationException("Invalid event template structure");

        ArrayNode tags = (ArrayNode) event.get("tags");
        tags.addArray().add("nonce").add(signature.r());
        tags.addArray().add("frost").add(sessionId);
        event.put("pubkey", xOnly(groupPublicKey));
        event.put("sig", signature.s());
        event.put("id", eventId(event));
        return event;
    }

    private String eventId(ObjectNode event) {
        ArrayNode canonical = mapper.createArrayNode()
                .add(0)
                .add(event.get("pubkey").asText())
                .add(event.get("created_at").asLong())
                .add(event.get("kind").asInt());
        canonical.add(event.get("tags"));
        canonical.add(event.get("content").asText());
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(write(canonical).getBytes(StandardCharsets.UTF_8));
            return Hex.toHexString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    static String xOnly(String groupPublicKey) {
        return switch (groupPublicKey.length()) {
            case 64 -> groupPublicKey;
            case 66, 130 -> groupPublicKey.substring(2, 66);
            default -> throw new PublicationException("Unsupported group key length " + groupPublicKey.length());
        };
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new PublicationException("Cannot serialize event", e);
        }
    }
}
