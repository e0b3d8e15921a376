package com.titiplex.frost.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titiplex.frost.core.model.FinalSignature;
import com.titiplex.frost.core.model.NonceCommitment;
import com.titiplex.frost.core.model.SessionStatus;
import com.titiplex.frost.core.model.SigningSession;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class SqliteSessionStore implements SessionStore {

    private static final TypeReference<List<String>> LIST = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, String>> MAP = new TypeReference<>() {
    };
    private static final String OPEN_STATES = "('pending','nonce_collection','signing','aggregating')";
    private static final String TERMINAL_STATES = "('completed','failed','expired')";
    private static final String NEXT_TOKEN = "MAX(?, updated_at + 1)";

    private final SqliteDatabase db;
    private final ObjectMapper mapper = new ObjectMapper();

    public SqliteSessionStore(SqliteDatabase db) {
        this.db = db;
        init();
    }

    @Override
    public void init() {
        db.query(conn -> {
            try (Statement st = conn.createStatement()) {
                st.executeUpdate("""
                        CREATE TABLE IF NOT EXISTS frost_signing_sessions (
                          session_id TEXT PRIMARY KEY,
                          group_id TEXT NOT NULL,
                          message_hash TEXT NOT NULL,
                          message_template TEXT,
                          event_type TEXT,
                          created_by TEXT,
                          participants TEXT NOT NULL,
                          threshold INTEGER NOT NULL CHECK (threshold >= 1 AND threshold <= 7),
                          nonce_commitments TEXT NOT NULL DEFAULT '{}',
                          partial_signatures TEXT NOT NULL DEFAULT '{}',
                          final_signature TEXT,
                          status TEXT NOT NULL CHECK (status IN
                            ('pending','nonce_collection','signing','aggregating','completed','failed','expired')),
                          publication_id TEXT,
                          created_at INTEGER NOT NULL,
                          updated_at INTEGER NOT NULL,
                          expires_at INTEGER NOT NULL,
                          nonce_collection_started_at INTEGER,
                          signing_started_at INTEGER,
                          completed_at INTEGER,
                          failed_at INTEGER,
                          error_message TEXT,
                          CHECK ((status = 'completed') = (final_signature IS NOT NULL))
                        )
                        """);
                // no FK to the sessions table: rows must survive session cleanup
                st.executeUpdate("""
                        CREATE TABLE IF NOT EXISTS frost_nonce_commitments (
                          id INTEGER PRIMARY KEY AUTOINCREMENT,
                          session_id TEXT NOT NULL,
                          participant_id TEXT NOT NULL,
                          nonce_commitment TEXT NOT NULL,
                          nonce_used INTEGER NOT NULL DEFAULT 0,
                          created_at INTEGER NOT NULL,
                          used_at INTEGER,
                          CONSTRAINT unique_nonce_commitment UNIQUE (nonce_commitment),
                          CONSTRAINT unique_participant_session UNIQUE (session_id, participant_id)
                        )
                        """);
                st.executeUpdate("CREATE INDEX IF NOT EXISTS idx_frost_sessions_group ON frost_signing_sessions(group_id, status)");
                st.executeUpdate("CREATE INDEX IF NOT EXISTS idx_frost_sessions_expiry ON frost_signing_sessions(status, expires_at)");
            }
            return null;
        });
    }

    // ---------- Sessions ----------
    @Override
    public void insertSession(SigningSession s) {
        db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO frost_signing_sessions(session_id,group_id,message_hash,message_template,event_type," +
                            "created_by,participants,threshold,nonce_commitments,partial_signatures,final_signature,status," +
                            "publication_id,created_at,updated_at,expires_at,nonce_collection_started_at,signing_started_at," +
                            "completed_at,failed_at,error_message) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)")) {
                ps.setString(1, s.sessionId());
                ps.setString(2, s.groupId());
                ps.setString(3, s.messageHash());
                ps.setString(4, s.messageTemplate());
                ps.setString(5, s.eventType());
                ps.setString(6, s.createdBy());
                ps.setString(7, json(s.participants()));
                ps.setInt(8, s.threshold());
                ps.setString(9, json(s.nonceCommitments()));
                ps.setString(10, json(s.partialSignatures()));
                ps.setString(11, s.finalSignature() == null ? null : json(s.finalSignature()));
                ps.setString(12, s.status().dbValue());
                ps.setString(13, s.publicationId());
                ps.setLong(14, s.createdAt());
                ps.setLong(15, s.updatedAt());
                ps.setLong(16, s.expiresAt());
                setLong(ps, 17, s.nonceCollectionStartedAt());
                setLong(ps, 18, s.signingStartedAt());
                setLong(ps, 19, s.completedAt());
                setLong(ps, 20, s.failedAt());
                ps.setString(21, s.errorMessage());
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public SigningSession findById(String sessionId) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM frost_signing_sessions WHERE session_id=?")) {
                ps.setString(1, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) return mapSession(rs);
                    return null;
                }
            }
        });
    }

    @Override
    public WriteOutcome commitNonce(NonceCommitment row, SigningSession next, long expectedUpdatedAt) {
        return db.inTransaction(conn -> {
            WriteOutcome dup = duplicateCheck(conn, row);
            if (dup != null) throw new SqliteDatabase.Rollback(dup);
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO frost_nonce_commitments(session_id,participant_id,nonce_commitment,nonce_used,created_at) " +
                            "VALUES(?,?,?,0,?)")) {
                ps.setString(1, row.sessionId());
                ps.setString(2, row.participantId());
                ps.setString(3, row.commitment());
                ps.setLong(4, row.createdAt());
                ps.executeUpdate();
            } catch (SQLException e) {
                // another writer got in between the check and the insert; the constraint decides
                WriteOutcome raced = duplicateCheck(conn, row);
                if (raced != null) throw new SqliteDatabase.Rollback(raced);
                throw e;
            }
            if (!writeSession(conn, next, expectedUpdatedAt)) throw new SqliteDatabase.Rollback(WriteOutcome.STALE);
            return WriteOutcome.APPLIED;
        });
    }

    private WriteOutcome duplicateCheck(Connection conn, NonceCommitment row) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM frost_nonce_commitments WHERE nonce_commitment=?")) {
            ps.setString(1, row.commitment());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return WriteOutcome.DUPLICATE_NONCE;
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM frost_nonce_commitments WHERE session_id=? AND participant_id=?")) {
            ps.setString(1, row.sessionId());
            ps.setString(2, row.participantId());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return WriteOutcome.DUPLICATE_PARTICIPANT;
            }
        }
        return null;
    }

    @Override
    public WriteOutcome commitSignatureShare(String participantId, String commitment, long usedAt,
                                             SigningSession next, long expectedUpdatedAt) {
        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE frost_nonce_commitments SET nonce_used=1, used_at=? " +
                            "WHERE session_id=? AND participant_id=? AND nonce_commitment=? AND nonce_used=0")) {
                ps.setLong(1, usedAt);
                ps.setString(2, next.sessionId());
                ps.setString(3, participantId);
                ps.setString(4, commitment);
                if (ps.executeUpdate() != 1) throw new SqliteDatabase.Rollback(WriteOutcome.NONCE_ALREADY_USED);
            }
            if (!writeSession(conn, next, expectedUpdatedAt)) throw new SqliteDatabase.Rollback(WriteOutcome.STALE);
            return WriteOutcome.APPLIED;
        });
    }

    @Override
    public boolean updateSession(SigningSession next, long expectedUpdatedAt) {
        return db.query(conn -> writeSession(conn, next, expectedUpdatedAt));
    }

    private boolean writeSession(Connection conn, SigningSession s, long expectedUpdatedAt) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE frost_signing_sessions SET nonce_commitments=?, partial_signatures=?, final_signature=?, status=?, " +
                        "publication_id=?, updated_at=?, nonce_collection_started_at=?, signing_started_at=?, completed_at=?, " +
                        "failed_at=?, error_message=? WHERE session_id=? AND updated_at=?")) {
            ps.setString(1, json(s.nonceCommitments()));
            ps.setString(2, json(s.partialSignatures()));
            ps.setString(3, s.finalSignature() == null ? null : json(s.finalSignature()));
            ps.setString(4, s.status().dbValue());
            ps.setString(5, s.publicationId());
            ps.setLong(6, s.updatedAt());
            setLong(ps, 7, s.nonceCollectionStartedAt());
            setLong(ps, 8, s.signingStartedAt());
            setLong(ps, 9, s.completedAt());
            setLong(ps, 10, s.failedAt());
            ps.setString(11, s.errorMessage());
            ps.setString(12, s.sessionId());
            ps.setLong(13, expectedUpdatedAt);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean transitionStatus(String sessionId, SessionStatus from, SessionStatus to, long now) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE frost_signing_sessions SET status=?, updated_at=" + NEXT_TOKEN +
                            " WHERE session_id=? AND status=? AND expires_at >= ?")) {
                ps.setString(1, to.dbValue());
                ps.setLong(2, now);
                ps.setString(3, sessionId);
                ps.setString(4, from.dbValue());
                ps.setLong(5, now);
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean completeSession(String sessionId, FinalSignature signature, long now) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE frost_signing_sessions SET final_signature=?, status='completed', completed_at=?, " +
                            "updated_at=" + NEXT_TOKEN + " WHERE session_id=? AND status='aggregating'")) {
                ps.setString(1, json(signature));
                ps.setLong(2, now);
                ps.setLong(3, now);
                ps.setString(4, sessionId);
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean markFailed(String sessionId, String reason, long now) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE frost_signing_sessions SET status='failed', error_message=?, failed_at=?, " +
                            "updated_at=" + NEXT_TOKEN + " WHERE session_id=? AND status IN " + OPEN_STATES)) {
                ps.setString(1, reason);
                ps.setLong(2, now);
                ps.setLong(3, now);
                ps.setString(4, sessionId);
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean markExpired(String sessionId, long now) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE frost_signing_sessions SET status='expired', error_message='Session expired due to timeout', " +
                            "failed_at=?, updated_at=" + NEXT_TOKEN + " WHERE session_id=? AND expires_at < ? " +
                            "AND status IN " + OPEN_STATES)) {
                ps.setLong(1, now);
                ps.setLong(2, now);
                ps.setString(3, sessionId);
                ps.setLong(4, now);
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public int expireSessions(long now) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE frost_signing_sessions SET status='expired', error_message='Session expired due to timeout', " +
                            "failed_at=?, updated_at=" + NEXT_TOKEN + " WHERE expires_at < ? AND status IN " + OPEN_STATES)) {
                ps.setLong(1, now);
                ps.setLong(2, now);
                ps.setLong(3, now);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public int deleteTerminalSessionsCreatedBefore(long cutoff) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "DELETE FROM frost_signing_sessions WHERE status IN " + TERMINAL_STATES + " AND created_at < ?")) {
                ps.setLong(1, cutoff);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public boolean recordPublication(String sessionId, String publicationId, long expectedUpdatedAt, long now) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE frost_signing_sessions SET publication_id=?, updated_at=" + NEXT_TOKEN +
                            " WHERE session_id=? AND updated_at=? AND status='completed'")) {
                ps.setString(1, publicationId);
                ps.setLong(2, now);
                ps.setString(3, sessionId);
                ps.setLong(4, expectedUpdatedAt);
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public List<SigningSession> listActiveSessions(String groupId) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT * FROM frost_signing_sessions WHERE group_id=? AND status IN " + OPEN_STATES +
                            " ORDER BY created_at DESC")) {
                ps.setString(1, groupId);
                return mapAll(ps);
            }
        });
    }

    @Override
    public List<SigningSession> listPendingSessionsFor(String participantId) {
        List<SigningSession> candidates = db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT * FROM frost_signing_sessions WHERE status IN ('pending','nonce_collection') ORDER BY created_at DESC")) {
                return mapAll(ps);
            }
        });
        List<SigningSession> out = new ArrayList<>();
        for (SigningSession s : candidates) {
            if (s.hasParticipant(participantId) && !s.nonceCommitments().containsKey(participantId)) out.add(s);
        }
        return out;
    }

    // ---------- Nonce ledger ----------
    @Override
    public List<NonceCommitment> listNonceCommitments(String sessionId) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT * FROM frost_nonce_commitments WHERE session_id=? ORDER BY id ASC")) {
                ps.setString(1, sessionId);
                List<NonceCommitment> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new NonceCommitment(
                                rs.getString("session_id"),
                                rs.getString("participant_id"),
                                rs.getString("nonce_commitment"),
                                rs.getInt("nonce_used") == 1,
                                rs.getLong("created_at"),
                                getLong(rs, "used_at")
                        ));
                    }
                }
                return out;
            }
        });
    }

    @Override
    public boolean isCommitmentKnown(String commitment) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM frost_nonce_commitments WHERE nonce_commitment=?")) {
                ps.setString(1, commitment);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    // ---------- Mapping ----------
    private List<SigningSession> mapAll(PreparedStatement ps) throws SQLException {
        List<SigningSession> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(mapSession(rs));
        }
        return out;
    }

    private SigningSession mapSession(ResultSet rs) throws SQLException {
        String id = rs.getString("session_id");
        String finalSig = rs.getString("final_signature");
        return new SigningSession(
                id,
                rs.getString("group_id"),
                rs.getString("message_hash"),
                rs.getString("message_template"),
                rs.getString("event_type"),
                rs.getString("created_by"),
                readList(id, rs.getString("participants")),
                rs.getInt("threshold"),
                readMap(id, rs.getString("nonce_commitments")),
                readMap(id, rs.getString("partial_signatures")),
                finalSig == null ? null : readSignature(id, finalSig),
                SessionStatus.fromDb(rs.getString("status")),
                rs.getString("publication_id"),
                rs.getLong("created_at"),
                rs.getLong("updated_at"),
                rs.getLong("expires_at"),
                getLong(rs, "nonce_collection_started_at"),
                getLong(rs, "signing_started_at"),
                getLong(rs, "completed_at"),
                getLong(rs, "failed_at"),
                rs.getString("error_message")
        );
    }

    private List<String> readList(String id, String col) {
        try {
            List<String> list = mapper.readValue(col, LIST);
            if (list == null || list.contains(null)) throw new StoreException("null participant in session " + id, null);
            return list;
        } catch (JsonProcessingException e) {
            throw new StoreException("corrupt participants column in session " + id, e);
        }
    }

    private Map<String, String> readMap(String id, String col) {
        try {
            Map<String, String> map = mapper.readValue(col, MAP);
            if (map == null || map.containsValue(null)) throw new StoreException("null entry in session " + id, null);
            return map;
        } catch (JsonProcessingException e) {
            throw new StoreException("corrupt map column in session " + id, e);
        }
    }

    private FinalSignature readSignature(String id, String col) {
        try {
            FinalSignature sig = mapper.readValue(col, FinalSignature.class);
            if (sig.r() == null || sig.s() == null) throw new StoreException("incomplete final signature in session " + id, null);
            return sig;
        } catch (JsonProcessingException e) {
            throw new StoreException("corrupt final_signature column in session " + id, e);
        }
    }

    private String json(Object o) {
        try {
            return mapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new StoreException("cannot serialize " + o.getClass().getSimpleName(), e);
        }
    }

    static void setLong(PreparedStatement ps, int idx, Long v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.INTEGER);
        else ps.setLong(idx, v);
    }

    static Long getLong(ResultSet rs, String col) throws SQLException {
        long v = rs.getLong(col);
        return rs.wasNull() ? null : v;
    }
}
