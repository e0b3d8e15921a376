package com.titiplex.frost.core.approval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titiplex.frost.core.model.ApprovalStatus;
import com.titiplex.frost.core.model.CreateSessionRequest;
import com.titiplex.frost.core.model.PendingApproval;
import com.titiplex.frost.core.store.SqliteDatabase;
import com.titiplex.frost.core.store.StoreException;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

@Repository
public class SqliteApprovalAuditService implements ApprovalAuditService {
    private static final TypeReference<List<String>> LIST = new TypeReference<>() {
    };

    private final SqliteDatabase db;
    private final ObjectMapper mapper = new ObjectMapper();

    public SqliteApprovalAuditService(SqliteDatabase db) {
        this.db = db;
        db.query(conn -> {
            try (Statement st = conn.createStatement()) {
                st.executeUpdate("""
                        CREATE TABLE IF NOT EXISTS signing_approvals (
                          id TEXT PRIMARY KEY,
                          group_id TEXT NOT NULL,
                          requester_id TEXT NOT NULL,
                          event_type TEXT,
                          permission_id TEXT,
                          request TEXT NOT NULL,
                          required_approvals INTEGER NOT NULL,
                          approved_by TEXT NOT NULL DEFAULT '[]',
                          status TEXT NOT NULL CHECK (status IN ('pending','approved','rejected','expired')),
                          requested_at INTEGER NOT NULL,
                          expires_at INTEGER NOT NULL,
                          session_id TEXT,
                          reason TEXT
                        )
                        """);
                st.executeUpdate("CREATE INDEX IF NOT EXISTS idx_signing_approvals_group ON signing_approvals(group_id, status)");
            }
            return null;
        });
    }

    @Override
    public void open(PendingApproval a) {
        db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO signing_approvals(id,group_id,requester_id,event_type,permission_id,request," +
                            "required_approvals,approved_by,status,requested_at,expires_at,session_id,reason) " +
                            "VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)")) {
                ps.setString(1, a.id());
                ps.setString(2, a.groupId());
                ps.setString(3, a.requesterId());
                ps.setString(4, a.eventType());
                ps.setString(5, a.permissionId());
                ps.setString(6, json(a.request()));
                ps.setInt(7, a.requiredApprovals());
                ps.setString(8, json(a.approvedBy()));
                ps.setString(9, a.status().dbValue());
                ps.setLong(10, a.requestedAt());
                ps.setLong(11, a.expiresAt());
                ps.setString(12, a.sessionId());
                ps.setString(13, a.reason());
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public PendingApproval find(String approvalId) {
        return db.query(conn -> select(conn, approvalId));
    }

    @Override
    public PendingApproval addApproval(String approvalId, String approverId) {
        return db.inTransaction(conn -> {
            PendingApproval cur = select(conn, approvalId);
            if (cur == null || cur.status() != ApprovalStatus.PENDING) return null;
            if (cur.approvedBy().contains(approverId)) return cur;
            List<String> approvers = new ArrayList<>(cur.approvedBy());
            approvers.add(approverId);
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE signing_approvals SET approved_by=? WHERE id=? AND status='pending'")) {
                ps.setString(1, json(approvers));
                ps.setString(2, approvalId);
                ps.executeUpdate();
            }
            return select(conn, approvalId);
        });
    }

    @Override
    public boolean resolve(String approvalId, ApprovalStatus status, String sessionId, String reason) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE signing_approvals SET status=?, session_id=?, reason=? WHERE id=? AND status='pending'")) {
                ps.setString(1, status.dbValue());
                ps.setString(2, sessionId);
                ps.setString(3, reason);
                ps.setString(4, approvalId);
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public List<PendingApproval> listPending(String groupId) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT * FROM signing_approvals WHERE group_id=? AND status='pending' ORDER BY requested_at DESC")) {
                ps.setString(1, groupId);
                List<PendingApproval> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
                return out;
            }
        });
    }

    private PendingApproval select(Connection conn, String id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM signing_approvals WHERE id=?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? map(rs) : null;
            }
        }
    }

    private PendingApproval map(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        try {
            return new PendingApproval(
                    id,
                    rs.getString("group_id"),
                    rs.getString("requester_id"),
                    rs.getString("event_type"),
                    rs.getString("permission_id"),
                    mapper.readValue(rs.getString("request"), CreateSessionRequest.class),
                    rs.getInt("required_approvals"),
                    mapper.readValue(rs.getString("approved_by"), LIST),
                    ApprovalStatus.fromDb(rs.getString("status")),
                    rs.getLong("requested_at"),
                    rs.getLong("expires_at"),
                    rs.getString("session_id"),
                    rs.getString("reason")
            );
        } catch (JsonProcessingException e) {
            throw new StoreException("corrupt approval record " + id, e);
        }
    }

    private String json(Object o) {
        try {
            return mapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new StoreException("cannot serialize " + o.getClass().getSimpleName(), e);
        }
    }
}
