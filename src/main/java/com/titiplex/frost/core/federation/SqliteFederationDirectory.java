package com.titiplex.frost.core.federation;

import com.titiplex.frost.core.crypto.Secp256k1;
import com.titiplex.frost.core.store.SqliteDatabase;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Locale;

@Repository
public class SqliteFederationDirectory implements FederationDirectory {
    private final SqliteDatabase db;

    public SqliteFederationDirectory(SqliteDatabase db) {
        this.db = db;
        db.query(conn -> {
            try (Statement st = conn.createStatement()) {
                st.executeUpdate("""
                        CREATE TABLE IF NOT EXISTS family_federations (
                          group_id TEXT PRIMARY KEY,
                          name TEXT,
                          group_public_key TEXT NOT NULL
                        )
                        """);
            }
            return null;
        });
    }

    @Override
    public void registerFederation(String groupId, String name, String groupPublicKey) {
        Secp256k1.decodePublicKey(groupPublicKey); // reject keys that cannot verify anything
        db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO family_federations(group_id,name,group_public_key) VALUES(?,?,?) " +
                            "ON CONFLICT(group_id) DO UPDATE SET name=excluded.name, group_public_key=excluded.group_public_key")) {
                ps.setString(1, groupId);
                ps.setString(2, name);
                ps.setString(3, groupPublicKey.toLowerCase(Locale.ROOT));
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public String findGroupPublicKey(String groupId) {
        return db.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT group_public_key FROM family_federations WHERE group_id=?")) {
                ps.setString(1, groupId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getString(1) : null;
                }
            }
        });
    }
}
