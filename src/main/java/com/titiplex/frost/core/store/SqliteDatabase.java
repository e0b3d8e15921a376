package com.titiplex.frost.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Owns the single SQLite connection shared by the stores. Callers synchronize on this
 * object around every statement or transaction.
 */
@Component
public class SqliteDatabase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SqliteDatabase.class);
    private static final String PREFIX = "jdbc:sqlite:";

    private final Connection conn;

    public SqliteDatabase(@Value("${frost.store.url:jdbc:sqlite:${user.home}/.frost-coordinator/frost.sqlite}") String url) {
        try {
            String file = url.startsWith(PREFIX) ? url.substring(PREFIX.length()) : "";
            if (!file.isEmpty() && !file.startsWith(":memory:")) {
                Path parent = Path.of(file).toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
            }
            conn = DriverManager.getConnection(url);
            try (Statement st = conn.createStatement()) {
                st.execute("PRAGMA foreign_keys = ON");
                st.execute("PRAGMA busy_timeout = 5000");
            }
            log.info("Opened FROST store at {}", url);
        } catch (Exception e) {
            throw new StoreException("cannot open store " + url, e);
        }
    }

    /**
     * Runs {@code work} inside one transaction. Any exception rolls back; a
     * {@link Rollback} carries a result out after rolling back.
     */
    public synchronized <T> T inTransaction(TxWork<T> work) {
        try {
            conn.setAutoCommit(false);
            try {
                T out = work.run(conn);
                conn.commit();
                return out;
            } catch (Rollback rb) {
                conn.rollback();
                @SuppressWarnings("unchecked") T out = (T) rb.result;
                return out;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("transaction failed", e);
        }
    }

    public synchronized <T> T query(TxWork<T> work) {
        try {
            return work.run(conn);
        } catch (SQLException e) {
            throw new StoreException("query failed", e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Closing store failed: {}", e.getMessage());
        }
    }

    @FunctionalInterface
    public interface TxWork<T> {
        T run(Connection conn) throws SQLException;
    }

    /**
     * Abort the current transaction and return {@code result} to the caller.
     */
    public static final class Rollback extends RuntimeException {
        private final Object result;

        public Rollback(Object result) {
            super(null, null, false, false);
            this.result = result;
        }
    }
}
