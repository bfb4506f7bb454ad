package io.treeshell.storage;

import io.treeshell.config.TreeShellConfig;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.Properties;

public final class Database {
    static final String SCHEMA_VERSION = "treeshell.schema.v1";
    private static final int BUSY_TIMEOUT_MS = 5000;

    private final TreeShellConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(TreeShellConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setBusyTimeout(BUSY_TIMEOUT_MS);
        sqlite.enforceForeignKeys(true);
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = sqlite.toProperties();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.stateDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS workflow_records (
                        path TEXT PRIMARY KEY,
                        status TEXT NOT NULL,
                        execution_count INTEGER NOT NULL DEFAULT 0,
                        failure_count INTEGER NOT NULL DEFAULT 0,
                        failures_at_approval INTEGER NOT NULL DEFAULT 0,
                        approved_by TEXT,
                        approved_at_ms INTEGER,
                        flagged_for_review INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS pending_approvals (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        path TEXT NOT NULL UNIQUE,
                        enqueued_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(path) REFERENCES workflow_records(path)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_meta (
                        meta_key TEXT PRIMARY KEY,
                        meta_value TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_workflow_records_status ON workflow_records(status, path)");
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT OR IGNORE INTO schema_meta(meta_key,meta_value,updated_at_ms) VALUES('schema_version',?,?)")) {
                ps.setString(1, SCHEMA_VERSION);
                ps.setLong(2, Instant.now().toEpochMilli());
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
        }
    }

    public String schemaVersion() {
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT meta_value FROM schema_meta WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getString(1) : null;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read schema version", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
