package de.bsommerfeld.tscache.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Connection source for the SQLite snapshot database.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed right after.
 * SQLite serialises writes at the file level, so pooling buys nothing.
 * Ordinary connections start {@code DEFERRED} transactions; connections from
 * {@link #getExclusiveConnection()} start {@code IMMEDIATE} ones, which take
 * the write lock up front. The migration utility relies on that to keep
 * concurrent writers out while it rewrites a subject.
 *
 * <h3>Schema</h3>
 * {@code schema.sql} is applied on construction. Every statement uses
 * {@code IF NOT EXISTS}, so re-running it is harmless.
 */
public class SqliteDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteDatabase.class);

    private static final int BUSY_TIMEOUT_MILLIS = 10_000;

    private final String dbUrl;

    public SqliteDatabase(Path databaseFile) {
        this("jdbc:sqlite:" + prepare(databaseFile).toAbsolutePath());
    }

    public SqliteDatabase(String dbUrl) {
        this.dbUrl = dbUrl;
        initialize();
    }

    public String getUrl() {
        return dbUrl;
    }

    public Connection getConnection() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        return DriverManager.getConnection(dbUrl, config.toProperties());
    }

    /** A connection whose transactions begin with {@code BEGIN IMMEDIATE}. */
    public Connection getExclusiveConnection() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return DriverManager.getConnection(dbUrl, config.toProperties());
    }

    private static Path prepare(Path databaseFile) {
        Path parent = databaseFile.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StoreException("Failed to create database directory " + parent, e);
        }
        return databaseFile;
    }

    private void initialize() {
        LOG.info("[DB] Initializing Database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new StoreException("Database initialization failed", e);
        }
    }

    private void applySchema(Connection conn) throws SQLException {
        List<String> statements;
        try {
            statements = SqlLoader.schemaStatements();
        } catch (IllegalStateException e) {
            throw new StoreException("Cannot load " + SqlLoader.SCHEMA_RESOURCE, e);
        }

        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String statement : statements)
                stmt.execute(statement);
            conn.commit();
            LOG.info("[DB] Database schema applied ({} statements)", statements.size());
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        }
    }
}
