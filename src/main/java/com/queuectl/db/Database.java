package com.queuectl.db;

import org.h2.jdbcx.JdbcConnectionPool;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Connection pool for the H2 job database.
 *
 * <p>The database is opened in {@code AUTO_SERVER} mode for file URLs, so the command line
 * and every worker process can open the same file concurrently: the first process to
 * open it serves the others over TCP. All of them then share one MVCC engine, which is
 * what makes the store's conditional updates atomic across processes.</p>
 */
public class Database implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(Database.class.getName());

    private static final String DB_USER = "sa";
    private static final String DB_PASSWORD = "";
    private static final int POOL_SIZE = 10;
    private static final int CONNECTION_TIMEOUT_SECONDS = 30;
    private static final String SCHEMA_RESOURCE = "/schema.sql";

    private final String url;
    private JdbcConnectionPool connectionPool;
    private volatile boolean initialized = false;
    private volatile boolean closed = false;

    public Database(String url) {
        this.url = url;
    }

    public synchronized void initialize() throws SQLException {
        if (initialized) {
            logger.fine("Database already initialized");
            return;
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }

        logger.fine("Opening connection pool for " + url);
        connectionPool = JdbcConnectionPool.create(url, DB_USER, DB_PASSWORD);
        connectionPool.setMaxConnections(POOL_SIZE);
        connectionPool.setLoginTimeout(CONNECTION_TIMEOUT_SECONDS);

        try {
            initializeSchema();
        } catch (SQLException e) {
            connectionPool.dispose();
            connectionPool = null;
            throw e;
        }

        initialized = true;
        logger.fine("Database initialization complete");
    }

    public Connection getConnection() throws SQLException {
        if (!initialized) {
            throw new SQLException("Database not initialized. Call initialize() first.");
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }
        return connectionPool.getConnection();
    }

    // Runs each statement of schema.sql; all of them are idempotent (IF NOT EXISTS)
    private void initializeSchema() throws SQLException {
        String schema = readSchema();

        try (Connection conn = connectionPool.getConnection();
             Statement stmt = conn.createStatement()) {

            StringBuilder currentStatement = new StringBuilder();
            int executedCount = 0;

            for (String line : schema.split("\n")) {
                line = line.trim();
                if (line.startsWith("--") || line.isEmpty()) {
                    continue;
                }

                currentStatement.append(line).append(' ');

                if (line.endsWith(";")) {
                    String sql = currentStatement.toString().trim();
                    sql = sql.substring(0, sql.length() - 1).trim();
                    if (!sql.isEmpty()) {
                        stmt.execute(sql);
                        executedCount++;
                    }
                    currentStatement.setLength(0);
                }
            }

            logger.fine("Executed " + executedCount + " schema statements");
        }
    }

    private String readSchema() throws SQLException {
        try (InputStream in = Database.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new SQLException("Schema resource not found on classpath: " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema resource", e);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;

        if (connectionPool != null) {
            int active = connectionPool.getActiveConnections();
            if (active > 0) {
                logger.warning("Closing database with " + active + " connection(s) still in use");
            }
            try {
                connectionPool.dispose();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Error closing connection pool", e);
            }
        }
        logger.fine("Database closed");
    }

    public String getUrl() {
        return url;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isClosed() {
        return closed;
    }
}
