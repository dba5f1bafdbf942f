package io.segmentlite.engine.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves a JDBC URL to a live java.sql.Connection.
 *
 * Supports:
 * - InMemory DuckDB ({@code jdbc:duckdb:}) and SQLite ({@code jdbc:sqlite::memory:})
 * - LocalFile DuckDB and SQLite
 *
 * Connections are cached per URL so that in-memory tables persist across requests.
 */
public class ConnectionResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionResolver.class);

    // Force-load JDBC drivers at class initialization
    static {
        loadDriver("org.duckdb.DuckDBDriver");
        loadDriver("org.sqlite.JDBC");
    }

    private final Map<String, Connection> connectionCache = new ConcurrentHashMap<>();

    private static void loadDriver(String driverClass) {
        try {
            Class.forName(driverClass);
        } catch (ClassNotFoundException e) {
            logger.warn("JDBC driver {} not found in classpath", driverClass);
        }
    }

    /**
     * Resolves the given JDBC URL to a connection, reusing a cached one while it is open.
     *
     * @param jdbcUrl A duckdb or sqlite JDBC URL
     * @return A live JDBC Connection
     * @throws SQLException If connection fails
     * @throws IllegalArgumentException for a URL of another database
     */
    public Connection resolve(String jdbcUrl) throws SQLException {
        if (!jdbcUrl.startsWith("jdbc:duckdb:") && !jdbcUrl.startsWith("jdbc:sqlite:")) {
            throw new IllegalArgumentException("Unsupported JDBC URL: " + jdbcUrl);
        }
        Connection cached = connectionCache.get(jdbcUrl);
        if (cached != null && !cached.isClosed()) {
            return cached;
        }

        logger.info("Opening connection to {}", jdbcUrl);
        Connection newConn = DriverManager.getConnection(jdbcUrl);
        connectionCache.put(jdbcUrl, newConn);
        return newConn;
    }

    /**
     * Creates an in-memory DuckDB connection outside the cache.
     */
    public static Connection createInMemoryDuckDB() throws SQLException {
        return DriverManager.getConnection("jdbc:duckdb:");
    }

    /**
     * Creates an in-memory SQLite connection outside the cache.
     */
    public static Connection createInMemorySQLite() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite::memory:");
    }

    /**
     * Closes and forgets all cached connections.
     */
    public void clearCache() {
        connectionCache.forEach((url, conn) -> {
            try {
                conn.close();
            } catch (SQLException e) {
                logger.warn("Failed to close connection to {}: {}", url, e.getMessage());
            }
        });
        connectionCache.clear();
    }
}
