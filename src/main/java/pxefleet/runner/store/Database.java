package pxefleet.runner.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.config.RunnerConfig;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with
 * auto-commit disabled.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(RunnerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("pxefleet-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- HOSTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS hosts (
                            id              VARCHAR(64) PRIMARY KEY,
                            hostname        VARCHAR(255) NOT NULL UNIQUE,
                            mac_address     VARCHAR(32),
                            ip_address      VARCHAR(64),
                            room            VARCHAR(128),
                            host_group      VARCHAR(128)
                        );
                    """);

            // ---------- OPERATIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS operations (
                            id                  VARCHAR(64) PRIMARY KEY,
                            target_hosts        CLOB NOT NULL,
                            commands            VARCHAR(2048) NOT NULL,
                            wake_on_lan         BOOLEAN DEFAULT FALSE,
                            wake_delay_seconds  INT DEFAULT 0,
                            deferred            BOOLEAN DEFAULT FALSE,
                            status              VARCHAR(32) DEFAULT 'PENDING',
                            progress            INT DEFAULT 0,
                            completed_sessions  INT DEFAULT 0,
                            failed_sessions     INT DEFAULT 0,
                            cancelled_sessions  INT DEFAULT 0,
                            cancel_requested    BOOLEAN DEFAULT FALSE,
                            busy_polls          INT DEFAULT 0,
                            wake_until          TIMESTAMP,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at          TIMESTAMP,
                            completed_at        TIMESTAMP
                        );
                    """);

            // ---------- SESSIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS sessions (
                            id                   VARCHAR(64) PRIMARY KEY,
                            operation_id         VARCHAR(64) NOT NULL,
                            host_id              VARCHAR(64) NOT NULL,
                            hostname             VARCHAR(255),
                            commands             VARCHAR(2048) NOT NULL,
                            status               VARCHAR(32) DEFAULT 'PENDING',
                            progress             INT DEFAULT 0,
                            error_kind           VARCHAR(32),
                            error_message        VARCHAR(2048),
                            failed_command_index INT,
                            exit_code            INT,
                            log_output           CLOB,
                            heartbeat_at         TIMESTAMP,
                            created_at           TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at           TIMESTAMP,
                            completed_at         TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_hosts_room ON hosts(room);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_hosts_group ON hosts(host_group);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_operations_status ON operations(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_sessions_operation ON sessions(operation_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_sessions_host_status ON sessions(host_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_sessions_heartbeat ON sessions(status, heartbeat_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
