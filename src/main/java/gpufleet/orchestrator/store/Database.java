package gpufleet.orchestrator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import gpufleet.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(OrchestratorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("gpufleet-db-pool");
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

            // ---------- WORKERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workers (
                            id                  VARCHAR(64) PRIMARY KEY,
                            status              VARCHAR(20) NOT NULL DEFAULT 'INACTIVE',
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            last_heartbeat      TIMESTAMP,
                            instance_id         VARCHAR(128),
                            orchestrator_status VARCHAR(20),
                            ram_tier_gb         INT,
                            storage_volume      VARCHAR(128),
                            host                VARCHAR(255),
                            ssh_port            INT,
                            error_reason        VARCHAR(2048),
                            error_time          TIMESTAMP,
                            diagnostics         CLOB,
                            promoted_at         TIMESTAMP,
                            terminated_at       TIMESTAMP,
                            termination_reason  VARCHAR(32),
                            version             BIGINT NOT NULL DEFAULT 0
                        );
                    """);

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id                      VARCHAR(64) PRIMARY KEY,
                            task_type               VARCHAR(128) NOT NULL,
                            params                  CLOB,
                            status                  VARCHAR(20) NOT NULL DEFAULT 'Queued',
                            worker_id               VARCHAR(64),
                            attempts                INT DEFAULT 0,
                            error_message           VARCHAR(2048),
                            created_at              TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            generation_started_at   TIMESTAMP,
                            generation_processed_at TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_workers_status ON workers(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_workers_updated ON workers(updated_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status_created ON tasks(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_worker_status ON tasks(worker_id, status);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
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
