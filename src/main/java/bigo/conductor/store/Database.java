package bigo.conductor.store;

import bigo.conductor.config.ConductorConfig;
import bigo.conductor.exception.LedgerException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Ledger connection pool and schema management.
 * Uses HikariCP for connection pooling; every connection runs with autocommit off.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    public static final int SCHEMA_VERSION = 1;

    private final HikariDataSource dataSource;

    public Database(ConductorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("bigo-ledger-pool");
        hikariConfig.setAutoCommit(false);

        // H2 specific settings
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Ledger pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Ledger health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Schema version recorded in the metadata table.
     */
    public int schemaVersion() {
        String sql = "SELECT \"value\" FROM metadata WHERE \"key\" = 'schema_version'";
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Integer.parseInt(rs.getString(1)) : 0;
        } catch (SQLException e) {
            throw new LedgerException("Failed to read schema version", e);
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id              VARCHAR(64) PRIMARY KEY,
                            parent_id       VARCHAR(64) REFERENCES tasks(id),
                            title           VARCHAR(1024) NOT NULL,
                            description     CLOB,
                            tier            INT DEFAULT 2,
                            status          VARCHAR(20) DEFAULT 'pending',
                            worker_backend  VARCHAR(64),
                            context_path    VARCHAR(1024),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- EXECUTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS executions (
                            id              VARCHAR(64) PRIMARY KEY,
                            task_id         VARCHAR(64) NOT NULL REFERENCES tasks(id),
                            worker_id       VARCHAR(64),
                            backend         VARCHAR(64) NOT NULL,
                            input_hash      VARCHAR(64),
                            output          CLOB,
                            tokens_used     INT DEFAULT 0,
                            cost_usd        DOUBLE DEFAULT 0,
                            duration_ms     BIGINT DEFAULT 0,
                            status          VARCHAR(20) DEFAULT 'pending',
                            error_msg       CLOB,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- VALIDATIONS (reserved for the validator quorum) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS validations (
                            id              VARCHAR(64) PRIMARY KEY,
                            execution_id    VARCHAR(64) NOT NULL REFERENCES executions(id),
                            validator_id    VARCHAR(64),
                            backend         VARCHAR(64) NOT NULL,
                            verdict         VARCHAR(20),
                            findings        CLOB,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- METADATA ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS metadata (
                            "key"           VARCHAR(128) PRIMARY KEY,
                            "value"         VARCHAR(1024),
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status ON tasks(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_tier ON tasks(tier);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_executions_task ON executions(task_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_executions_backend ON executions(backend);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_validations_execution ON validations(execution_id);");

            st.executeBatch();
            recordSchemaVersion(conn);
            conn.commit();

            log.info("Ledger schema initialized (version {})", SCHEMA_VERSION);
        } catch (SQLException e) {
            throw new LedgerException("Failed to initialize ledger schema", e);
        }
    }

    private static void recordSchemaVersion(Connection conn) throws SQLException {
        String update = "UPDATE metadata SET \"value\" = ?, updated_at = CURRENT_TIMESTAMP WHERE \"key\" = 'schema_version'";
        try (PreparedStatement ps = conn.prepareStatement(update)) {
            ps.setString(1, String.valueOf(SCHEMA_VERSION));
            if (ps.executeUpdate() > 0) {
                return;
            }
        }
        String insert = "INSERT INTO metadata (\"key\", \"value\") VALUES ('schema_version', ?)";
        try (PreparedStatement ps = conn.prepareStatement(insert)) {
            ps.setString(1, String.valueOf(SCHEMA_VERSION));
            ps.executeUpdate();
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Ledger pool closed");
        }
    }
}
