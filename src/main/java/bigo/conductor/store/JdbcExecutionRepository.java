package bigo.conductor.store;

import bigo.conductor.exception.LedgerException;
import bigo.conductor.model.BackendClass;
import bigo.conductor.model.Execution;
import bigo.conductor.model.ExecutionStatus;
import bigo.conductor.repository.ExecutionRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static bigo.conductor.store.JdbcTaskRepository.setTimestamp;
import static bigo.conductor.store.JdbcTaskRepository.toInstant;

/**
 * JDBC implementation of ExecutionRepository.
 */
public class JdbcExecutionRepository implements ExecutionRepository {

    private final Database db;

    public JdbcExecutionRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Execution execution) {
        String sql = """
                    INSERT INTO executions (id, task_id, worker_id, backend, input_hash, output, tokens_used,
                                            cost_usd, duration_ms, status, error_msg, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, execution.id());
            ps.setString(2, execution.taskId());
            ps.setString(3, execution.workerId());
            ps.setString(4, execution.backend());
            ps.setString(5, execution.inputHash());
            ps.setString(6, execution.output());
            ps.setInt(7, execution.tokensUsed());
            ps.setDouble(8, execution.costUsd());
            ps.setLong(9, execution.durationMs());
            ps.setString(10, execution.status().dbValue());
            ps.setString(11, execution.errorMessage());
            setTimestamp(ps, 12, execution.createdAt() != null ? execution.createdAt() : Instant.now());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new LedgerException("Failed to save execution: " + execution.id(), e);
        }
    }

    @Override
    public List<Execution> findByTaskId(String taskId) {
        String sql = "SELECT * FROM executions WHERE task_id = ? ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            List<Execution> list = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    list.add(mapRow(rs));
                }
            }
            return list;
        } catch (SQLException e) {
            throw new LedgerException("Failed to find executions for task: " + taskId, e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM executions");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new LedgerException("Failed to count executions", e);
        }
    }

    @Override
    public BackendUsage usageOf(BackendClass backendClass) {
        String sql = """
                SELECT COUNT(*), COALESCE(SUM(cost_usd), 0)
                FROM executions
                WHERE backend LIKE ? AND status = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, backendClass.likePattern());
            ps.setString(2, ExecutionStatus.COMPLETED.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return new BackendUsage(rs.getInt(1), rs.getDouble(2));
            }
        } catch (SQLException e) {
            throw new LedgerException("Failed to sum executions of " + backendClass.prefix(), e);
        }
    }

    private Execution mapRow(ResultSet rs) throws SQLException {
        return new Execution(
                rs.getString("id"),
                rs.getString("task_id"),
                rs.getString("worker_id"),
                rs.getString("backend"),
                rs.getString("input_hash"),
                rs.getString("output"),
                rs.getInt("tokens_used"),
                rs.getDouble("cost_usd"),
                rs.getLong("duration_ms"),
                ExecutionStatus.fromDb(rs.getString("status")),
                rs.getString("error_msg"),
                toInstant(rs.getTimestamp("created_at")));
    }
}
