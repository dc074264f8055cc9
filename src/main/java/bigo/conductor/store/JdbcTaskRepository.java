package bigo.conductor.store;

import bigo.conductor.exception.LedgerException;
import bigo.conductor.model.Backend;
import bigo.conductor.model.Task;
import bigo.conductor.model.TaskStatus;
import bigo.conductor.model.Tier;
import bigo.conductor.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC implementation of TaskRepository.
 * Status changes are single conditional UPDATE statements, so concurrent
 * writers can never move a task backwards.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO tasks (id, parent_id, title, description, tier, status, worker_backend,
                                       context_path, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        Instant now = Instant.now();
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.parentId());
            ps.setString(3, task.title());
            ps.setString(4, task.description());
            ps.setInt(5, task.tier().level());
            ps.setString(6, task.status().dbValue());
            ps.setString(7, task.backend() != null ? task.backend().id() : null);
            ps.setString(8, task.contextPath());
            setTimestamp(ps, 9, task.createdAt() != null ? task.createdAt() : now);
            setTimestamp(ps, 10, task.updatedAt() != null ? task.updatedAt() : now);

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new LedgerException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new LedgerException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public boolean updateStatus(String taskId, Set<TaskStatus> expected, TaskStatus target) {
        if (expected.isEmpty()) {
            return false;
        }
        String sql = "UPDATE tasks SET status = ?, updated_at = ? WHERE id = ? AND status IN ("
                + placeholders(expected.size()) + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            ps.setString(i++, target.dbValue());
            setTimestamp(ps, i++, Instant.now());
            ps.setString(i++, taskId);
            for (TaskStatus status : expected) {
                ps.setString(i++, status.dbValue());
            }

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} -> {}", taskId, target);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new LedgerException("Failed to update status of task: " + taskId, e);
        }
    }

    @Override
    public List<Task> findRecent(int limit) {
        String sql = "SELECT * FROM tasks ORDER BY created_at DESC, id LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<Task> tasks = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tasks.add(mapRow(rs));
                }
            }
            return tasks;
        } catch (SQLException e) {
            throw new LedgerException("Failed to list recent tasks", e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM tasks");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new LedgerException("Failed to count tasks", e);
        }
    }

    @Override
    public int countByStatuses(Set<TaskStatus> statuses) {
        if (statuses.isEmpty()) {
            return 0;
        }
        String sql = "SELECT COUNT(*) FROM tasks WHERE status IN (" + placeholders(statuses.size()) + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            for (TaskStatus status : statuses) {
                ps.setString(i++, status.dbValue());
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new LedgerException("Failed to count tasks by status", e);
        }
    }

    // ==================== Helper Methods ====================

    private Task mapRow(ResultSet rs) throws SQLException {
        String backend = rs.getString("worker_backend");
        return Task.builder()
                .id(rs.getString("id"))
                .parentId(rs.getString("parent_id"))
                .title(rs.getString("title"))
                .description(rs.getString("description"))
                .tier(Tier.fromLevel(rs.getInt("tier")))
                .status(TaskStatus.fromDb(rs.getString("status")))
                .backend(backend != null ? Backend.fromId(backend) : null)
                .contextPath(rs.getString("context_path"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    static String placeholders(int n) {
        return String.join(", ", Collections.nCopies(n, "?"));
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
