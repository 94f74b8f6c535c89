package gpufleet.orchestrator.store;

import gpufleet.orchestrator.model.Task;
import gpufleet.orchestrator.model.TaskCounts;
import gpufleet.orchestrator.model.TaskStatus;
import gpufleet.orchestrator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JDBC implementation of TaskRepository.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    /**
     * Claimable filter shared by claimNext() and countWorkload(). It mirrors the
     * filter the worker agents claim with; a mismatch makes the fleet scale for
     * tasks no worker will pick up.
     */
    private static final String CLAIMABLE = "status = 'Queued'";
    private static final String IN_PROGRESS = "status = 'In Progress'";

    private final Database db;
    private final Clock clock;

    public JdbcTaskRepository(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcTaskRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    MERGE INTO tasks (id, task_type, params, status, worker_id, attempts, error_message,
                                      created_at, generation_started_at, generation_processed_at)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.taskType());
            ps.setString(3, task.params());
            ps.setString(4, task.status().label());
            ps.setString(5, task.workerId());
            ps.setInt(6, task.attempts());
            ps.setString(7, task.errorMessage());
            setTimestamp(ps, 8, task.createdAt() != null ? task.createdAt() : clock.instant());
            setTimestamp(ps, 9, task.generationStartedAt());
            setTimestamp(ps, 10, task.generationProcessedAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            List<Task> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new StoreException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public Optional<Task> claimNext(String workerId) {
        // Lock the row, then update it
        String selectSql = "SELECT * FROM tasks WHERE " + CLAIMABLE
                + " ORDER BY created_at, id LIMIT 1 FOR UPDATE";

        String updateSql = """
                    UPDATE tasks
                    SET status = 'In Progress', worker_id = ?, generation_started_at = ?,
                        attempts = attempts + 1
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement updatePs = conn.prepareStatement(updateSql)) {

                List<Task> candidates = executeQuery(selectPs);
                if (candidates.isEmpty()) {
                    conn.commit();
                    return Optional.empty();
                }

                Task task = candidates.get(0);
                Instant now = clock.instant();
                updatePs.setString(1, workerId);
                updatePs.setTimestamp(2, Timestamp.from(now));
                updatePs.setString(3, task.id());
                updatePs.executeUpdate();
                conn.commit();

                log.debug("Claimed task {} for worker {}", task.id(), workerId);

                return Optional.of(task.toBuilder()
                        .status(TaskStatus.IN_PROGRESS)
                        .workerId(workerId)
                        .generationStartedAt(now)
                        .attempts(task.attempts() + 1)
                        .build());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to claim task for worker: " + workerId, e);
        }
    }

    @Override
    public boolean complete(String taskId, String workerId) {
        String sql = """
                    UPDATE tasks
                    SET status = 'Complete', generation_processed_at = ?
                    WHERE id = ? AND worker_id = ? AND status = 'In Progress'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(clock.instant()));
            ps.setString(2, taskId);
            ps.setString(3, workerId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to complete task: " + taskId, e);
        }
    }

    @Override
    public boolean fail(String taskId, String workerId, String errorMessage) {
        String sql = """
                    UPDATE tasks
                    SET status = 'Failed', generation_processed_at = ?, error_message = ?
                    WHERE id = ? AND worker_id = ? AND status = 'In Progress'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(clock.instant()));
            ps.setString(2, errorMessage);
            ps.setString(3, taskId);
            ps.setString(4, workerId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to fail task: " + taskId, e);
        }
    }

    @Override
    public TaskCounts countWorkload() {
        String sql = "SELECT "
                + "SUM(CASE WHEN " + CLAIMABLE + " THEN 1 ELSE 0 END) AS queued, "
                + "SUM(CASE WHEN " + IN_PROGRESS + " THEN 1 ELSE 0 END) AS in_progress "
                + "FROM tasks";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            if (rs.next()) {
                return new TaskCounts(rs.getInt("queued"), rs.getInt("in_progress"));
            }
            return new TaskCounts(0, 0);
        } catch (SQLException e) {
            throw new StoreException("Failed to count workload", e);
        }
    }

    @Override
    public List<Task> findInProgressByWorker(String workerId) {
        String sql = "SELECT * FROM tasks WHERE worker_id = ? AND " + IN_PROGRESS
                + " ORDER BY generation_started_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workerId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find in-progress tasks for worker: " + workerId, e);
        }
    }

    @Override
    public List<Task> findInProgressByWorkers(Collection<String> workerIds) {
        if (workerIds.isEmpty()) {
            return List.of();
        }
        String placeholders = workerIds.stream().map(id -> "?").collect(Collectors.joining(", "));
        String sql = "SELECT * FROM tasks WHERE " + IN_PROGRESS + " AND worker_id IN (" + placeholders + ")"
                + " ORDER BY generation_started_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            for (String workerId : workerIds) {
                ps.setString(i++, workerId);
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find in-progress tasks for " + workerIds.size() + " workers", e);
        }
    }

    @Override
    public List<Task> findUnassignedInProgress(Instant startedBefore) {
        String sql = "SELECT * FROM tasks WHERE " + IN_PROGRESS
                + " AND worker_id IS NULL AND generation_started_at < ? ORDER BY generation_started_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(startedBefore));
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find unassigned in-progress tasks", e);
        }
    }

    @Override
    public Optional<Instant> lastCompletionAt(String workerId) {
        String sql = "SELECT MAX(generation_processed_at) FROM tasks WHERE worker_id = ? AND status = 'Complete'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(toInstant(rs.getTimestamp(1)));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to read last completion for worker: " + workerId, e);
        }
    }

    @Override
    public boolean resetToQueued(String taskId, String expectedWorkerId, int maxAttempts, String reason) {
        String ownerClause = expectedWorkerId != null ? "worker_id = ?" : "worker_id IS NULL";
        String sql = """
                    UPDATE tasks
                    SET status = 'Queued', worker_id = NULL, generation_started_at = NULL,
                        generation_processed_at = NULL, error_message = ?
                    WHERE id = ? AND status = 'In Progress' AND attempts < ? AND\s""" + ownerClause;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, reason);
            ps.setString(2, taskId);
            ps.setInt(3, maxAttempts);
            if (expectedWorkerId != null) {
                ps.setString(4, expectedWorkerId);
            }
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} reset to Queued: {}", taskId, reason);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to reset task: " + taskId, e);
        }
    }

    @Override
    public boolean markFailed(String taskId, String errorMessage) {
        String sql = """
                    UPDATE tasks
                    SET status = 'Failed', generation_processed_at = ?, error_message = ?
                    WHERE id = ? AND status = 'In Progress'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(clock.instant()));
            ps.setString(2, errorMessage);
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} marked as Failed: {}", taskId, errorMessage);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to mark task as failed: " + taskId, e);
        }
    }

    // Helper methods

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getString("id"))
                .taskType(rs.getString("task_type"))
                .params(rs.getString("params"))
                .status(TaskStatus.fromLabel(rs.getString("status")))
                .workerId(rs.getString("worker_id"))
                .attempts(rs.getInt("attempts"))
                .errorMessage(rs.getString("error_message"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .generationStartedAt(toInstant(rs.getTimestamp("generation_started_at")))
                .generationProcessedAt(toInstant(rs.getTimestamp("generation_processed_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
