package gpufleet.orchestrator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import gpufleet.orchestrator.model.TerminationReason;
import gpufleet.orchestrator.model.Worker;
import gpufleet.orchestrator.model.WorkerDiagnostics;
import gpufleet.orchestrator.model.WorkerMetadata;
import gpufleet.orchestrator.model.WorkerStatus;
import gpufleet.orchestrator.repository.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of WorkerRepository.
 * Every status change is a single {@code UPDATE ... WHERE id = ? AND version = ?}.
 */
public class JdbcWorkerRepository implements WorkerRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkerRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    private static final String METADATA_COLUMNS = """
            instance_id = ?, orchestrator_status = ?, ram_tier_gb = ?, storage_volume = ?,
            host = ?, ssh_port = ?, error_reason = ?, error_time = ?, diagnostics = ?,
            promoted_at = ?, terminated_at = ?, termination_reason = ?""";

    private final Database db;
    private final Clock clock;

    public JdbcWorkerRepository(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcWorkerRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public Worker insert(Worker worker) {
        String sql = """
                    INSERT INTO workers (id, status, created_at, updated_at, last_heartbeat, version)
                    VALUES (?, 'INACTIVE', ?, ?, NULL, 0)
                """;
        String metadataSql = "UPDATE workers SET " + METADATA_COLUMNS + " WHERE id = ?";

        Instant now = clock.instant();
        Instant createdAt = worker.createdAt() != null ? worker.createdAt() : now;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql);
                    PreparedStatement metaPs = conn.prepareStatement(metadataSql)) {
                ps.setString(1, worker.id());
                ps.setTimestamp(2, Timestamp.from(createdAt));
                ps.setTimestamp(3, Timestamp.from(now));
                ps.executeUpdate();

                int next = bindMetadata(metaPs, 1, worker.metadata());
                metaPs.setString(next, worker.id());
                metaPs.executeUpdate();

                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to insert worker: " + worker.id(), e);
        }

        log.debug("Registered worker {}", worker.id());
        return worker.toBuilder()
                .status(WorkerStatus.INACTIVE)
                .createdAt(createdAt)
                .updatedAt(now)
                .lastHeartbeat(null)
                .version(0)
                .build();
    }

    @Override
    public Optional<Worker> findById(String workerId) {
        String sql = "SELECT * FROM workers WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find worker: " + workerId, e);
        }
    }

    @Override
    public List<Worker> findAll() {
        String sql = "SELECT * FROM workers ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            return mapRows(rs);
        } catch (SQLException e) {
            throw new StoreException("Failed to find all workers", e);
        }
    }

    @Override
    public List<Worker> findUpdatedSince(Instant since) {
        String sql = "SELECT * FROM workers WHERE updated_at >= ? ORDER BY updated_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(since));
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find workers updated since " + since, e);
        }
    }

    @Override
    public Optional<Worker> update(Worker current, WorkerStatus status, WorkerMetadata metadata) {
        if (status != current.status() && !current.status().canTransitionTo(status)) {
            throw new IllegalStateException(
                    "Worker " + current.id() + " cannot move from " + current.status() + " to " + status);
        }

        String sql = "UPDATE workers SET status = ?, updated_at = ?, version = version + 1, "
                + METADATA_COLUMNS + " WHERE id = ? AND version = ?";

        Instant now = clock.instant();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setTimestamp(2, Timestamp.from(now));
            int next = bindMetadata(ps, 3, metadata);
            ps.setString(next, current.id());
            ps.setLong(next + 1, current.version());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                log.debug("Worker {} changed concurrently (version {}), update skipped",
                        current.id(), current.version());
                return Optional.empty();
            }

            return Optional.of(current.toBuilder()
                    .status(status)
                    .metadata(metadata)
                    .updatedAt(now)
                    .version(current.version() + 1)
                    .build());
        } catch (SQLException e) {
            throw new StoreException("Failed to update worker: " + current.id(), e);
        }
    }

    @Override
    public void recordHeartbeat(String workerId, Instant at) {
        String sql = "UPDATE workers SET last_heartbeat = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(at));
            ps.setString(2, workerId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to record heartbeat for worker: " + workerId, e);
        }
    }

    // Helper methods

    private static int bindMetadata(PreparedStatement ps, int start, WorkerMetadata m) throws SQLException {
        int i = start;
        ps.setString(i++, m.instanceId());
        ps.setString(i++, m.orchestratorStatus() != null ? m.orchestratorStatus().name() : null);
        setInteger(ps, i++, m.ramTierGb());
        ps.setString(i++, m.storageVolume());
        ps.setString(i++, m.host());
        setInteger(ps, i++, m.sshPort());
        ps.setString(i++, m.errorReason());
        setTimestamp(ps, i++, m.errorTime());
        ps.setString(i++, writeDiagnostics(m.diagnostics()));
        setTimestamp(ps, i++, m.promotedAt());
        setTimestamp(ps, i++, m.terminatedAt());
        ps.setString(i++, m.terminationReason() != null ? m.terminationReason().name() : null);
        return i;
    }

    private List<Worker> mapRows(ResultSet rs) throws SQLException {
        List<Worker> results = new ArrayList<>();
        while (rs.next()) {
            results.add(mapRow(rs));
        }
        return results;
    }

    private Worker mapRow(ResultSet rs) throws SQLException {
        String orchestratorStatus = rs.getString("orchestrator_status");
        String terminationReason = rs.getString("termination_reason");

        WorkerMetadata metadata = new WorkerMetadata(
                rs.getString("instance_id"),
                orchestratorStatus != null ? WorkerStatus.valueOf(orchestratorStatus) : null,
                getInteger(rs, "ram_tier_gb"),
                rs.getString("storage_volume"),
                rs.getString("host"),
                getInteger(rs, "ssh_port"),
                rs.getString("error_reason"),
                toInstant(rs.getTimestamp("error_time")),
                readDiagnostics(rs.getString("diagnostics")),
                toInstant(rs.getTimestamp("promoted_at")),
                toInstant(rs.getTimestamp("terminated_at")),
                terminationReason != null ? TerminationReason.valueOf(terminationReason) : null);

        return Worker.builder()
                .id(rs.getString("id"))
                .status(WorkerStatus.valueOf(rs.getString("status")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .lastHeartbeat(toInstant(rs.getTimestamp("last_heartbeat")))
                .metadata(metadata)
                .version(rs.getLong("version"))
                .build();
    }

    private static String writeDiagnostics(WorkerDiagnostics diagnostics) {
        if (diagnostics == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(diagnostics);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize diagnostics", e);
        }
    }

    private static WorkerDiagnostics readDiagnostics(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, WorkerDiagnostics.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable diagnostics column: {}", e.getMessage());
            return null;
        }
    }

    private static Integer getInteger(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static void setInteger(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
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
