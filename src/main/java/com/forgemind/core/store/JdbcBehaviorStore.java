package com.forgemind.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.forgemind.core.error.CollaboratorUnavailableException;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.EvolutionRunRecord;
import com.forgemind.core.model.ExecutionRecord;
import com.forgemind.core.model.SemanticVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link BehaviorStore} that keeps JSON documents in four tables:
 * current behaviors, version snapshots, the execution ledger and evolution runs.
 * <p>
 * Written against portable SQL so it runs on PostgreSQL in production and on H2 in tests.
 * The tables are created by {@link #createTables()}.
 */
public class JdbcBehaviorStore implements BehaviorStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcBehaviorStore.class);
    private static final String COLLABORATOR = "behavior-store";

    private static final List<String> CREATE_TABLES_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS forge_behaviors (
                behavior_id VARCHAR(255) NOT NULL PRIMARY KEY,
                version     VARCHAR(64)  NOT NULL,
                document    TEXT         NOT NULL,
                updated_at  TIMESTAMP    NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS forge_behavior_versions (
                behavior_id VARCHAR(255) NOT NULL,
                version     VARCHAR(64)  NOT NULL,
                document    TEXT         NOT NULL,
                saved_at    TIMESTAMP    NOT NULL,
                PRIMARY KEY (behavior_id, version)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS forge_executions (
                execution_id     VARCHAR(255) NOT NULL PRIMARY KEY,
                behavior_id      VARCHAR(255) NOT NULL,
                behavior_version VARCHAR(64),
                executed_at      TIMESTAMP    NOT NULL,
                document         TEXT         NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_forge_executions_behavior ON forge_executions (behavior_id, executed_at)",
            """
            CREATE TABLE IF NOT EXISTS forge_evolution_runs (
                run_id      VARCHAR(255) NOT NULL PRIMARY KEY,
                behavior_id VARCHAR(255) NOT NULL,
                finished_at TIMESTAMP,
                document    TEXT         NOT NULL
            )
            """
    );

    private static final String UPDATE_CURRENT_SQL = """
            UPDATE forge_behaviors SET version = ?, document = ?, updated_at = ?
            WHERE behavior_id = ?
            """;

    private static final String INSERT_CURRENT_SQL = """
            INSERT INTO forge_behaviors (version, document, updated_at, behavior_id)
            VALUES (?, ?, ?, ?)
            """;

    private static final String CAS_CURRENT_SQL = """
            UPDATE forge_behaviors SET version = ?, document = ?, updated_at = ?
            WHERE behavior_id = ? AND version = ?
            """;

    private static final String UPDATE_VERSION_SQL = """
            UPDATE forge_behavior_versions SET document = ?, saved_at = ?
            WHERE behavior_id = ? AND version = ?
            """;

    private static final String INSERT_VERSION_SQL = """
            INSERT INTO forge_behavior_versions (document, saved_at, behavior_id, version)
            VALUES (?, ?, ?, ?)
            """;

    private static final String SELECT_CURRENT_SQL = """
            SELECT document FROM forge_behaviors WHERE behavior_id = ?
            """;

    private static final String SELECT_ALL_SQL = """
            SELECT document FROM forge_behaviors ORDER BY behavior_id
            """;

    private static final String SELECT_VERSION_SQL = """
            SELECT document FROM forge_behavior_versions WHERE behavior_id = ? AND version = ?
            """;

    private static final String SELECT_VERSIONS_SQL = """
            SELECT document FROM forge_behavior_versions WHERE behavior_id = ?
            """;

    private static final String INSERT_EXECUTION_SQL = """
            INSERT INTO forge_executions (execution_id, behavior_id, behavior_version, executed_at, document)
            VALUES (?, ?, ?, ?, ?)
            """;

    private static final String SELECT_EXECUTIONS_SQL = """
            SELECT document FROM forge_executions
            WHERE behavior_id = ? AND executed_at >= ?
            ORDER BY executed_at ASC
            """;

    private static final String INSERT_RUN_SQL = """
            INSERT INTO forge_evolution_runs (run_id, behavior_id, finished_at, document)
            VALUES (?, ?, ?, ?)
            """;

    private static final String SELECT_RUNS_SQL = """
            SELECT document FROM forge_evolution_runs
            WHERE behavior_id = ?
            ORDER BY finished_at DESC
            """;

    /** SQLState class for integrity constraint violations (duplicate keys). */
    private static final String INTEGRITY_VIOLATION_CLASS = "23";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcBehaviorStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Creates the store tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String ddl : CREATE_TABLES_SQL) {
                try (PreparedStatement stmt = conn.prepareStatement(ddl)) {
                    stmt.execute();
                }
            }
        }
        log.info("Behavior store tables ensured");
    }

    @Override
    public String save(Behavior behavior) {
        String document = toJson(behavior);
        Timestamp now = Timestamp.from(Instant.now());
        inTransaction("save " + behavior.id(), conn -> {
            if (writeCurrent(conn, UPDATE_CURRENT_SQL, behavior, document, now) == 0) {
                writeCurrent(conn, INSERT_CURRENT_SQL, behavior, document, now);
            }
            writeSnapshot(conn, behavior, document, now);
            return null;
        });
        return behavior.id();
    }

    @Override
    public Optional<Behavior> load(String behaviorId) {
        return queryDocuments(SELECT_CURRENT_SQL, Behavior.class, behaviorId).stream().findFirst();
    }

    @Override
    public List<Behavior> search(String query, int limit) {
        return BehaviorSearch.rank(listAll(), query, limit);
    }

    @Override
    public boolean recordExecution(ExecutionRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_EXECUTION_SQL)) {
            stmt.setString(1, record.executionId());
            stmt.setString(2, record.behaviorId());
            stmt.setString(3, record.behaviorVersion());
            stmt.setTimestamp(4, Timestamp.from(record.timestamp()));
            stmt.setString(5, toJson(record));
            stmt.executeUpdate();
            return true;
        } catch (SQLException e) {
            if (isDuplicateKey(e)) {
                log.debug("Execution {} already recorded", record.executionId());
                return false;
            }
            throw unavailable("record execution " + record.executionId(), e);
        }
    }

    @Override
    public boolean compareAndSwap(String expectedVersion, Behavior behavior) {
        String document = toJson(behavior);
        Timestamp now = Timestamp.from(Instant.now());
        return inTransaction("compare-and-swap " + behavior.id(), conn -> {
            int updated;
            try (PreparedStatement stmt = conn.prepareStatement(CAS_CURRENT_SQL)) {
                stmt.setString(1, behavior.version());
                stmt.setString(2, document);
                stmt.setTimestamp(3, now);
                stmt.setString(4, behavior.id());
                stmt.setString(5, expectedVersion);
                updated = stmt.executeUpdate();
            }
            if (updated == 1) {
                writeSnapshot(conn, behavior, document, now);
            }
            return updated == 1;
        });
    }

    @Override
    public Optional<Behavior> loadVersion(String behaviorId, String version) {
        return queryDocuments(SELECT_VERSION_SQL, Behavior.class, behaviorId, version).stream().findFirst();
    }

    @Override
    public List<Behavior> listVersions(String behaviorId) {
        List<Behavior> snapshots = new ArrayList<>(queryDocuments(SELECT_VERSIONS_SQL, Behavior.class, behaviorId));
        snapshots.sort(Comparator.comparing(b -> SemanticVersion.parse(b.version())));
        return snapshots;
    }

    @Override
    public List<Behavior> listAll() {
        return queryDocuments(SELECT_ALL_SQL, Behavior.class);
    }

    @Override
    public List<ExecutionRecord> executions(String behaviorId, Instant since) {
        Timestamp from = Timestamp.from(since != null ? since : Instant.EPOCH);
        return queryDocuments(SELECT_EXECUTIONS_SQL, ExecutionRecord.class, behaviorId, from);
    }

    @Override
    public void saveEvolutionRun(EvolutionRunRecord run) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_RUN_SQL)) {
            stmt.setString(1, run.runId());
            stmt.setString(2, run.behaviorId());
            stmt.setTimestamp(3, run.finishedAt() != null ? Timestamp.from(run.finishedAt()) : null);
            stmt.setString(4, toJson(run));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw unavailable("save evolution run " + run.runId(), e);
        }
    }

    @Override
    public List<EvolutionRunRecord> evolutionRuns(String behaviorId, int limit) {
        return queryDocuments(SELECT_RUNS_SQL, EvolutionRunRecord.class, behaviorId).stream()
                .limit(Math.max(0, limit))
                .toList();
    }

    // ── internals ─────────────────────────────────────────────────

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    private <T> T inTransaction(String operation, SqlWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw unavailable(operation, e);
        }
    }

    private static int writeCurrent(Connection conn, String sql, Behavior behavior, String document,
                                    Timestamp now) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, behavior.version());
            stmt.setString(2, document);
            stmt.setTimestamp(3, now);
            stmt.setString(4, behavior.id());
            return stmt.executeUpdate();
        }
    }

    private static void writeSnapshot(Connection conn, Behavior behavior, String document,
                                      Timestamp now) throws SQLException {
        for (String sql : List.of(UPDATE_VERSION_SQL, INSERT_VERSION_SQL)) {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, document);
                stmt.setTimestamp(2, now);
                stmt.setString(3, behavior.id());
                stmt.setString(4, behavior.version());
                if (stmt.executeUpdate() > 0) {
                    return;
                }
            }
        }
    }

    private <T> List<T> queryDocuments(String sql, Class<T> type, Object... params) {
        List<T> results = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(fromJson(rs.getString("document"), type));
                }
            }
        } catch (SQLException e) {
            throw unavailable("query " + type.getSimpleName(), e);
        }
        return results;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    private static boolean isDuplicateKey(SQLException e) {
        return e.getSQLState() != null && e.getSQLState().startsWith(INTEGRITY_VIOLATION_CLASS);
    }

    private static CollaboratorUnavailableException unavailable(String operation, SQLException e) {
        log.error("Behavior store failed to {}: {}", operation, e.getMessage());
        return new CollaboratorUnavailableException(COLLABORATOR, operation + ": " + e.getMessage(), e);
    }
}
