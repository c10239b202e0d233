package com.ryuqq.drover.adapter.persistence.jdbc;

import com.ryuqq.drover.adapter.persistence.ManifestCodec;
import com.ryuqq.drover.core.model.RunId;
import com.ryuqq.drover.core.model.RunResult;
import com.ryuqq.drover.core.model.WorkManifest;
import com.ryuqq.drover.core.spi.CheckpointException;
import com.ryuqq.drover.core.spi.CheckpointStore;
import com.ryuqq.drover.core.spi.RunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * JDBC 기반 {@link CheckpointStore}의 공통 골격.
 *
 * <p>SQL 흐름(스키마 생성, INSERT, UPDATE, 조회)은 이 클래스가 담당하고, 백엔드마다 다른
 * 컬럼 타입의 바인딩과 읽기만 하위 클래스가 구현합니다.</p>
 *
 * <p><strong>연결 정책:</strong> 호출마다 {@link DriverManager}로 연결을 열고 닫습니다.
 * 실행당 쓰기는 시작과 완료 두 번뿐이므로 커넥션 풀을 두지 않습니다.</p>
 *
 * <p>모든 {@link SQLException}은 {@link CheckpointException}으로 변환됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class JdbcCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStore.class);

    static final String TABLE = "runs";

    private static final String SELECT_COLUMNS =
        "SELECT id, started_at, completed_at, success, tasks_total, tasks_completed, tasks_failed, manifest FROM "
            + TABLE;

    private final String jdbcUrl;
    private final Properties connectionProperties;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param jdbcUrl JDBC URL
     * @param connectionProperties 드라이버 연결 속성 (user, password 등)
     * @param clock 시계
     * @throws IllegalArgumentException jdbcUrl이 비어 있거나 인자가 null인 경우
     */
    protected JdbcCheckpointStore(String jdbcUrl, Properties connectionProperties, Clock clock) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl cannot be null or blank");
        }
        if (connectionProperties == null) {
            throw new IllegalArgumentException("connectionProperties cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.jdbcUrl = jdbcUrl;
        this.connectionProperties = connectionProperties;
        this.clock = clock;
    }

    /**
     * runs 테이블 DDL.
     *
     * @return CREATE TABLE IF NOT EXISTS 문
     */
    protected abstract String createTableSql();

    /**
     * INSERT 문의 manifest 자리표시자 (예: {@code ?}, {@code ?::jsonb}).
     *
     * @return 자리표시자
     */
    protected String manifestPlaceholder() {
        return "?";
    }

    protected abstract void bindId(PreparedStatement ps, int index, RunId runId) throws SQLException;

    protected abstract void bindInstant(PreparedStatement ps, int index, Instant instant) throws SQLException;

    protected abstract void bindSuccess(PreparedStatement ps, int index, boolean success) throws SQLException;

    protected abstract RunId readId(ResultSet rs, String column) throws SQLException;

    /**
     * 시각 컬럼 읽기.
     *
     * @return 시각, NULL이면 null
     */
    protected abstract Instant readInstant(ResultSet rs, String column) throws SQLException;

    /**
     * 성공 여부 컬럼 읽기.
     *
     * @return 성공 여부, NULL이면 null
     */
    protected abstract Boolean readSuccess(ResultSet rs, String column) throws SQLException;

    /**
     * 백엔드 이름 (로그용).
     *
     * @return 이름
     */
    protected abstract String backendName();

    protected Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    @Override
    public void init() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute(createTableSql());
            st.execute("CREATE INDEX IF NOT EXISTS idx_runs_started_at ON " + TABLE + " (started_at)");
        } catch (SQLException e) {
            throw new CheckpointException("Failed to initialize " + backendName() + " checkpoint schema", e);
        }
        log.info("{} checkpoint store ready", backendName());
    }

    @Override
    public void startRun(RunId runId, WorkManifest manifest) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        String manifestJson = ManifestCodec.toJson(manifest);
        String sql = "INSERT INTO " + TABLE
            + " (id, started_at, tasks_total, tasks_completed, tasks_failed, manifest)"
            + " VALUES (?, ?, ?, 0, 0, " + manifestPlaceholder() + ")";

        try (Connection conn = openConnection()) {
            if (exists(conn, runId)) {
                throw new CheckpointException("Run already exists: " + runId);
            }
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                bindId(ps, 1, runId);
                bindInstant(ps, 2, clock.instant());
                ps.setInt(3, manifest.totalTasks());
                ps.setString(4, manifestJson);
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new CheckpointException("Failed to start run: " + runId, e);
        }
        log.info("Started run {}", runId);
    }

    @Override
    public void completeRun(RunId runId, RunResult result) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        String sql = "UPDATE " + TABLE
            + " SET completed_at = ?, success = ?, tasks_completed = ?, tasks_failed = ?"
            + " WHERE id = ?";

        int updated;
        try (Connection conn = openConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            bindInstant(ps, 1, clock.instant());
            bindSuccess(ps, 2, result.success());
            ps.setInt(3, result.tasksCompleted());
            ps.setInt(4, result.tasksFailed());
            bindId(ps, 5, runId);
            updated = ps.executeUpdate();
        } catch (SQLException e) {
            throw new CheckpointException("Failed to complete run: " + runId, e);
        }
        if (updated == 0) {
            throw new CheckpointException("Run not found: " + runId);
        }
        log.info("Completed run {} (success: {})", runId, result.success());
    }

    @Override
    public List<RunRecord> listRuns() {
        String sql = SELECT_COLUMNS + " ORDER BY started_at DESC";
        try (Connection conn = openConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            List<RunRecord> records = new ArrayList<>();
            while (rs.next()) {
                records.add(mapRow(rs));
            }
            return records;
        } catch (SQLException e) {
            throw new CheckpointException("Failed to list runs", e);
        }
    }

    @Override
    public Optional<RunRecord> getRun(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        try (Connection conn = openConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_COLUMNS + " WHERE id = ?")) {
            bindId(ps, 1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new CheckpointException("Failed to read run: " + runId, e);
        }
    }

    private boolean exists(Connection conn, RunId runId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM " + TABLE + " WHERE id = ?")) {
            bindId(ps, 1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private RunRecord mapRow(ResultSet rs) throws SQLException {
        return new RunRecord(
            readId(rs, "id"),
            readInstant(rs, "started_at"),
            readInstant(rs, "completed_at"),
            readSuccess(rs, "success"),
            rs.getInt("tasks_total"),
            rs.getInt("tasks_completed"),
            rs.getInt("tasks_failed"),
            rs.getString("manifest")
        );
    }
}
