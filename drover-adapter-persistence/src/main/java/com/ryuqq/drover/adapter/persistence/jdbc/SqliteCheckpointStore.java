package com.ryuqq.drover.adapter.persistence.jdbc;

import com.ryuqq.drover.core.model.RunId;
import com.ryuqq.drover.core.spi.CheckpointException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Properties;

/**
 * 파일 기반 SQLite {@link JdbcCheckpointStore}.
 *
 * <p><strong>컬럼 매핑:</strong></p>
 * <ul>
 *   <li>id: TEXT (UUID 문자열)</li>
 *   <li>started_at, completed_at: TEXT (ISO-8601 UTC, 나노초 9자리 고정폭)</li>
 *   <li>success: INTEGER (1 / 0 / NULL)</li>
 *   <li>manifest: TEXT (JSON)</li>
 * </ul>
 *
 * <p>시각을 고정폭으로 기록하므로 문자열 정렬이 시간 순서와 일치합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SqliteCheckpointStore extends JdbcCheckpointStore {

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'").withZone(ZoneOffset.UTC);

    private final Path databaseFile;

    /**
     * 데이터베이스 파일 경로로 생성.
     *
     * @param databaseFile SQLite 파일 경로 (상위 디렉터리는 init 시 생성)
     * @throws IllegalArgumentException databaseFile이 null인 경우
     */
    public SqliteCheckpointStore(Path databaseFile) {
        this(requirePath(databaseFile), Clock.systemUTC());
    }

    SqliteCheckpointStore(Path databaseFile, Clock clock) {
        super("jdbc:sqlite:" + databaseFile, new Properties(), clock);
        this.databaseFile = databaseFile;
    }

    /**
     * JDBC URL로 생성 ({@code jdbc:sqlite:...}).
     *
     * @param jdbcUrl JDBC URL
     * @throws IllegalArgumentException jdbcUrl이 비어 있는 경우
     */
    public SqliteCheckpointStore(String jdbcUrl) {
        super(jdbcUrl, new Properties(), Clock.systemUTC());
        this.databaseFile = null;
    }

    private static Path requirePath(Path databaseFile) {
        if (databaseFile == null) {
            throw new IllegalArgumentException("databaseFile cannot be null");
        }
        return databaseFile;
    }

    @Override
    public void init() {
        Path parent = databaseFile == null ? null : databaseFile.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new CheckpointException("Failed to create database directory: " + parent, e);
            }
        }
        super.init();
    }

    @Override
    protected String createTableSql() {
        return """
            CREATE TABLE IF NOT EXISTS runs (
                id TEXT PRIMARY KEY,
                started_at TEXT NOT NULL,
                completed_at TEXT,
                success INTEGER,
                tasks_total INTEGER NOT NULL,
                tasks_completed INTEGER NOT NULL,
                tasks_failed INTEGER NOT NULL,
                manifest TEXT NOT NULL
            )
            """;
    }

    @Override
    protected void bindId(PreparedStatement ps, int index, RunId runId) throws SQLException {
        ps.setString(index, runId.toString());
    }

    @Override
    protected void bindInstant(PreparedStatement ps, int index, Instant instant) throws SQLException {
        ps.setString(index, TIMESTAMP.format(instant));
    }

    @Override
    protected void bindSuccess(PreparedStatement ps, int index, boolean success) throws SQLException {
        ps.setInt(index, success ? 1 : 0);
    }

    @Override
    protected RunId readId(ResultSet rs, String column) throws SQLException {
        return RunId.of(rs.getString(column));
    }

    @Override
    protected Instant readInstant(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value == null ? null : Instant.parse(value);
    }

    @Override
    protected Boolean readSuccess(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        if (rs.wasNull()) {
            return null;
        }
        return value != 0;
    }

    @Override
    protected String backendName() {
        return "SQLite";
    }
}
