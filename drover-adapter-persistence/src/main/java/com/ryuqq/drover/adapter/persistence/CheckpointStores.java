package com.ryuqq.drover.adapter.persistence;

import com.ryuqq.drover.adapter.persistence.jdbc.PostgresCheckpointStore;
import com.ryuqq.drover.adapter.persistence.jdbc.SqliteCheckpointStore;
import com.ryuqq.drover.core.spi.CheckpointStore;

import java.nio.file.Path;

/**
 * 연결 문자열 scheme으로 Checkpoint Store 백엔드를 선택합니다.
 *
 * <p><strong>지원 형식:</strong></p>
 * <ul>
 *   <li>{@code sqlite://<path>}, {@code jdbc:sqlite:<path>} → {@link SqliteCheckpointStore}</li>
 *   <li>{@code postgres://...}, {@code postgresql://...} → {@link PostgresCheckpointStore#fromUrl(String)}</li>
 *   <li>{@code jdbc:postgresql://...} → {@link PostgresCheckpointStore} (자격 증명은 URL 쿼리로 전달)</li>
 * </ul>
 *
 * <p>반환된 store는 아직 {@link CheckpointStore#init()}이 호출되지 않은 상태입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CheckpointStores {

    static final String SQLITE_SCHEME = "sqlite://";
    static final String SQLITE_JDBC_PREFIX = "jdbc:sqlite:";
    static final String POSTGRES_SCHEME = "postgres://";
    static final String POSTGRESQL_SCHEME = "postgresql://";
    static final String POSTGRES_JDBC_PREFIX = "jdbc:postgresql:";

    private CheckpointStores() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 연결 문자열로 Checkpoint Store 생성.
     *
     * @param url 연결 문자열
     * @return 선택된 백엔드
     * @throws IllegalArgumentException url이 비어 있거나 지원하지 않는 scheme인 경우
     */
    public static CheckpointStore connect(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
        if (url.startsWith(SQLITE_SCHEME)) {
            String path = url.substring(SQLITE_SCHEME.length());
            if (path.isBlank()) {
                throw new IllegalArgumentException("SQLite URL has no path: " + url);
            }
            return new SqliteCheckpointStore(Path.of(path));
        }
        if (url.startsWith(SQLITE_JDBC_PREFIX)) {
            return new SqliteCheckpointStore(url);
        }
        if (url.startsWith(POSTGRES_SCHEME) || url.startsWith(POSTGRESQL_SCHEME)) {
            return PostgresCheckpointStore.fromUrl(url);
        }
        if (url.startsWith(POSTGRES_JDBC_PREFIX)) {
            return new PostgresCheckpointStore(url, null, null);
        }
        throw new IllegalArgumentException("Unsupported database URL: " + url);
    }
}
