package com.ryuqq.drover.adapter.persistence.jdbc;

import com.ryuqq.drover.core.model.RunId;
import com.ryuqq.drover.core.model.RunResult;
import com.ryuqq.drover.core.spi.CheckpointException;
import com.ryuqq.drover.core.spi.RunRecord;
import com.ryuqq.drover.testkit.fixture.TaskFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SqliteCheckpointStore 컬럼 매핑 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SqliteCheckpointStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void 시각은_고정폭_ISO_8601_문자열로_저장됨() throws Exception {
        // given
        Path dbFile = tempDir.resolve("drover.db");
        Instant startedAt = Instant.parse("2024-05-01T10:00:00Z");
        SqliteCheckpointStore store = new SqliteCheckpointStore(dbFile, Clock.fixed(startedAt, ZoneOffset.UTC));
        store.init();
        RunId runId = RunId.generate();

        // when
        store.startRun(runId, TaskFixtures.readyManifest(1));

        // then
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbFile);
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT started_at, success FROM runs")) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getString("started_at")).isEqualTo("2024-05-01T10:00:00.000000000Z");
            rs.getInt("success");
            assertThat(rs.wasNull()).isTrue();
        }
        assertThat(store.getRun(runId)).get().extracting(RunRecord::startedAt).isEqualTo(startedAt);
    }

    @Test
    void 같은_초_안의_실행도_시간_순서대로_정렬됨() {
        // given
        Path dbFile = tempDir.resolve("drover.db");
        RunId earlier = RunId.generate();
        RunId later = RunId.generate();
        new SqliteCheckpointStore(dbFile, Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC))
            .init();
        new SqliteCheckpointStore(dbFile, Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC))
            .startRun(earlier, TaskFixtures.readyManifest(1));
        new SqliteCheckpointStore(dbFile, Clock.fixed(Instant.parse("2024-05-01T10:00:00.500Z"), ZoneOffset.UTC))
            .startRun(later, TaskFixtures.readyManifest(1));

        // when
        List<RunRecord> runs = new SqliteCheckpointStore(dbFile).listRuns();

        // then
        assertThat(runs).extracting(RunRecord::id).containsExactly(later, earlier);
    }

    @Test
    void success는_정수로_저장되고_Boolean으로_복원됨() {
        // given
        SqliteCheckpointStore store = new SqliteCheckpointStore(tempDir.resolve("drover.db"));
        store.init();
        RunId runId = RunId.generate();
        store.startRun(runId, TaskFixtures.readyManifest(2));

        // when
        store.completeRun(runId, RunResult.of(1, 1, List.of(), Duration.ofSeconds(3)));

        // then
        RunRecord record = store.getRun(runId).orElseThrow();
        assertThat(record.success()).isFalse();
        assertThat(record.tasksTotal()).isEqualTo(2);
        assertThat(record.tasksFailed()).isEqualTo(1);
    }

    @Test
    void init_전에_쓰면_CheckpointException_발생() {
        // given
        SqliteCheckpointStore store = new SqliteCheckpointStore(tempDir.resolve("drover.db"));

        // when & then
        assertThatThrownBy(() -> store.startRun(RunId.generate(), TaskFixtures.readyManifest(1)))
            .isInstanceOf(CheckpointException.class)
            .hasCauseInstanceOf(SQLException.class);
    }

    @Test
    void 디렉터리를_만들_수_없으면_init에서_예외_발생() throws Exception {
        // given
        Path blocker = Files.createFile(tempDir.resolve("not-a-dir"));
        SqliteCheckpointStore store = new SqliteCheckpointStore(blocker.resolve("drover.db"));

        // when & then
        assertThatThrownBy(store::init)
            .isInstanceOf(CheckpointException.class)
            .hasMessageContaining("directory");
    }
}
