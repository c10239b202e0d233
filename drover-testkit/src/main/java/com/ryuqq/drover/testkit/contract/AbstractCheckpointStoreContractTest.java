package com.ryuqq.drover.testkit.contract;

import com.ryuqq.drover.core.model.RunId;
import com.ryuqq.drover.core.model.RunResult;
import com.ryuqq.drover.core.model.TaskId;
import com.ryuqq.drover.core.model.WorkManifest;
import com.ryuqq.drover.core.spi.CheckpointException;
import com.ryuqq.drover.core.spi.CheckpointStore;
import com.ryuqq.drover.core.spi.RunRecord;
import com.ryuqq.drover.testkit.fixture.TaskFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Abstract base class for {@link CheckpointStore} contract tests.
 *
 * <p>Every backend extends this class once and only supplies a fresh, empty store. The
 * inherited tests pin the record semantics all backends must share:</p>
 * <ul>
 *   <li>startRun creates an in-progress record carrying the manifest snapshot</li>
 *   <li>completeRun seals the record with the final counters</li>
 *   <li>starting an existing run or completing an unknown run is rejected</li>
 *   <li>listRuns returns the most recent run first</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class SqliteCheckpointStoreContractTest extends AbstractCheckpointStoreContractTest {
 *     {@literal @}Override
 *     protected CheckpointStore createStore() {
 *         return new SqliteCheckpointStore(tempDir.resolve("drover.db"));
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractCheckpointStoreContractTest {

    protected CheckpointStore store;

    /**
     * Creates the store under test. Called before each test; the store must be empty.
     *
     * @return store under test
     */
    protected abstract CheckpointStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
        store.init();
    }

    // ============================================================
    // 1. startRun / getRun
    // ============================================================

    @Test
    void startRun_진행_중_기록을_생성함() {
        // given
        RunId runId = RunId.generate();
        WorkManifest manifest = TaskFixtures.readyManifest(3);

        // when
        store.startRun(runId, manifest);

        // then
        RunRecord record = store.getRun(runId).orElseThrow();
        assertThat(record.id()).isEqualTo(runId);
        assertThat(record.startedAt()).isNotNull();
        assertThat(record.completedAt()).isNull();
        assertThat(record.success()).isNull();
        assertThat(record.isCompleted()).isFalse();
        assertThat(record.tasksTotal()).isEqualTo(3);
        assertThat(record.tasksCompleted()).isZero();
        assertThat(record.tasksFailed()).isZero();
    }

    @Test
    void startRun_매니페스트_스냅샷을_보관함() {
        // given
        RunId runId = RunId.generate();
        WorkManifest manifest = TaskFixtures.manifestOf(TaskFixtures.ready("bd-a1", 2));

        // when
        store.startRun(runId, manifest);

        // then
        String snapshot = store.getRun(runId).orElseThrow().manifest();
        assertThat(snapshot).isNotBlank().contains("bd-a1");
    }

    @Test
    void startRun_같은_RunId로_두_번_시작하면_예외_발생() {
        // given
        RunId runId = RunId.generate();
        store.startRun(runId, TaskFixtures.readyManifest(1));

        // when & then
        assertThatThrownBy(() -> store.startRun(runId, TaskFixtures.readyManifest(1)))
            .isInstanceOf(CheckpointException.class);
    }

    @Test
    void getRun_없는_RunId면_empty() {
        // when
        Optional<RunRecord> record = store.getRun(RunId.generate());

        // then
        assertThat(record).isEmpty();
    }

    // ============================================================
    // 2. completeRun
    // ============================================================

    @Test
    void completeRun_최종_카운트와_완료_시각을_기록함() {
        // given
        RunId runId = RunId.generate();
        store.startRun(runId, TaskFixtures.readyManifest(3));
        RunResult result = RunResult.of(2, 1, List.of(), Duration.ofSeconds(42));

        // when
        store.completeRun(runId, result);

        // then
        RunRecord record = store.getRun(runId).orElseThrow();
        assertThat(record.tasksTotal()).isEqualTo(3);
        assertThat(record.tasksCompleted()).isEqualTo(2);
        assertThat(record.tasksFailed()).isEqualTo(1);
        assertThat(record.completedAt()).isNotNull();
        assertThat(record.completedAt()).isAfterOrEqualTo(record.startedAt());
        assertThat(record.success()).isFalse();
        assertThat(record.isCompleted()).isTrue();
    }

    @Test
    void completeRun_성공한_실행은_success_true() {
        // given
        RunId runId = RunId.generate();
        store.startRun(runId, TaskFixtures.readyManifest(1));

        // when
        store.completeRun(runId, RunResult.of(1, 0, List.of(), Duration.ofSeconds(1)));

        // then
        assertThat(store.getRun(runId).orElseThrow().success()).isTrue();
    }

    @Test
    void completeRun_차단된_채_끝난_실행은_success_false() {
        // given
        RunId runId = RunId.generate();
        store.startRun(runId, TaskFixtures.readyManifest(1));

        // when
        store.completeRun(runId, RunResult.of(0, 0, List.of(TaskId.of("bd-123")), Duration.ofSeconds(1)));

        // then
        assertThat(store.getRun(runId).orElseThrow().success()).isFalse();
    }

    @Test
    void completeRun_없는_RunId면_예외_발생() {
        // when & then
        assertThatThrownBy(() -> store.completeRun(RunId.generate(), RunResult.of(0, 0, List.of(), Duration.ZERO)))
            .isInstanceOf(CheckpointException.class);
    }

    // ============================================================
    // 3. listRuns / init
    // ============================================================

    @Test
    void listRuns_최근_실행이_먼저_옴() throws InterruptedException {
        // given
        RunId first = RunId.generate();
        RunId second = RunId.generate();
        RunId third = RunId.generate();
        store.startRun(first, TaskFixtures.readyManifest(1));
        Thread.sleep(15);
        store.startRun(second, TaskFixtures.readyManifest(1));
        Thread.sleep(15);
        store.startRun(third, TaskFixtures.readyManifest(1));

        // when
        List<RunRecord> runs = store.listRuns();

        // then
        assertThat(runs).extracting(RunRecord::id).containsExactly(third, second, first);
    }

    @Test
    void listRuns_기록이_없으면_빈_목록() {
        // when & then
        assertThat(store.listRuns()).isEmpty();
    }

    @Test
    void init_반복_호출해도_기존_기록을_유지함() {
        // given
        RunId runId = RunId.generate();
        store.startRun(runId, TaskFixtures.readyManifest(1));

        // when & then
        assertThatCode(() -> store.init()).doesNotThrowAnyException();
        assertThat(store.getRun(runId)).isPresent();
    }
}
