package com.ryuqq.drover.adapter.inmemory.checkpoint;

import com.ryuqq.drover.core.model.RunId;
import com.ryuqq.drover.core.model.RunResult;
import com.ryuqq.drover.core.model.WorkManifest;
import com.ryuqq.drover.core.spi.CheckpointException;
import com.ryuqq.drover.core.spi.CheckpointStore;
import com.ryuqq.drover.core.spi.RunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 메모리 기반 {@link CheckpointStore}.
 *
 * <p>테스트, dry run, 임베딩 용도입니다. 프로세스가 종료되면 기록이 사라집니다.</p>
 *
 * <p>매니페스트는 생성자로 받은 serializer로 문자열화합니다. 기본 serializer는
 * record의 문자열 표현을 그대로 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCheckpointStore.class);

    private final ConcurrentHashMap<RunId, RunRecord> runs = new ConcurrentHashMap<>();
    private final Function<WorkManifest, String> manifestSerializer;
    private final Clock clock;

    public InMemoryCheckpointStore() {
        this(String::valueOf, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param manifestSerializer 매니페스트 직렬화 함수
     * @param clock 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public InMemoryCheckpointStore(Function<WorkManifest, String> manifestSerializer, Clock clock) {
        if (manifestSerializer == null) {
            throw new IllegalArgumentException("manifestSerializer cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.manifestSerializer = manifestSerializer;
        this.clock = clock;
    }

    @Override
    public void init() {
        log.debug("In-memory checkpoint store ready ({} runs)", runs.size());
    }

    @Override
    public void startRun(RunId runId, WorkManifest manifest) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        RunRecord record = new RunRecord(runId, clock.instant(), null, null,
            manifest.totalTasks(), 0, 0, manifestSerializer.apply(manifest));
        if (runs.putIfAbsent(runId, record) != null) {
            throw new CheckpointException("Run already exists: " + runId);
        }
    }

    @Override
    public void completeRun(RunId runId, RunResult result) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        RunRecord updated = runs.computeIfPresent(runId, (id, started) -> new RunRecord(
            id,
            started.startedAt(),
            clock.instant(),
            result.success(),
            started.tasksTotal(),
            result.tasksCompleted(),
            result.tasksFailed(),
            started.manifest()
        ));
        if (updated == null) {
            throw new CheckpointException("Run not found: " + runId);
        }
    }

    @Override
    public List<RunRecord> listRuns() {
        return runs.values().stream()
            .sorted(Comparator.comparing(RunRecord::startedAt).reversed())
            .toList();
    }

    @Override
    public Optional<RunRecord> getRun(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        return Optional.ofNullable(runs.get(runId));
    }

    /**
     * 모든 기록 삭제 (테스트 격리용).
     */
    public void clear() {
        runs.clear();
    }
}
