package com.ryuqq.drover.adapter.inmemory.source;

import com.ryuqq.drover.core.model.Epic;
import com.ryuqq.drover.core.model.Task;
import com.ryuqq.drover.core.model.TaskId;
import com.ryuqq.drover.core.model.WorkItem;
import com.ryuqq.drover.core.model.WorkManifest;
import com.ryuqq.drover.core.spi.WorkSource;
import com.ryuqq.drover.core.spi.WorkSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 메모리 기반 {@link WorkSource}.
 *
 * <p>{@link WorkItem} 목록을 작업 출처로 사용하며, 실행 중 생성/종료된 Task를 기록합니다.
 * 새로 만든 Task의 ID는 {@code mem-<n>} 형식입니다.</p>
 *
 * <p>모든 public 메서드는 인스턴스 락으로 직렬화됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryWorkSource implements WorkSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkSource.class);
    private static final String CREATED_ID_PREFIX = "mem-";
    private static final String CLOSED = "closed";
    private static final String OPEN = "open";

    private final Map<String, WorkItem> items = new LinkedHashMap<>();
    private final List<TaskId> createdTasks = new ArrayList<>();
    private final Map<TaskId, String> closedTasks = new LinkedHashMap<>();
    private int sequence;

    public InMemoryWorkSource() {
        this(List.of());
    }

    /**
     * 생성자.
     *
     * @param initialItems 초기 항목
     * @throws IllegalArgumentException initialItems가 null이거나 ID가 중복된 경우
     */
    public InMemoryWorkSource(List<WorkItem> initialItems) {
        if (initialItems == null) {
            throw new IllegalArgumentException("initialItems cannot be null");
        }
        initialItems.forEach(this::add);
    }

    /**
     * 항목 추가.
     *
     * @param item 항목
     * @throws IllegalArgumentException 같은 ID의 항목이 이미 있는 경우
     */
    public synchronized void add(WorkItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (items.putIfAbsent(item.id(), item) != null) {
            throw new IllegalArgumentException("Work item already exists: " + item.id());
        }
    }

    @Override
    public synchronized WorkManifest discoverAll() {
        return WorkManifest.assemble(List.copyOf(items.values()));
    }

    @Override
    public synchronized Epic discoverEpic(String epicId) {
        if (epicId == null || epicId.isBlank()) {
            throw new IllegalArgumentException("epicId cannot be null or blank");
        }
        WorkItem epicItem = items.get(epicId);
        if (epicItem == null || !epicItem.isEpic()) {
            throw new WorkSourceException("Epic not found: " + epicId);
        }
        List<Task> tasks = items.values().stream()
            .filter(item -> !item.isEpic() && epicId.equals(item.parent()))
            .map(item -> item.toTask(epicId))
            .toList();
        return new Epic(epicItem.id(), epicItem.title(), tasks);
    }

    @Override
    public synchronized TaskId createTask(String title) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        // 이미 등록된 ID는 건너뜀
        String id;
        do {
            sequence++;
            id = CREATED_ID_PREFIX + sequence;
        } while (items.putIfAbsent(id, WorkItem.task(id, title, 0, OPEN)) != null);
        TaskId taskId = TaskId.of(id);
        createdTasks.add(taskId);
        log.debug("Created work item {}: {}", id, title);
        return taskId;
    }

    @Override
    public synchronized void closeTask(TaskId id, String reason) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        WorkItem item = items.get(id.getValue());
        if (item == null) {
            throw new WorkSourceException("Work item not found: " + id);
        }
        items.put(item.id(), new WorkItem(item.id(), item.title(), item.description(), item.priority(), CLOSED,
            item.parent(), item.blockedBy(), item.labels(), item.epic()));
        closedTasks.put(id, reason);
        log.debug("Closed work item {}: {}", id, reason);
    }

    /**
     * 이 출처에서 생성된 Task ID (생성 순서).
     *
     * @return 불변 목록
     */
    public synchronized List<TaskId> createdTasks() {
        return List.copyOf(createdTasks);
    }

    /**
     * 종료된 Task와 종료 사유 (종료 순서).
     *
     * @return 불변 Map
     */
    public synchronized Map<TaskId, String> closedTasks() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(closedTasks));
    }

    /**
     * 현재 항목 조회.
     *
     * @param id 항목 ID
     * @return 항목 (없으면 null)
     */
    public synchronized WorkItem find(String id) {
        return items.get(id);
    }
}
