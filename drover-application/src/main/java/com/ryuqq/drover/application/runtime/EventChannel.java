package com.ryuqq.drover.application.runtime;

import com.ryuqq.drover.core.event.WorkerEvent;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Worker → Orchestrator 단방향 이벤트 채널.
 *
 * <p>용량이 제한된 FIFO 큐입니다. 가득 차면 {@link #send(WorkerEvent)}는 대기하고
 * {@link #offer(WorkerEvent)}는 즉시 false를 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EventChannel {

    private final BlockingQueue<WorkerEvent> queue;

    /**
     * Constructor.
     *
     * @param capacity 최대 적재 이벤트 수
     * @throws IllegalArgumentException capacity가 0 이하인 경우
     */
    public EventChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * 이벤트 전송 (공간이 생길 때까지 대기).
     *
     * @param event 이벤트
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public void send(WorkerEvent event) throws InterruptedException {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        queue.put(event);
    }

    /**
     * 이벤트 전송 시도 (대기 없음).
     *
     * @param event 이벤트
     * @return 적재되었으면 true
     */
    public boolean offer(WorkerEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        return queue.offer(event);
    }

    /**
     * 다음 이벤트 수신.
     *
     * @param timeout 최대 대기 시간
     * @return 이벤트 (시간 내 도착하지 않으면 empty)
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public Optional<WorkerEvent> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public int size() {
        return queue.size();
    }
}
