package com.ryuqq.drover.application.monitor;

import com.ryuqq.drover.application.runtime.EventChannel;
import com.ryuqq.drover.application.state.RunState;
import com.ryuqq.drover.core.event.Stalled;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 진행 없음(stall) 감지기.
 *
 * <p>주기적으로 마지막 진행 시각을 확인하여 임계값을 넘으면 WARN 로그를 남기고,
 * stall 구간마다 한 번 {@link Stalled} 이벤트를 채널에 제출합니다.
 * 마지막 진행 시각이 갱신되면 다음 stall에 대해 다시 보고합니다.</p>
 *
 * <p>관찰 전용 컴포넌트이며, Task 상태를 바꾸지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StallMonitor {

    private static final Logger log = LoggerFactory.getLogger(StallMonitor.class);

    private final RunState runState;
    private final EventChannel eventChannel;
    private final Duration threshold;
    private final Duration checkInterval;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private Instant reportedProgress;

    /**
     * 생성자.
     *
     * @param runState 실행 상태
     * @param eventChannel 이벤트 채널
     * @param threshold stall 임계값
     * @param checkInterval 검사 주기
     * @param clock 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public StallMonitor(RunState runState, EventChannel eventChannel,
                        Duration threshold, Duration checkInterval, Clock clock) {
        if (runState == null) {
            throw new IllegalArgumentException("runState cannot be null");
        }
        if (eventChannel == null) {
            throw new IllegalArgumentException("eventChannel cannot be null");
        }
        if (threshold == null) {
            throw new IllegalArgumentException("threshold cannot be null");
        }
        if (checkInterval == null) {
            throw new IllegalArgumentException("checkInterval cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.runState = runState;
        this.eventChannel = eventChannel;
        this.threshold = threshold;
        this.checkInterval = checkInterval;
        this.clock = clock;
    }

    /**
     * 주기 검사 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("StallMonitor already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "drover-stall-monitor");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = checkInterval.toMillis();
        scheduler.scheduleAtFixedRate(this::checkSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * 검사 중지 (멱등).
     */
    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * 1회 검사.
     *
     * @return 이번 검사에서 Stalled 이벤트를 제출했으면 true
     */
    boolean check() {
        Instant lastProgress = runState.lastProgress();
        Duration idle = Duration.between(lastProgress, clock.instant());
        if (idle.compareTo(threshold) <= 0) {
            return false;
        }

        log.warn("Stall detected: no progress for {}s (threshold: {}s)", idle.toSeconds(), threshold.toSeconds());
        if (lastProgress.equals(reportedProgress)) {
            return false;
        }
        reportedProgress = lastProgress;
        if (!eventChannel.offer(new Stalled(idle))) {
            log.debug("Event channel full, dropping stall notification");
            return false;
        }
        return true;
    }

    private void checkSafely() {
        // 예외가 전파되면 ScheduledExecutorService가 이후 실행을 중단함
        try {
            check();
        } catch (RuntimeException e) {
            log.error("Stall check failed", e);
        }
    }
}
