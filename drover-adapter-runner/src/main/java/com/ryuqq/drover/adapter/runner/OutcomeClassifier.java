package com.ryuqq.drover.adapter.runner;

import com.ryuqq.drover.core.event.TaskBlocked;
import com.ryuqq.drover.core.event.TaskCompleted;
import com.ryuqq.drover.core.event.TaskFailed;
import com.ryuqq.drover.core.event.WorkerEvent;
import com.ryuqq.drover.core.model.TaskId;
import com.ryuqq.drover.core.spi.TaskExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Task 실행 결과를 정확히 하나의 {@link WorkerEvent}로 변환.
 *
 * <p><strong>분류 규칙 (위에서부터 먼저 일치하는 규칙 적용):</strong></p>
 * <table>
 *   <caption>실패 메시지 분류</caption>
 *   <tr><th>조건</th><th>이벤트</th></tr>
 *   <tr><td>성공</td><td>TaskCompleted</td></tr>
 *   <tr><td>"blocked by" + 차단 요인 ID 1개 이상</td><td>TaskBlocked (ID 중복 제거, 등장 순서)</td></tr>
 *   <tr><td>"blocked by" + 인식 가능한 ID 없음</td><td>TaskFailed (재시도 불가)</td></tr>
 *   <tr><td>재시도 불가로 표시된 예외</td><td>TaskFailed (재시도 불가)</td></tr>
 *   <tr><td>"blocked" 언급 ("by" 없음)</td><td>TaskFailed (재시도 불가)</td></tr>
 *   <tr><td>그 외 (예상치 못한 런타임 예외 포함)</td><td>TaskFailed (재시도 가능)</td></tr>
 * </table>
 *
 * <p>"blocked by" 판별은 대소문자를 구분하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OutcomeClassifier {

    private static final Logger log = LoggerFactory.getLogger(OutcomeClassifier.class);

    private static final String BLOCKED_BY = "blocked by";
    private static final String BLOCKED = "blocked";

    private final Pattern blockerIdPattern;

    /**
     * 생성자.
     *
     * @param blockerIdPattern 차단 요인 ID 정규식
     * @throws IllegalArgumentException blockerIdPattern이 null인 경우
     */
    public OutcomeClassifier(String blockerIdPattern) {
        if (blockerIdPattern == null) {
            throw new IllegalArgumentException("blockerIdPattern cannot be null");
        }
        this.blockerIdPattern = Pattern.compile(blockerIdPattern);
    }

    public WorkerEvent completed(TaskId taskId, Duration elapsed) {
        return new TaskCompleted(taskId, elapsed);
    }

    /**
     * Task Runner가 보고한 실패 분류.
     *
     * @param taskId Task ID
     * @param failure 실패
     * @return TaskBlocked 또는 TaskFailed
     */
    public WorkerEvent failed(TaskId taskId, TaskExecutionException failure) {
        return classify(taskId, failure.getMessage(), failure.isRetriable());
    }

    /**
     * 예상치 못한 예외 분류 (재시도 가능).
     *
     * @param taskId Task ID
     * @param cause 예외
     * @return TaskBlocked 또는 TaskFailed
     */
    public WorkerEvent unexpected(TaskId taskId, Throwable cause) {
        String message = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
        return classify(taskId, message, true);
    }

    /**
     * 실행 제한 시간 초과 (재시도 가능).
     *
     * @param taskId Task ID
     * @param timeout 제한 시간
     * @return TaskFailed
     */
    public WorkerEvent timedOut(TaskId taskId, Duration timeout) {
        return new TaskFailed(taskId, "Task timed out after " + timeout.toSeconds() + "s", true);
    }

    WorkerEvent classify(TaskId taskId, String message, boolean retriable) {
        String text = message == null ? "" : message;
        String lower = text.toLowerCase(Locale.ROOT);

        if (lower.contains(BLOCKED_BY)) {
            Set<TaskId> blockers = extractBlockerIds(text);
            if (!blockers.isEmpty()) {
                return new TaskBlocked(taskId, blockers);
            }
            return new TaskFailed(taskId, text, false);
        }
        if (!retriable || lower.contains(BLOCKED)) {
            return new TaskFailed(taskId, text, false);
        }
        return new TaskFailed(taskId, text, true);
    }

    /**
     * 메시지 전체에서 차단 요인 ID 추출.
     *
     * <p>정규식에는 일치하지만 Task ID 형식이 아닌 토큰은 건너뜁니다.</p>
     *
     * @param message 실패 메시지
     * @return 등장 순서대로 중복 제거된 ID
     */
    Set<TaskId> extractBlockerIds(String message) {
        Set<TaskId> ids = new LinkedHashSet<>();
        Matcher matcher = blockerIdPattern.matcher(message);
        while (matcher.find()) {
            String token = matcher.group();
            try {
                ids.add(TaskId.of(token));
            } catch (IllegalArgumentException e) {
                log.debug("Skipping blocker token '{}': {}", token, e.getMessage());
            }
        }
        return ids;
    }
}
