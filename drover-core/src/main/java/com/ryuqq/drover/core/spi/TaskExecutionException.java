package com.ryuqq.drover.core.spi;

/**
 * Task Runner가 보고하는 Task 수준 실패.
 *
 * <p>이 예외는 실행(run)을 중단시키지 않고, Worker에 의해 outcome 이벤트로 변환됩니다.
 * 메시지에 {@code "blocked by <ids>"}가 포함되면 차단으로 분류됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TaskExecutionException extends Exception {

    private final boolean retriable;

    /**
     * 재시도 가능한 실패 생성.
     *
     * @param message 실패 메시지
     */
    public TaskExecutionException(String message) {
        this(message, true, null);
    }

    /**
     * 재시도 가능 여부를 지정하여 생성.
     *
     * @param message 실패 메시지
     * @param retriable 재시도 가능 여부
     */
    public TaskExecutionException(String message, boolean retriable) {
        this(message, retriable, null);
    }

    /**
     * 원인을 포함하여 생성.
     *
     * @param message 실패 메시지
     * @param retriable 재시도 가능 여부
     * @param cause 원인 (null 가능)
     */
    public TaskExecutionException(String message, boolean retriable, Throwable cause) {
        super(message, cause);
        this.retriable = retriable;
    }

    /**
     * 재시도 불가능한 실패 생성.
     *
     * @param message 실패 메시지
     * @return TaskExecutionException
     */
    public static TaskExecutionException permanent(String message) {
        return new TaskExecutionException(message, false);
    }

    /**
     * 재시도 가능 여부.
     *
     * @return 재시도 가능하면 true
     */
    public boolean isRetriable() {
        return retriable;
    }
}
