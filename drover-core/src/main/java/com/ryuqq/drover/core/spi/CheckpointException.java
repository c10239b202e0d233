package com.ryuqq.drover.core.spi;

/**
 * Checkpoint Store 호출 실패 (연결, 스키마 초기화, 읽기/쓰기 오류).
 *
 * <p>실행 준비 단계(init, startRun)에서 발생하면 Worker가 생성되기 전에 실행이 중단됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CheckpointException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public CheckpointException(String message) {
        super(message);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
