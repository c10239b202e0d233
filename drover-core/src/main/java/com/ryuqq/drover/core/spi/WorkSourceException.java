package com.ryuqq.drover.core.spi;

/**
 * Work Source 호출 실패 (연결 불가, 응답 오류, 항목 없음).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WorkSourceException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public WorkSourceException(String message) {
        super(message);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public WorkSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
