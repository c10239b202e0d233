package com.ryuqq.drover.core.statemachine;

import java.util.Locale;

/**
 * Task의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>READY → COMPLETED (실행 성공)</li>
 *   <li>READY → READY (재시도 가능한 실패, 재시도 예산 남음)</li>
 *   <li>READY → FAILED (재시도 불가 또는 예산 소진)</li>
 *   <li>READY → BLOCKED (차단 요인 보고)</li>
 *   <li>BLOCKED → READY (모든 차단 요인 완료)</li>
 *   <li><strong>종료 상태는 다시 방문하지 않음 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 *          ┌──(retry)──┐
 *          ▼           │
 * ──► READY ───────────┘
 *      │  ▲
 *      │  └──(unblocked)── BLOCKED ◄──(blocked)──┐
 *      │                                         │
 *      ├─► COMPLETED (성공)                       │
 *      ├─► FAILED (영구 실패)                     │
 *      └─────────────────────────────────────────┘
 * </pre>
 *
 * <p>{@link #IN_PROGRESS}는 Work Source에서 가져온 항목에만 나타나는 수집 전용 상태입니다.
 * 실행 시작 시 READY로 재구동되며 상태 전이 로직이 부여하는 일은 없습니다.
 * claim은 상태가 아니라 Claim Registry의 할당으로만 표현됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TaskStatus {

    /**
     * 실행 대기 (claim 가능).
     */
    READY,

    /**
     * 외부에서 진행 중으로 보고된 항목 (수집 전용).
     */
    IN_PROGRESS,

    /**
     * 차단됨 (blockedBy의 모든 Task 완료 대기).
     */
    BLOCKED,

    /**
     * 완료 (성공).
     */
    COMPLETED,

    /**
     * 실패 (영구).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Work Source 상태 문자열을 내부 상태로 매핑.
     *
     * <p>매핑 규칙:</p>
     * <ul>
     *   <li>{@code open} → READY</li>
     *   <li>{@code in-progress} → IN_PROGRESS</li>
     *   <li>{@code blocked} → BLOCKED</li>
     *   <li>{@code closed} → COMPLETED</li>
     *   <li>그 외 (null 포함) → READY</li>
     * </ul>
     *
     * @param status Work Source 상태 문자열
     * @return 매핑된 TaskStatus
     */
    public static TaskStatus fromWorkSource(String status) {
        if (status == null) {
            return READY;
        }
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "in-progress" -> IN_PROGRESS;
            case "blocked" -> BLOCKED;
            case "closed" -> COMPLETED;
            default -> READY;
        };
    }
}
