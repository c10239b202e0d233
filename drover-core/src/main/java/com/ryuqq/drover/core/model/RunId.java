package com.ryuqq.drover.core.model;

import java.util.UUID;

/**
 * 실행(run) 식별자.
 *
 * <p>Orchestrator 호출마다 새로 생성되며, Checkpoint Store의 레코드 키로 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunId {

    private final UUID value;

    private RunId(UUID value) {
        if (value == null) {
            throw new IllegalArgumentException("RunId cannot be null");
        }
        this.value = value;
    }

    /**
     * 새로운 RunId 생성 (UUID v4).
     *
     * @return RunId 인스턴스
     */
    public static RunId generate() {
        return new RunId(UUID.randomUUID());
    }

    /**
     * UUID로 RunId 생성.
     *
     * @param value UUID
     * @return RunId 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static RunId of(UUID value) {
        return new RunId(value);
    }

    /**
     * 문자열로 RunId 생성.
     *
     * @param value UUID 문자열
     * @return RunId 인스턴스
     * @throws IllegalArgumentException UUID 형식이 아닌 경우
     */
    public static RunId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RunId cannot be null or blank");
        }
        try {
            return new RunId(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("RunId is not a valid UUID: " + value, e);
        }
    }

    /**
     * UUID 값 조회.
     *
     * @return UUID
     */
    public UUID getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunId runId = (RunId) o;
        return value.equals(runId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
