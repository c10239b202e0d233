package com.ryuqq.drover.adapter.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.ryuqq.drover.core.model.RunId;
import com.ryuqq.drover.core.model.TaskId;
import com.ryuqq.drover.core.model.WorkManifest;
import com.ryuqq.drover.core.spi.CheckpointException;

/**
 * 매니페스트 스냅샷을 실행 기록에 저장할 JSON 문자열로 변환합니다.
 *
 * <p>저장된 JSON은 감사 용도의 불투명 값이며 다시 읽어 실행을 재개하지 않으므로
 * 역직렬화는 제공하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ManifestCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new SimpleModule("drover-ids")
            .addSerializer(TaskId.class, ToStringSerializer.instance)
            .addSerializer(RunId.class, ToStringSerializer.instance))
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ManifestCodec() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 매니페스트를 JSON으로 직렬화.
     *
     * @param manifest 매니페스트
     * @return JSON 문자열
     * @throws IllegalArgumentException manifest가 null인 경우
     * @throws CheckpointException 직렬화에 실패한 경우
     */
    public static String toJson(WorkManifest manifest) {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        try {
            return MAPPER.writeValueAsString(manifest);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to serialize manifest", e);
        }
    }
}
