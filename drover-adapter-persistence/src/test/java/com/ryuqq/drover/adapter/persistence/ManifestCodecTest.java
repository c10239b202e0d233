package com.ryuqq.drover.adapter.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.drover.core.model.Epic;
import com.ryuqq.drover.core.model.WorkManifest;
import com.ryuqq.drover.testkit.fixture.TaskFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ManifestCodec 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ManifestCodecTest {

    private final ObjectMapper reader = new ObjectMapper();

    @Test
    void toJson_TaskId는_문자열로_직렬화됨() throws Exception {
        // given
        WorkManifest manifest = TaskFixtures.manifestOf(
            TaskFixtures.ready("bd-a1", 3),
            TaskFixtures.blocked("bd-a2", "bd-a1")
        );

        // when
        JsonNode json = reader.readTree(ManifestCodec.toJson(manifest));

        // then
        assertThat(json.get("totalTasks").asInt()).isEqualTo(2);
        JsonNode tasks = json.get("standaloneTasks");
        assertThat(tasks.get(0).get("id").asText()).isEqualTo("bd-a1");
        assertThat(tasks.get(0).get("status").asText()).isEqualTo("READY");
        assertThat(tasks.get(1).get("blockedBy").get(0).asText()).isEqualTo("bd-a1");
    }

    @Test
    void toJson_Epic_소속_Task도_포함됨() throws Exception {
        // given
        Epic epic = new Epic("epic-1", "Checkout", List.of(TaskFixtures.ready("t-1", 0)));

        // when
        JsonNode json = reader.readTree(ManifestCodec.toJson(WorkManifest.ofEpic(epic)));

        // then
        assertThat(json.get("epics").get(0).get("title").asText()).isEqualTo("Checkout");
        assertThat(json.get("epics").get(0).get("tasks").get(0).get("id").asText()).isEqualTo("t-1");
    }

    @Test
    void toJson_null이면_예외_발생() {
        // when & then
        assertThatThrownBy(() -> ManifestCodec.toJson(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
