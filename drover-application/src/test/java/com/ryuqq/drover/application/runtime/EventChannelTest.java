package com.ryuqq.drover.application.runtime;

import com.ryuqq.drover.core.event.Stalled;
import com.ryuqq.drover.core.event.TaskCompleted;
import com.ryuqq.drover.core.event.WorkerEvent;
import com.ryuqq.drover.core.model.TaskId;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventChannelTest {

    @Test
    void poll_보낸_순서대로_수신함() throws InterruptedException {
        // given
        EventChannel channel = new EventChannel(10);
        WorkerEvent first = new TaskCompleted(TaskId.of("t-1"), Duration.ofSeconds(1));
        WorkerEvent second = new Stalled(Duration.ofSeconds(400));
        channel.send(first);
        channel.send(second);

        // when & then
        assertThat(channel.poll(Duration.ofMillis(10))).contains(first);
        assertThat(channel.poll(Duration.ofMillis(10))).contains(second);
    }

    @Test
    void poll_이벤트가_없으면_대기_후_empty() throws InterruptedException {
        // given
        EventChannel channel = new EventChannel(1);

        // when & then
        assertThat(channel.poll(Duration.ofMillis(10))).isEmpty();
    }

    @Test
    void offer_가득_차면_false() {
        // given
        EventChannel channel = new EventChannel(1);
        channel.offer(new Stalled(Duration.ofSeconds(1)));

        // when
        boolean accepted = channel.offer(new Stalled(Duration.ofSeconds(2)));

        // then
        assertThat(accepted).isFalse();
        assertThat(channel.size()).isEqualTo(1);
    }

    @Test
    void capacity가_0이면_예외_발생() {
        // when & then
        assertThatThrownBy(() -> new EventChannel(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("capacity must be positive (current: 0)");
    }
}
