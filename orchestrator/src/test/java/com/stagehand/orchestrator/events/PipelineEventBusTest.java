package com.stagehand.orchestrator.events;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineEventBusTest {

    private final PipelineEventBus bus = new PipelineEventBus();

    @Test
    void publish_reachesGlobalAndMatchingTaskListeners() {
        List<String> global = new ArrayList<>();
        List<String> taskA  = new ArrayList<>();
        List<String> taskB  = new ArrayList<>();
        bus.subscribe(e -> global.add(e.taskId()));
        bus.subscribe("a", e -> taskA.add(e.toStatus()));
        bus.subscribe("b", e -> taskB.add(e.toStatus()));

        bus.publish(PipelineEvent.stage("p", "a", "e1", "pending", "running"));
        bus.publish(PipelineEvent.task("p", "b", "pending", "in_progress"));

        assertThat(global).containsExactly("a", "b");
        assertThat(taskA).containsExactly("running");
        assertThat(taskB).containsExactly("in_progress");
    }

    @Test
    void publish_throwingListener_doesNotStopOthers() {
        List<PipelineEvent> seen = new ArrayList<>();
        bus.subscribe(e -> { throw new IllegalStateException("listener bug"); });
        bus.subscribe(seen::add);

        bus.publish(PipelineEvent.task("p", "t", "pending", "failed"));

        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).type()).isEqualTo(PipelineEvent.Type.TASK_STATUS_CHANGED);
        assertThat(seen.get(0).executionId()).isNull();
    }

    @Test
    void close_unsubscribes_andIsIdempotent() {
        List<PipelineEvent> seen = new ArrayList<>();
        PipelineEventBus.Subscription global = bus.subscribe(seen::add);
        PipelineEventBus.Subscription perTask = bus.subscribe("t", seen::add);

        global.close();
        perTask.close();
        perTask.close();
        bus.publish(PipelineEvent.stage("p", "t", "e", "running", "awaiting_user"));

        assertThat(seen).isEmpty();
    }
}
