package com.narraflow.narraflow_backend.collab;

import com.narraflow.narraflow_backend.config.CollaborationProperties;
import com.narraflow.narraflow_backend.exception.SessionNotJoinedException;
import com.narraflow.narraflow_backend.model.collab.FlowEvent;
import com.narraflow.narraflow_backend.model.collab.FlowEventType;
import com.narraflow.narraflow_backend.model.collab.SessionUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowSessionRegistryTest {

    private final UUID flowId = UUID.randomUUID();

    private FakeLeaseClock clock;
    private RecordingEventPublisher publisher;
    private CollaborationProperties properties;
    private FlowSessionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new FakeLeaseClock();
        publisher = new RecordingEventPublisher();
        properties = new CollaborationProperties();
        registry = new FlowSessionRegistry(publisher, clock, properties);
    }

    @Test
    void firstJoinOpensTheFlowAndLastLeaveClosesIt() {
        registry.join(flowId, "s1", SessionUser.of("u1", "Ana", null));
        registry.join(flowId, "s2", SessionUser.of("u2", "Ben", null));
        assertThat(registry.openFlowCount()).isEqualTo(1);

        assertThat(registry.leave(flowId, "s1")).isTrue();
        assertThat(registry.find(flowId)).isPresent();

        assertThat(registry.leave(flowId, "s2")).isTrue();
        assertThat(registry.find(flowId)).isEmpty();
        assertThat(registry.leave(flowId, "s2")).isFalse();
    }

    @Test
    void joinAndLeaveBroadcastPresenceDiffs() {
        registry.join(flowId, "s1", SessionUser.of("u1", "Ana", null));
        registry.join(flowId, "s2", SessionUser.of("u2", "Ben", null));
        registry.leave(flowId, "s1");

        List<FlowEvent> diffs = publisher.eventsOfType(FlowEventType.PRESENCE_DIFF);
        assertThat(diffs).hasSize(3);
        assertThat(diffs.get(2).payload()).containsEntry("leaves", List.of("s1"));
    }

    @Test
    void leavingReleasesTheSessionsLeases() {
        FlowSession session = registry.join(flowId, "s1", SessionUser.of("u1", "Ana", null));
        registry.join(flowId, "s2", SessionUser.of("u2", "Ben", null));
        UUID nodeId = UUID.randomUUID();
        session.acquire(nodeId, "s1");

        registry.disconnect("s1");

        assertThat(session.liveLease(nodeId)).isEmpty();
        assertThat(session.acquire(nodeId, "s2").sessionId()).isEqualTo("s2");
    }

    @Test
    void joiningAnotherFlowLeavesThePreviousOne() {
        UUID otherFlow = UUID.randomUUID();
        registry.join(flowId, "s1", SessionUser.of("u1", "Ana", null));

        registry.join(otherFlow, "s1", SessionUser.of("u1", "Ana", null));

        assertThat(registry.find(flowId)).isEmpty();
        assertThat(registry.find(otherFlow)).isPresent();
    }

    @Test
    void requireRejectsSessionsThatDidNotJoin() {
        registry.join(flowId, "s1", SessionUser.of("u1", "Ana", null));

        assertThat(registry.require(flowId, "s1")).isNotNull();
        assertThatThrownBy(() -> registry.require(flowId, "s9")).isInstanceOf(SessionNotJoinedException.class);
        assertThatThrownBy(() -> registry.require(UUID.randomUUID(), "s1")).isInstanceOf(SessionNotJoinedException.class);
    }

    @Test
    void eventsForClosedFlowsCarrySequenceZero() {
        FlowEvent event = registry.broadcast(flowId, FlowEventType.FLOW_REFRESH, Map.of("reason", "restored"));

        assertThat(event.sequence()).isZero();
        assertThat(publisher.events()).containsExactly(event);
    }

    @Test
    void sweepExpiresLeasesOfAbandonedSessions() {
        FlowSession session = registry.join(flowId, "s1", SessionUser.of("u1", "Ana", null));
        registry.join(flowId, "s2", SessionUser.of("u2", "Ben", null));
        UUID nodeId = UUID.randomUUID();
        session.acquire(nodeId, "s1");

        clock.advance(properties.getLeaseTtlMs() + 1);
        session.touch("s2");
        registry.sweep();

        assertThat(session.liveLease(nodeId)).isEmpty();
        assertThat(session.acquire(nodeId, "s2").sessionId()).isEqualTo("s2");
    }

    @Test
    void sweepDropsIdleSessions() {
        registry.join(flowId, "s1", SessionUser.of("u1", "Ana", null));

        clock.advance(properties.getSessionTimeoutMs() + 1);
        registry.sweep();

        assertThat(registry.find(flowId)).isEmpty();
    }

    @Test
    void flowLockRunsTheAction() {
        assertThat(registry.withFlowLock(flowId, () -> "done")).isEqualTo("done");
    }
}
