package com.narraflow.narraflow_backend.collab;

import com.narraflow.narraflow_backend.IntegrationTestSupport;
import com.narraflow.narraflow_backend.exception.FlowNotFoundException;
import com.narraflow.narraflow_backend.exception.LockConflictException;
import com.narraflow.narraflow_backend.exception.LockRequiredException;
import com.narraflow.narraflow_backend.exception.NodeNotFoundException;
import com.narraflow.narraflow_backend.exception.SessionNotJoinedException;
import com.narraflow.narraflow_backend.exception.StructuralViolationException;
import com.narraflow.narraflow_backend.model.collab.FlowEvent;
import com.narraflow.narraflow_backend.model.collab.FlowEventType;
import com.narraflow.narraflow_backend.model.collab.FlowSnapshot;
import com.narraflow.narraflow_backend.model.collab.LeaseView;
import com.narraflow.narraflow_backend.model.collab.SessionUser;
import com.narraflow.narraflow_backend.model.domain.Flow;
import com.narraflow.narraflow_backend.model.domain.FlowNode;
import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.dto.CreateConnectionRequest;
import com.narraflow.narraflow_backend.model.dto.CreateFlowRequest;
import com.narraflow.narraflow_backend.model.dto.CreateNodeRequest;
import com.narraflow.narraflow_backend.model.dto.HubSummary;
import com.narraflow.narraflow_backend.model.dto.NodePositionRequest;
import com.narraflow.narraflow_backend.service.FlowGraphService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

class CollaborationServiceTest extends IntegrationTestSupport {

    private static final SessionUser ANA = SessionUser.of("u-ana", "Ana", "#ef4444");
    private static final SessionUser BEN = SessionUser.of("u-ben", "Ben", "#3b82f6");

    @Autowired
    private CollaborationService collaborationService;

    @Autowired
    private FlowGraphService flowGraphService;

    @Autowired
    private FlowSessionRegistry registry;

    private Flow flow;
    private FlowNode dialogue;

    @BeforeEach
    void openFlow() {
        flow = flowGraphService.createFlow(projectId, new CreateFlowRequest(null, "Tavern", null, null, null, null));
        dialogue = flowGraphService.createNode(flow.getId(),
                new CreateNodeRequest(null, NodeType.DIALOGUE, 10.0, 20.0, null));
    }

    @AfterEach
    void closeSessions() {
        collaborationService.leave(flow.getId(), "ana");
        collaborationService.leave(flow.getId(), "ben");
    }

    @Test
    void joinReturnsGraphLocksAndPresence() {
        collaborationService.join(flow.getId(), "ana", ANA);
        collaborationService.acquireLock(flow.getId(), dialogue.getId(), "ana");

        FlowSnapshot snapshot = collaborationService.join(flow.getId(), "ben", BEN);

        assertThat(snapshot.graph().nodes()).extracting(FlowNode::getId).contains(dialogue.getId());
        assertThat(snapshot.locks()).extracting(LeaseView::nodeId, LeaseView::sessionId)
                .containsExactly(tuple(dialogue.getId(), "ana"));
        assertThat(snapshot.presence()).extracting(view -> view.user().displayName())
                .containsExactly("Ana", "Ben");
        assertThat(snapshot.sequence()).isEqualTo(registry.find(flow.getId()).orElseThrow().currentSequence());
    }

    @Test
    void joiningAMissingFlowFails() {
        UUID missing = UUID.randomUUID();

        assertThatThrownBy(() -> collaborationService.join(missing, "ana", ANA))
                .isInstanceOf(FlowNotFoundException.class);
        assertThat(registry.find(missing)).isEmpty();
    }

    @Test
    void lockingRequiresJoiningFirst() {
        assertThatThrownBy(() -> collaborationService.acquireLock(flow.getId(), dialogue.getId(), "ana"))
                .isInstanceOf(SessionNotJoinedException.class);
    }

    @Test
    void lockingANodeOfAnotherFlowFails() {
        Flow other = flowGraphService.createFlow(projectId, new CreateFlowRequest(null, "Cellar", null, null, null, null));
        collaborationService.join(flow.getId(), "ana", ANA);

        assertThatThrownBy(() -> collaborationService.acquireLock(other.getId(), dialogue.getId(), "ana"))
                .isInstanceOf(NodeNotFoundException.class);
    }

    @Test
    void payloadEditWithoutLeaseWritesNothing() {
        collaborationService.join(flow.getId(), "ana", ANA);
        Map<String, Object> before = flowGraphService.getNode(dialogue.getId()).getPayload();

        assertThatThrownBy(() -> collaborationService.updateNodePayload(flow.getId(), dialogue.getId(), "ana",
                dialogueText("Hello")))
                .isInstanceOf(LockRequiredException.class);

        assertThat(flowGraphService.getNode(dialogue.getId()).getPayload()).isEqualTo(before);
    }

    @Test
    void payloadEditWithoutAnyOpenSessionNeedsALease() {
        assertThatThrownBy(() -> collaborationService.updateNodePayload(flow.getId(), dialogue.getId(), "ana",
                dialogueText("Hello")))
                .isInstanceOf(LockRequiredException.class);
    }

    @Test
    void payloadEditWithLeaseIsSavedAndBroadcast() {
        collaborationService.join(flow.getId(), "ana", ANA);
        collaborationService.acquireLock(flow.getId(), dialogue.getId(), "ana");

        FlowNode saved = collaborationService.updateNodePayload(flow.getId(), dialogue.getId(), "ana",
                dialogueText("Hello"));

        assertThat(saved.getPayload()).containsEntry("text", "Hello");
        assertThat(saved.getVersion()).isGreaterThan(dialogue.getVersion());
        assertThat(eventsOfType(FlowEventType.NODE_UPDATED)).singleElement()
                .satisfies(event -> assertThat(event.payload()).containsEntry("session_id", "ana"));
    }

    @Test
    void expiredLeaseNoLongerAllowsEdits() {
        collaborationService.join(flow.getId(), "ana", ANA);
        collaborationService.acquireLock(flow.getId(), dialogue.getId(), "ana");
        clock.advance(30_001);

        assertThatThrownBy(() -> collaborationService.updateNodePayload(flow.getId(), dialogue.getId(), "ana",
                dialogueText("Too late")))
                .isInstanceOf(LockRequiredException.class);
    }

    @Test
    void secondSessionCannotLockAHeldNode() {
        collaborationService.join(flow.getId(), "ana", ANA);
        collaborationService.join(flow.getId(), "ben", BEN);
        collaborationService.acquireLock(flow.getId(), dialogue.getId(), "ana");

        assertThatThrownBy(() -> collaborationService.acquireLock(flow.getId(), dialogue.getId(), "ben"))
                .isInstanceOfSatisfying(LockConflictException.class,
                        e -> assertThat(e.getHeldLease().holder().displayName()).isEqualTo("Ana"));
    }

    @Test
    void moveAndDeleteAreRefusedWhileAnotherSessionEdits() {
        collaborationService.join(flow.getId(), "ana", ANA);
        collaborationService.join(flow.getId(), "ben", BEN);
        collaborationService.acquireLock(flow.getId(), dialogue.getId(), "ana");

        assertThatThrownBy(() -> collaborationService.updateNodePosition(flow.getId(), dialogue.getId(), "ben",
                new NodePositionRequest(50.0, 60.0)))
                .isInstanceOf(LockConflictException.class);
        assertThatThrownBy(() -> collaborationService.deleteNode(flow.getId(), dialogue.getId(), "ben"))
                .isInstanceOf(LockConflictException.class);

        FlowNode unchanged = flowGraphService.getNode(dialogue.getId());
        assertThat(unchanged.isDeleted()).isFalse();
        assertThat(unchanged.getPositionX()).isEqualTo(10.0);
    }

    @Test
    void holderCanMoveItsOwnNode() {
        collaborationService.join(flow.getId(), "ana", ANA);
        collaborationService.acquireLock(flow.getId(), dialogue.getId(), "ana");

        FlowNode moved = collaborationService.updateNodePosition(flow.getId(), dialogue.getId(), "ana",
                new NodePositionRequest(50.0, 60.0));

        assertThat(moved.getPositionX()).isEqualTo(50.0);
        assertThat(eventsOfType(FlowEventType.NODE_MOVED)).singleElement()
                .satisfies(event -> assertThat(event.payload()).containsEntry("x", 50.0).containsEntry("y", 60.0));
    }

    @Test
    void deletingANodeReleasesItsLease() {
        collaborationService.join(flow.getId(), "ana", ANA);
        collaborationService.acquireLock(flow.getId(), dialogue.getId(), "ana");

        collaborationService.deleteNode(flow.getId(), dialogue.getId(), "ana");

        assertThat(collaborationService.listLocks(flow.getId())).isEmpty();
        assertThat(eventsOfType(FlowEventType.NODE_DELETED)).hasSize(1);
        assertThat(eventsOfType(FlowEventType.NODE_UNLOCKED)).singleElement()
                .satisfies(event -> assertThat(event.payload()).containsEntry("reason", "node_deleted"));
    }

    @Test
    void leavingReleasesEveryLeaseOfTheSession() {
        FlowNode hub = flowGraphService.createNode(flow.getId(), new CreateNodeRequest(null, NodeType.HUB, 0.0, 0.0, null));
        collaborationService.join(flow.getId(), "ana", ANA);
        collaborationService.join(flow.getId(), "ben", BEN);
        collaborationService.acquireLock(flow.getId(), dialogue.getId(), "ana");
        collaborationService.acquireLock(flow.getId(), hub.getId(), "ana");

        collaborationService.leave(flow.getId(), "ana");

        assertThat(collaborationService.listLocks(flow.getId())).isEmpty();
        collaborationService.acquireLock(flow.getId(), dialogue.getId(), "ben");
    }

    @Test
    void flowIsForgottenOnceTheLastSessionLeaves() {
        collaborationService.join(flow.getId(), "ana", ANA);

        collaborationService.leave(flow.getId(), "ana");

        assertThat(registry.find(flow.getId())).isEmpty();
    }

    @Test
    void eventsCarryIncreasingSequenceNumbers() {
        collaborationService.join(flow.getId(), "ana", ANA);
        collaborationService.acquireLock(flow.getId(), dialogue.getId(), "ana");
        collaborationService.updateNodePayload(flow.getId(), dialogue.getId(), "ana", dialogueText("One"));
        collaborationService.updateNodePayload(flow.getId(), dialogue.getId(), "ana", dialogueText("Two"));

        List<Long> sequences = publishedEvents().stream().map(FlowEvent::sequence).toList();

        assertThat(sequences).isNotEmpty().isSorted().doesNotHaveDuplicates();
        assertThat(sequences).allMatch(sequence -> sequence > 0);
    }

    @Test
    void concurrentHubCreationNeverReusesAnId() throws Exception {
        int threads = 8;
        int rounds = 5;
        List<FlowNode> created = Collections.synchronizedList(new ArrayList<>());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            for (int round = 0; round < rounds; round++) {
                CountDownLatch start = new CountDownLatch(1);
                List<Future<FlowNode>> futures = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return collaborationService.createNode(flow.getId(), null,
                                new CreateNodeRequest(null, NodeType.HUB, 0.0, 0.0, null));
                    }));
                }
                start.countDown();
                for (Future<FlowNode> future : futures) {
                    created.add(future.get(30, TimeUnit.SECONDS));
                }
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(created).hasSize(threads * rounds);
        assertThat(flowGraphService.listHubs(flow.getId())).extracting(HubSummary::hubId)
                .hasSize(threads * rounds)
                .doesNotHaveDuplicates();
    }

    @Test
    void connectionsNeverOutliveAConcurrentlyDeletedNode() throws Exception {
        FlowNode entry = flowGraphService.getGraph(flow.getId()).nodes().stream()
                .filter(node -> node.getNodeType() == NodeType.ENTRY)
                .findFirst().orElseThrow();
        ExecutorService executor = Executors.newFixedThreadPool(5);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                String pin = "out_" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        collaborationService.createConnection(flow.getId(), null, new CreateConnectionRequest(
                                null, entry.getId(), pin, dialogue.getId(), null, null));
                    } catch (StructuralViolationException e) {
                        // lost the race against the delete
                    }
                    return null;
                }));
            }
            futures.add(executor.submit(() -> {
                start.await();
                return collaborationService.deleteNode(flow.getId(), dialogue.getId(), null);
            }));
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(flowGraphService.getGraph(flow.getId()).connections())
                .noneMatch(connection -> connection.getTargetNodeId().equals(dialogue.getId()));
    }

    @Test
    void flowLevelChangesAskClientsToRefresh() {
        collaborationService.renameFlow(flow.getId(), "Old Tavern");

        assertThat(eventsOfType(FlowEventType.FLOW_REFRESH)).singleElement().satisfies(event -> {
            assertThat(event.payload()).containsEntry("reason", "renamed");
            assertThat(event.sequence()).isZero();
        });
    }

    private List<FlowEvent> publishedEvents() {
        ArgumentCaptor<FlowEvent> captor = ArgumentCaptor.forClass(FlowEvent.class);
        verify(publisher, atLeastOnce()).publish(captor.capture());
        return captor.getAllValues().stream()
                .filter(event -> event.flowId().equals(flow.getId()))
                .toList();
    }

    private List<FlowEvent> eventsOfType(FlowEventType type) {
        return publishedEvents().stream().filter(event -> event.type() == type).toList();
    }

    private static Map<String, Object> dialogueText(String text) {
        return Map.of("text", text, "responses", List.of());
    }
}
