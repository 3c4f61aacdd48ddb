package com.narraflow.narraflow_backend.service;

import com.narraflow.narraflow_backend.IntegrationTestSupport;
import com.narraflow.narraflow_backend.exception.FlowNotFoundException;
import com.narraflow.narraflow_backend.exception.NodeNotFoundException;
import com.narraflow.narraflow_backend.exception.PayloadSchemaViolationException;
import com.narraflow.narraflow_backend.exception.ReferenceIndexException;
import com.narraflow.narraflow_backend.exception.StructuralViolationException;
import com.narraflow.narraflow_backend.expression.VariableKind;
import com.narraflow.narraflow_backend.model.domain.Flow;
import com.narraflow.narraflow_backend.model.domain.FlowConnection;
import com.narraflow.narraflow_backend.model.domain.FlowNode;
import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.dto.*;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class FlowGraphServiceTest extends IntegrationTestSupport {

    @Autowired
    private FlowGraphService flowGraphService;

    @Autowired
    private VariableReferenceTracker referenceTracker;

    @Test
    void newFlowStartsWithOneEntryNode() {
        Flow flow = createFlow("Act One");

        FlowGraphDto graph = flowGraphService.getGraph(flow.getId());

        assertThat(graph.nodes()).singleElement().satisfies(node -> {
            assertThat(node.getNodeType()).isEqualTo(NodeType.ENTRY);
            assertThat(node.getPositionX()).isEqualTo(100.0);
            assertThat(node.getPositionY()).isEqualTo(300.0);
        });
        assertThat(graph.connections()).isEmpty();
        assertThat(flow.getShortcut()).isEqualTo("act-one");
    }

    @Test
    void retriedCreateReturnsTheSameFlow() {
        UUID id = UUID.randomUUID();
        CreateFlowRequest request = new CreateFlowRequest(id, "Prologue", null, null, null, null);

        Flow first = flowGraphService.createFlow(projectId, request);
        Flow second = flowGraphService.createFlow(projectId, request);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(flowGraphService.getGraph(id).nodes()).hasSize(1);
    }

    @Test
    void shortcutsAreUniqueWithinAProject() {
        assertThat(createFlow("Act One").getShortcut()).isEqualTo("act-one");
        assertThat(createFlow("Act One").getShortcut()).isEqualTo("act-one-1");
        assertThat(createFlow("Chapter 1.2").getShortcut()).isEqualTo("chapter-1.2");
    }

    @Test
    void secondEntryNodeIsRejected() {
        Flow flow = createFlow("Main");

        assertThatThrownBy(() -> createNode(flow, NodeType.ENTRY, null))
                .isInstanceOf(StructuralViolationException.class);
    }

    @Test
    void entryNodeCannotBeDeleted() {
        Flow flow = createFlow("Main");
        FlowNode entry = flowGraphService.getGraph(flow.getId()).nodes().get(0);

        assertThatThrownBy(() -> flowGraphService.deleteNode(entry.getId()))
                .isInstanceOf(StructuralViolationException.class);
    }

    @Test
    void hubsGetGeneratedUniqueIds() {
        Flow flow = createFlow("Hubs");

        FlowNode first = createNode(flow, NodeType.HUB, null);
        FlowNode second = createNode(flow, NodeType.HUB, null);

        assertThat(first.getPayload()).containsEntry("hub_id", "hub_1");
        assertThat(second.getPayload()).containsEntry("hub_id", "hub_2");
        assertThatThrownBy(() -> flowGraphService.updateNodePayload(second.getId(), Map.of("hub_id", "hub_1")))
                .isInstanceOf(StructuralViolationException.class);
        assertThat(flowGraphService.listHubs(flow.getId())).extracting(HubSummary::hubId)
                .containsExactly("hub_1", "hub_2");
    }

    @Test
    void jumpMustTargetAnExistingHub() {
        Flow flow = createFlow("Jumps");
        createNode(flow, NodeType.HUB, Map.of("hub_id", "crossroads"));

        assertThatThrownBy(() -> createNode(flow, NodeType.JUMP, Map.of("target_hub_id", "nowhere")))
                .isInstanceOf(StructuralViolationException.class);
        assertThat(createNode(flow, NodeType.JUMP, Map.of("target_hub_id", "crossroads")).getPayload())
                .containsEntry("target_hub_id", "crossroads");
    }

    @Test
    void renamingAHubRetargetsItsJumps() {
        Flow flow = createFlow("Jumps");
        FlowNode hub = createNode(flow, NodeType.HUB, Map.of("hub_id", "crossroads"));
        FlowNode jump = createNode(flow, NodeType.JUMP, Map.of("target_hub_id", "crossroads"));

        PayloadUpdate update = flowGraphService.updateNodePayload(hub.getId(), Map.of("hub_id", "market"));

        assertThat(update.updatedJumps()).extracting(FlowNode::getId).containsExactly(jump.getId());
        assertThat(flowGraphService.getNode(jump.getId()).getPayload()).containsEntry("target_hub_id", "market");
    }

    @Test
    void deletingAHubClearsItsJumps() {
        Flow flow = createFlow("Jumps");
        FlowNode hub = createNode(flow, NodeType.HUB, Map.of("hub_id", "crossroads"));
        FlowNode jump = createNode(flow, NodeType.JUMP, Map.of("target_hub_id", "crossroads"));

        NodeDeletion deletion = flowGraphService.deleteNode(hub.getId());

        assertThat(deletion.updatedJumps()).hasSize(1);
        assertThat(flowGraphService.getNode(jump.getId()).getPayload()).containsEntry("target_hub_id", "");
    }

    @Test
    void restoredJumpLosesTheTargetOfADeletedHub() {
        Flow flow = createFlow("Jumps");
        FlowNode hub = createNode(flow, NodeType.HUB, null);
        FlowNode jump = createNode(flow, NodeType.JUMP, Map.of("target_hub_id", "hub_1"));
        flowGraphService.deleteNode(jump.getId());
        flowGraphService.deleteNode(hub.getId());

        FlowNode restored = flowGraphService.restoreNode(jump.getId());

        assertThat(flowGraphService.listHubs(flow.getId())).isEmpty();
        assertThat(restored.getPayload()).containsEntry("target_hub_id", "");
        assertThat(flowGraphService.getNode(jump.getId()).getPayload()).containsEntry("target_hub_id", "");
    }

    @Test
    void renamingAHubRetargetsTrashedJumpsWithoutReportingThem() {
        Flow flow = createFlow("Jumps");
        FlowNode hub = createNode(flow, NodeType.HUB, Map.of("hub_id", "crossroads"));
        FlowNode jump = createNode(flow, NodeType.JUMP, Map.of("target_hub_id", "crossroads"));
        flowGraphService.deleteNode(jump.getId());

        PayloadUpdate update = flowGraphService.updateNodePayload(hub.getId(), Map.of("hub_id", "market"));

        assertThat(update.updatedJumps()).isEmpty();
        assertThat(flowGraphService.restoreNode(jump.getId()).getPayload()).containsEntry("target_hub_id", "market");
    }

    @Test
    void restoringASubflowThatWouldCloseACycleIsRejected() {
        Flow a = createFlow("A");
        Flow b = createFlow("B");
        FlowNode toB = createNode(a, NodeType.SUBFLOW, Map.of("referenced_flow_id", b.getId().toString()));
        flowGraphService.deleteNode(toB.getId());
        createNode(b, NodeType.SUBFLOW, Map.of("referenced_flow_id", a.getId().toString()));

        assertThatThrownBy(() -> flowGraphService.restoreNode(toB.getId()))
                .isInstanceOf(StructuralViolationException.class)
                .hasMessageContaining("circular");
        assertThatThrownBy(() -> flowGraphService.getNode(toB.getId()))
                .isInstanceOf(NodeNotFoundException.class);
    }

    @Test
    void deletingANodeRemovesItsConnectionsAndIsIdempotent() {
        Flow flow = createFlow("Talk");
        FlowNode entry = flowGraphService.getGraph(flow.getId()).nodes().get(0);
        FlowNode line = createNode(flow, NodeType.DIALOGUE, Map.of("text", "Hello", "responses", List.of()));
        flowGraphService.createConnection(flow.getId(),
                new CreateConnectionRequest(null, entry.getId(), null, line.getId(), null, null));

        NodeDeletion first = flowGraphService.deleteNode(line.getId());
        NodeDeletion retry = flowGraphService.deleteNode(line.getId());

        assertThat(first.removedConnections()).hasSize(1);
        assertThat(first.alreadyDeleted()).isFalse();
        assertThat(retry.alreadyDeleted()).isTrue();
        FlowGraphDto graph = flowGraphService.getGraph(flow.getId());
        assertThat(graph.connections()).isEmpty();
        assertThat(graph.nodes()).extracting(FlowNode::getId).doesNotContain(line.getId());
        assertThatThrownBy(() -> flowGraphService.getNode(line.getId())).isInstanceOf(NodeNotFoundException.class);
    }

    @Test
    void restoredNodeComesBackWithoutConnections() {
        Flow flow = createFlow("Talk");
        FlowNode entry = flowGraphService.getGraph(flow.getId()).nodes().get(0);
        FlowNode line = createNode(flow, NodeType.DIALOGUE, Map.of("text", "Hello", "responses", List.of()));
        flowGraphService.createConnection(flow.getId(),
                new CreateConnectionRequest(null, entry.getId(), null, line.getId(), null, null));
        flowGraphService.deleteNode(line.getId());

        FlowNode restored = flowGraphService.restoreNode(line.getId());

        assertThat(restored.isDeleted()).isFalse();
        assertThat(flowGraphService.getGraph(flow.getId()).connections()).isEmpty();
    }

    @Test
    void identicalConnectionIsNotDuplicated() {
        Flow flow = createFlow("Talk");
        FlowNode entry = flowGraphService.getGraph(flow.getId()).nodes().get(0);
        FlowNode line = createNode(flow, NodeType.DIALOGUE, Map.of("text", "Hello", "responses", List.of()));
        CreateConnectionRequest request = new CreateConnectionRequest(null, entry.getId(), null, line.getId(), null, null);

        FlowConnection first = flowGraphService.createConnection(flow.getId(), request);
        FlowConnection second = flowGraphService.createConnection(flow.getId(), request);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(first.getSourcePin()).isEqualTo(FlowConnection.DEFAULT_SOURCE_PIN);
        assertThat(first.getTargetPin()).isEqualTo(FlowConnection.DEFAULT_TARGET_PIN);
    }

    @Test
    void connectionToNodeOfAnotherFlowIsRejected() {
        Flow flow = createFlow("One");
        Flow other = createFlow("Two");
        FlowNode entry = flowGraphService.getGraph(flow.getId()).nodes().get(0);
        FlowNode foreign = flowGraphService.getGraph(other.getId()).nodes().get(0);

        assertThatThrownBy(() -> flowGraphService.createConnection(flow.getId(),
                new CreateConnectionRequest(null, entry.getId(), null, foreign.getId(), null, null)))
                .isInstanceOf(StructuralViolationException.class);
    }

    @Test
    void circularSubflowReferencesAreRejected() {
        Flow a = createFlow("A");
        Flow b = createFlow("B");
        Flow c = createFlow("C");
        createNode(a, NodeType.SUBFLOW, Map.of("referenced_flow_id", b.getId().toString()));
        createNode(b, NodeType.EXIT, Map.of("exit_mode", "flow_reference", "referenced_flow_id", c.getId().toString()));

        assertThatThrownBy(() -> createNode(c, NodeType.SUBFLOW, Map.of("referenced_flow_id", a.getId().toString())))
                .isInstanceOf(StructuralViolationException.class)
                .hasMessageContaining("circular");
        assertThatThrownBy(() -> createNode(a, NodeType.SUBFLOW, Map.of("referenced_flow_id", a.getId().toString())))
                .isInstanceOf(StructuralViolationException.class);
    }

    @Test
    void deletingAFlowTrashesItsSubtreeAndRestoreBringsItBack() {
        Flow parent = createFlow("Act One");
        Flow child = flowGraphService.createFlow(projectId,
                new CreateFlowRequest(null, "Scene 1", parent.getId(), null, null, null));

        flowGraphService.deleteFlow(parent.getId());

        assertThatThrownBy(() -> flowGraphService.getFlow(child.getId())).isInstanceOf(FlowNotFoundException.class);
        assertThat(flowGraphService.listTrash(projectId)).extracting(Flow::getId).containsExactly(parent.getId());
        assertThat(flowGraphService.listFlowTree(projectId)).isEmpty();

        flowGraphService.restoreFlow(parent.getId());

        List<FlowTreeNode> tree = flowGraphService.listFlowTree(projectId);
        assertThat(tree).singleElement().satisfies(root ->
                assertThat(root.children()).extracting(FlowTreeNode::id).containsExactly(child.getId()));
        assertThat(flowGraphService.listTrash(projectId)).isEmpty();
    }

    @Test
    void childRestoredAloneGoesToTheRootWhenItsParentIsTrashed() {
        Flow parent = createFlow("Act One");
        Flow child = flowGraphService.createFlow(projectId,
                new CreateFlowRequest(null, "Scene 1", parent.getId(), null, null, null));
        flowGraphService.deleteFlow(child.getId());
        flowGraphService.deleteFlow(parent.getId());

        Flow restored = flowGraphService.restoreFlow(child.getId());

        assertThat(restored.getParentId()).isNull();
        assertThat(flowGraphService.listFlowTree(projectId)).extracting(FlowTreeNode::id).containsExactly(child.getId());
    }

    @Test
    void flowCannotMoveUnderItsOwnDescendant() {
        Flow parent = createFlow("Act One");
        Flow child = flowGraphService.createFlow(projectId,
                new CreateFlowRequest(null, "Scene 1", parent.getId(), null, null, null));

        assertThatThrownBy(() -> flowGraphService.moveFlow(parent.getId(), new MoveFlowRequest(child.getId(), null)))
                .isInstanceOf(StructuralViolationException.class);
        assertThatThrownBy(() -> flowGraphService.moveFlow(parent.getId(), new MoveFlowRequest(parent.getId(), null)))
                .isInstanceOf(StructuralViolationException.class);
    }

    @Test
    void movingRenumbersSiblingsDensely() {
        Flow first = createFlow("First");
        Flow second = createFlow("Second");
        Flow third = createFlow("Third");

        flowGraphService.moveFlow(third.getId(), new MoveFlowRequest(null, 0));

        assertThat(flowGraphService.listFlowTree(projectId))
                .extracting(FlowTreeNode::id, FlowTreeNode::position)
                .containsExactly(
                        tuple(third.getId(), 0),
                        tuple(first.getId(), 1),
                        tuple(second.getId(), 2));
    }

    @Test
    void hardDeleteOnlyAcceptsTrashedFlows() {
        Flow flow = createFlow("Doomed");

        assertThatThrownBy(() -> flowGraphService.hardDeleteFlow(flow.getId()))
                .isInstanceOf(StructuralViolationException.class);

        flowGraphService.deleteFlow(flow.getId());
        flowGraphService.hardDeleteFlow(flow.getId());

        assertThat(flowGraphService.listTrash(projectId)).isEmpty();
        assertThatThrownBy(() -> flowGraphService.restoreFlow(flow.getId())).isInstanceOf(FlowNotFoundException.class);
    }

    @Test
    void purgeRemovesFlowsTrashedBeforeTheCutoff() {
        Flow flow = createFlow("Old");
        flowGraphService.deleteFlow(flow.getId());

        assertThat(flowGraphService.purgeTrash(Instant.now().plusSeconds(1))).isGreaterThanOrEqualTo(1);
        assertThat(flowGraphService.listTrash(projectId)).isEmpty();
    }

    @Test
    void renameRegeneratesTheShortcut() {
        Flow flow = createFlow("Draft");

        Flow renamed = flowGraphService.renameFlow(flow.getId(), "The Tavern");

        assertThat(renamed.getShortcut()).isEqualTo("the-tavern");
        assertThatThrownBy(() -> flowGraphService.renameFlow(flow.getId(), " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownVariablesAreDroppedSilently() {
        Flow flow = createFlow("Checks");

        FlowNode node = createNode(flow, NodeType.CONDITION, condition("mc.ghost", "hp", "greater_than", "1"));

        assertThat(node.getPayload()).isNotNull();
        assertThat(referenceTracker.referencesOf(node.getId())).isEmpty();
    }

    @Test
    void operatorNotAllowedForTheVariableKindLeavesNodeUnchanged() {
        catalog.define(projectId, "var-" + UUID.randomUUID(), "mc.jaime", "name", VariableKind.TEXT);
        Flow flow = createFlow("Checks");
        FlowNode node = createNode(flow, NodeType.CONDITION, Map.of("logic", "all", "rules", List.of()));

        assertThatThrownBy(() -> flowGraphService.updateNodePayload(node.getId(),
                condition("mc.jaime", "name", "greater_than", "3")))
                .isInstanceOf(PayloadSchemaViolationException.class);

        assertThat(flowGraphService.getNode(node.getId()).getPayload()).isEqualTo(node.getPayload());
        assertThat(referenceTracker.referencesOf(node.getId())).isEmpty();
    }

    @Test
    void catalogOutageFailsTheWrite() {
        Flow flow = createFlow("Checks");
        FlowNode node = createNode(flow, NodeType.CONDITION, Map.of("logic", "all", "rules", List.of()));
        catalog.setUnavailable(true);

        assertThatThrownBy(() -> flowGraphService.updateNodePayload(node.getId(),
                condition("mc.jaime", "health", "greater_than", "3")))
                .isInstanceOf(ReferenceIndexException.class);

        catalog.setUnavailable(false);
        assertThat(flowGraphService.getNode(node.getId()).getPayload()).isEqualTo(node.getPayload());
    }

    private Flow createFlow(String name) {
        return flowGraphService.createFlow(projectId, new CreateFlowRequest(null, name, null, null, null, null));
    }

    private FlowNode createNode(Flow flow, NodeType type, Map<String, Object> payload) {
        return flowGraphService.createNode(flow.getId(), new CreateNodeRequest(null, type, 0.0, 0.0, payload));
    }

    static Map<String, Object> condition(String sheet, String variable, String operator, String value) {
        return Map.of("logic", "all", "rules", List.of(
                Map.of("id", "r1", "sheet", sheet, "variable", variable, "operator", operator, "value", value)));
    }
}
