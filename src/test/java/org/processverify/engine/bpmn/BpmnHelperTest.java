package org.processverify.engine.bpmn;

import org.processverify.engine.bpmn.models.Actor;
import org.processverify.engine.bpmn.models.DiagramType;
import org.processverify.engine.bpmn.models.Edge;
import org.processverify.engine.bpmn.models.GatewayType;
import org.processverify.engine.bpmn.models.Lane;
import org.processverify.engine.bpmn.models.Node;
import org.processverify.engine.bpmn.models.NodeKind;
import org.processverify.engine.bpmn.models.ProcessGraph;
import org.processverify.engine.errors.Stage;
import org.processverify.engine.errors.StructuralParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BpmnHelperTest {
    private static final String SEQUENTIAL_BPMN = "src/test/resources/models/sequential_process.bpmn";
    private static final String GATEWAY_BPMN = "src/test/resources/models/gateway_process.bpmn";
    private static final String COLLABORATION_BPMN = "src/test/resources/models/collaboration.bpmn";
    private static final String MALFORMED_BPMN = "src/test/resources/models/malformed.bpmn";

    @Test
    void shouldParseProcessDiagramAsSingleLane() {
        ProcessGraph graph = BpmnHelper.parseBpmnFile(SEQUENTIAL_BPMN);

        assertEquals(DiagramType.PROCESS, graph.type());
        assertEquals("Definitions_sequential", graph.id());
        assertEquals(1, graph.lanes().size());

        Lane lane = graph.lanes().get(0);
        assertEquals("Process_order", lane.id());
        assertEquals("Order Handling", lane.displayName());
        assertEquals(List.of("T1", "T2"), lane.tasks().stream().map(Node::id).toList());
        assertEquals("userTask", lane.nodesById().get("T1").bpmnType());
        assertEquals("serviceTask", lane.nodesById().get("T2").bpmnType());
        assertTrue(lane.isStartEvent("S1"));
        assertTrue(lane.isEndEvent("E1"));
        assertEquals(3, lane.sequenceFlows().size());
        assertTrue(graph.messageFlows().isEmpty());
    }

    @Test
    void shouldParseGatewaysWithRoutingType() {
        ProcessGraph graph = BpmnHelper.parseBpmnFile(GATEWAY_BPMN);

        List<Node> gateways = graph.gateways();
        assertEquals(2, gateways.size());
        assertEquals(NodeKind.GATEWAY, gateways.get(0).kind());
        assertEquals(GatewayType.PARALLEL, gateways.get(0).gatewayType());
        assertEquals(4, graph.tasks().size());
        assertEquals(8, graph.sequenceFlows().size());
    }

    @Test
    void shouldParseCollaborationIntoParticipantLanes() {
        ProcessGraph graph = BpmnHelper.parseBpmnFile(COLLABORATION_BPMN);

        assertTrue(graph.isCollaboration());
        assertEquals(List.of("A1", "A2"), graph.lanes().stream().map(Lane::id).toList());
        assertEquals("Shop Owner", graph.lanes().get(1).displayName());
        assertEquals("Process_shop", graph.lanes().get(1).processRef());

        assertEquals(3, graph.messageFlows().size());
        Edge first = graph.messageFlows().get(0);
        assertEquals("T1->T3", first.key());
        assertEquals("A1", first.laneId());

        List<Actor> actors = graph.actors();
        assertEquals(3, actors.size());
        assertTrue(actors.contains(new Actor("A1", "Customer", Actor.PARTICIPANT)));
        assertTrue(actors.contains(new Actor("Lane_buyer", "Buyer", Actor.LANE)));
    }

    @Test
    void shouldIgnoreFlowsWithoutBothEndpointsAndSynthesizeMissingIds() {
        String xml = """
                <bpmn:definitions xmlns:bpmn="http://www.omg.org/spec/BPMN/20100524/MODEL" id="D1">
                  <bpmn:process id="P1">
                    <bpmn:task id="T1"/>
                    <bpmn:task id="T2"/>
                    <bpmn:sequenceFlow sourceRef="T1" targetRef="T2"/>
                    <bpmn:sequenceFlow id="Dangling" sourceRef="T2"/>
                  </bpmn:process>
                </bpmn:definitions>
                """;

        ProcessGraph graph = BpmnHelper.parseBpmnXml(xml);

        List<Edge> flows = graph.sequenceFlows();
        assertEquals(1, flows.size());
        assertEquals("sf_T1_T2", flows.get(0).id());
        assertEquals("P1", graph.lanes().get(0).displayName());
    }

    @Test
    void shouldDefaultToProcessDiagramType() {
        String xml = "<bpmn:definitions xmlns:bpmn=\"http://www.omg.org/spec/BPMN/20100524/MODEL\" id=\"D1\"/>";

        assertEquals(DiagramType.PROCESS, BpmnHelper.detectDiagramType(xml));
        assertTrue(BpmnHelper.parseBpmnXml(xml).isEmpty());
    }

    @Test
    void shouldThrowOnMalformedXml() {
        StructuralParseException e = assertThrows(StructuralParseException.class,
                () -> BpmnHelper.parseBpmnFile(MALFORMED_BPMN));

        assertEquals(Stage.PARSE, e.getStage());
        assertEquals(MALFORMED_BPMN, e.getIdentifier());
    }

    @Test
    void shouldThrowWhenRootIsNotDefinitions() {
        assertThrows(StructuralParseException.class, () -> BpmnHelper.parseBpmnXml("<process id=\"P1\"/>"));
    }

    @Test
    void shouldThrowWhenFileIsMissing() {
        assertThrows(StructuralParseException.class,
                () -> BpmnHelper.parseBpmnFile("src/test/resources/models/does_not_exist.bpmn"));
    }
}
