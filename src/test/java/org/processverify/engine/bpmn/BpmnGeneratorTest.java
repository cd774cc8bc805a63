package org.processverify.engine.bpmn;

import org.processverify.engine.bpmn.models.DiagramType;
import org.processverify.engine.bpmn.models.GatewayType;
import org.processverify.engine.bpmn.models.Lane;
import org.processverify.engine.bpmn.models.Node;
import org.processverify.engine.bpmn.models.ProcessGraph;
import org.processverify.engine.closure.models.ControlFlow;
import org.processverify.engine.closure.models.GatewaySpec;
import org.processverify.engine.closure.models.UpdatedFlowReport;
import org.processverify.engine.errors.GraphEngineException;
import org.processverify.engine.errors.Stage;
import org.processverify.engine.formula.models.ActorSymbol;
import org.processverify.engine.formula.models.SymbolTable;
import org.processverify.engine.formula.models.TaskSymbol;
import org.processverify.engine.petriNet.PetriNetTranslator;
import org.processverify.engine.petriNet.models.Arc;
import org.processverify.engine.petriNet.models.PetriNet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BpmnGeneratorTest {
    private final BpmnGenerator generator = new BpmnGenerator();

    private static SymbolTable warehouseSymbols() {
        return new SymbolTable(
                List.of(new ActorSymbol("Warehouse", "A1")),
                List.of(new TaskSymbol("A1", "Accept order", "T1"),
                        new TaskSymbol("A1", "Pack goods", "T2"),
                        new TaskSymbol("A1", "Issue invoice", "T3"),
                        new TaskSymbol("A1", "Dispatch", "T4")));
    }

    private static UpdatedFlowReport fulfilmentFlow() {
        return new UpdatedFlowReport(
                List.of(),
                List.of(new GatewaySpec("G1", "Parallel", List.of("T1"), List.of("T2", "T3")),
                        new GatewaySpec("G2", "Parallel", List.of("T2", "T3"), List.of("T4"))),
                List.of(new ControlFlow("S1", "T1", "A1"),
                        new ControlFlow("T4", "E1", "A1"),
                        new ControlFlow("T1", "G1", "GATEWAY"),
                        new ControlFlow("G1", "T2", "GATEWAY"),
                        new ControlFlow("G1", "T3", "GATEWAY"),
                        new ControlFlow("T2", "G2", "GATEWAY"),
                        new ControlFlow("T3", "G2", "GATEWAY"),
                        new ControlFlow("G2", "T4", "GATEWAY")));
    }

    @Test
    void shouldGenerateProcessDiagramThatParsesBack(@TempDir Path tempDir) throws IOException {
        Path bpmn = tempDir.resolve("bpmn_output.bpmn");

        generator.write(warehouseSymbols(), fulfilmentFlow(), List.of(), bpmn);
        ProcessGraph graph = BpmnHelper.parseBpmnFile(bpmn.toString());

        assertTrue(BpmnValidator.isValid(bpmn.toFile()));
        assertEquals(DiagramType.PROCESS, graph.type());
        assertEquals("Definitions_1", graph.id());
        assertEquals(1, graph.lanes().size());

        Lane lane = graph.lanes().get(0);
        assertEquals("Process_A1", lane.id());
        assertEquals("Warehouse Process", lane.displayName());
        assertEquals(List.of("T1", "T2", "T3", "T4"), lane.tasks().stream().map(Node::id).toList());
        assertEquals("Pack goods", lane.nodesById().get("T2").name());
        assertTrue(lane.isStartEvent("S1"));
        assertTrue(lane.isEndEvent("E1"));
        assertEquals(List.of(GatewayType.PARALLEL, GatewayType.PARALLEL),
                lane.gateways().stream().map(Node::gatewayType).toList());
        assertEquals(8, lane.sequenceFlows().size());
        assertEquals("Flow_G1_to_T2", lane.sequenceFlows().get(3).id());
    }

    @Test
    void shouldTranslateGeneratedProcessDiagram(@TempDir Path tempDir) throws IOException {
        Path bpmn = tempDir.resolve("bpmn_output.bpmn");
        generator.write(warehouseSymbols(), fulfilmentFlow(), List.of(), bpmn);

        PetriNet net = new PetriNetTranslator().translateBpmnFile(bpmn.toString());

        assertEquals(List.of("t_T1", "t_T2", "t_T3", "t_T4", "t_G1", "t_G2"), net.transitions());
        assertEquals(14, net.places().size());
        assertEquals(20, net.arcs().size());
        assertEquals(Map.of("p_start_Warehouse_Process", 1), net.initialMarking());
        assertTrue(net.arcs().contains(new Arc("p_start_Warehouse_Process", "p_pre_T1")));
        assertTrue(net.arcs().contains(new Arc("p_post_G1", "p_pre_T3")));
        assertTrue(net.arcs().contains(new Arc("p_post_T4", "p_end_Warehouse_Process")));
    }

    @Test
    void shouldGenerateCollaborationWithMessageFlows(@TempDir Path tempDir) throws IOException {
        SymbolTable symbols = new SymbolTable(
                List.of(new ActorSymbol("Customer", "A1"), new ActorSymbol("Shop", "A2")),
                List.of(new TaskSymbol("A1", "initial of Customer", "S1"),
                        new TaskSymbol("A1", "Send order", "T1"),
                        new TaskSymbol("A1", "end of Customer", "E1"),
                        new TaskSymbol("A2", "initial of Shop", "S2"),
                        new TaskSymbol("A2", "Receive order", "T2"),
                        new TaskSymbol("A2", "end of Shop", "E2")));
        UpdatedFlowReport flow = new UpdatedFlowReport(List.of(), List.of(),
                List.of(new ControlFlow("S1", "T1", "A1"),
                        new ControlFlow("T1", "E1", "A1"),
                        new ControlFlow("S2", "T2", "A2"),
                        new ControlFlow("T2", "E2", "A2")));
        Path bpmn = tempDir.resolve("bpmn_output.bpmn");

        generator.write(symbols, flow, List.of(new ControlFlow("T1", "T2", "A1")), bpmn);
        ProcessGraph graph = BpmnHelper.parseBpmnXml(Files.readString(bpmn));

        assertEquals(DiagramType.COLLABORATION, graph.type());
        assertEquals(List.of("Participant_A1", "Participant_A2"), graph.lanes().stream().map(Lane::id).toList());
        assertEquals(List.of("Customer", "Shop"), graph.lanes().stream().map(Lane::displayName).toList());
        assertEquals(1, graph.messageFlows().size());
        assertEquals("MessageFlow_T1_to_T2", graph.messageFlows().get(0).id());
        assertEquals("Participant_A1", graph.messageFlows().get(0).laneId());

        PetriNet net = new PetriNetTranslator().translate(graph);
        assertEquals(9, net.places().size());
        assertEquals(2, net.tokenCount());
        assertTrue(net.arcs().contains(new Arc("t_T1", "p_msg_MessageFlow_T1_to_T2")));
        assertTrue(net.arcs().contains(new Arc("p_msg_MessageFlow_T1_to_T2", "t_T2")));
    }

    @Test
    void shouldPlaceGatewaysInFirstProcessOfCollaboration() {
        SymbolTable symbols = new SymbolTable(
                List.of(new ActorSymbol("Customer", "A1"), new ActorSymbol("Shop", "A2")),
                List.of(new TaskSymbol("A1", "Send order", "T1"),
                        new TaskSymbol("A2", "Receive order", "T2")));
        UpdatedFlowReport flow = new UpdatedFlowReport(List.of(),
                List.of(new GatewaySpec("G1", "Complex", List.of("T1"), List.of("T2"))),
                List.of(new ControlFlow("T1", "G1", "GATEWAY"), new ControlFlow("G1", "T2", "GATEWAY")));

        Document doc = generator.toDocument(symbols, flow, List.of());

        Element gatewayEl = (Element) doc.getElementsByTagNameNS(BpmnHelper.BPMN_NS, "exclusiveGateway").item(0);
        assertEquals("G1", gatewayEl.getAttribute("id"));
        assertEquals("Complex", gatewayEl.getAttribute("name"));
        assertEquals("Process_A1", ((Element) gatewayEl.getParentNode()).getAttribute("id"));
        assertEquals(2, doc.getElementsByTagNameNS(BpmnHelper.BPMN_NS, "sequenceFlow").getLength());
    }

    @Test
    void shouldDropMessageFlowsFromProcessDiagram() {
        String xml = generator.toXml(warehouseSymbols(), fulfilmentFlow(),
                List.of(new ControlFlow("T1", "T4", "A1")));

        assertEquals(DiagramType.PROCESS, BpmnHelper.detectDiagramType(xml));
        assertTrue(BpmnHelper.parseBpmnXml(xml).messageFlows().isEmpty());
    }

    @Test
    void shouldRejectSymbolTableWithoutActors() {
        GraphEngineException e = assertThrows(GraphEngineException.class,
                () -> generator.toDocument(new SymbolTable(List.of(), List.of()), fulfilmentFlow(), List.of()));

        assertEquals(Stage.GENERATION, e.getStage());
    }
}
