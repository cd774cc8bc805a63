package org.processverify.engine.petriNet;

import org.processverify.engine.bpmn.BpmnHelper;
import org.processverify.engine.bpmn.models.ProcessGraph;
import org.processverify.engine.config.models.EngineConfig;
import org.processverify.engine.petriNet.models.Arc;
import org.processverify.engine.petriNet.models.PetriNet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PetriNetTranslatorTest {
    private static final String MODELS = "src/test/resources/models/";

    private final PetriNetTranslator translator = new PetriNetTranslator();

    @Test
    void shouldTranslateSingleTask() {
        PetriNet net = translator.translateBpmnFile(MODELS + "single_task_process.bpmn");

        assertEquals(List.of("t_T1"), net.transitions());
        assertEquals(4, net.places().size());
        assertEquals(4, net.arcs().size());
        assertTrue(net.arcs().contains(new Arc("p_start_Single_Task", "p_pre_T1")));
        assertTrue(net.arcs().contains(new Arc("p_post_T1", "p_end_Single_Task")));
        assertEquals(Map.of("p_start_Single_Task", 1), net.initialMarking());
    }

    @Test
    void shouldFollowPlaceAndArcCountsOfSequentialProcess() {
        ProcessGraph graph = BpmnHelper.parseBpmnFile(MODELS + "sequential_process.bpmn");
        PetriNet net = translator.translate(graph);

        int activities = graph.tasks().size() + graph.gateways().size();
        assertEquals(2 * activities + 2 * graph.lanes().size(), net.places().size());
        assertEquals(activities, net.transitions().size());
        assertEquals(2 * activities + graph.sequenceFlows().size(), net.arcs().size());

        assertEquals(6, net.places().size());
        assertEquals(7, net.arcs().size());
        assertTrue(net.arcs().contains(new Arc("p_post_T1", "p_pre_T2")));
        assertEquals("t_T1", net.label("t_T1"));
    }

    @Test
    void shouldGiveGatewaysTheTaskPattern() {
        PetriNet net = translator.translateBpmnFile(MODELS + "gateway_process.bpmn");

        assertEquals(14, net.places().size());
        assertEquals(List.of("t_T1", "t_T2", "t_T3", "t_T4", "t_G1", "t_G2"), net.transitions());
        assertEquals(List.of("p_post_G1"), net.postSet("t_G1"));
        assertTrue(net.arcs().contains(new Arc("p_post_G1", "p_pre_T2")));
        assertTrue(net.arcs().contains(new Arc("p_post_G1", "p_pre_T3")));
    }

    @Test
    void shouldTranslateCollaborationWithMessagePlaces() {
        PetriNet net = translator.translateBpmnFile(MODELS + "collaboration.bpmn");

        assertEquals(15, net.places().size());
        assertEquals(4, net.transitions().size());
        assertEquals(19, net.arcs().size());
        assertEquals(2, net.tokenCount());
        assertEquals(1, net.initialMarking().get("p_start_Customer"));
        assertEquals(1, net.initialMarking().get("p_start_Shop_Owner"));

        assertTrue(net.arcs().contains(new Arc("t_T1", "p_msg_MF1")));
        assertTrue(net.arcs().contains(new Arc("p_msg_MF1", "t_T3")));
        assertTrue(net.arcs().contains(new Arc("t_T4", "p_msg_MF2")));
        assertTrue(net.arcs().contains(new Arc("p_msg_MF2", "t_T2")));
        // MF3 targets a participant, which has no transition
        assertTrue(net.hasPlace("p_msg_MF3"));
        assertTrue(net.arcs().contains(new Arc("t_T4", "p_msg_MF3")));
        assertEquals(List.of("p_post_T4", "p_msg_MF2", "p_msg_MF3"), net.postSet("t_T4"));
    }

    @Test
    void shouldKeepStartPlacesApartForParticipantsSharingAName() {
        PetriNet net = translator.translateBpmnFile(MODELS + "same_name_collaboration.bpmn");

        assertEquals(8, net.places().size());
        assertEquals(2, net.tokenCount());
        assertEquals(Map.of("p_start_Clerk_P1", 1, "p_start_Clerk_P2", 1), net.initialMarking());
        assertTrue(net.arcs().contains(new Arc("p_start_Clerk_P1", "p_pre_T1")));
        assertTrue(net.arcs().contains(new Arc("p_post_T2", "p_end_Clerk_P2")));
        assertFalse(net.hasPlace("p_start_Clerk"));
    }

    @Test
    void shouldHonourNamingConvention() {
        EngineConfig config = new EngineConfig();
        config.namingConvention.transitionPrefix = "tr_";
        config.namingConvention.postPlacePrefix = "after_";

        PetriNet net = new PetriNetTranslator(config).translateBpmnFile(MODELS + "single_task_process.bpmn");

        assertEquals(List.of("tr_T1"), net.transitions());
        assertEquals(List.of("after_T1"), net.postSet("tr_T1"));
    }

    @Test
    void shouldReturnEmptyNetForMalformedFile() {
        assertTrue(translator.translateBpmnFile(MODELS + "malformed.bpmn").isEmpty());
        assertTrue(translator.translateBpmnFile(MODELS + "missing.bpmn").isEmpty());
    }

    @Test
    void shouldReturnEmptyNetWhenStrictValidationFails() {
        EngineConfig config = new EngineConfig();
        config.validateBpmnInput = true;

        PetriNet net = new PetriNetTranslator(config).translateBpmnFile(MODELS + "schema_invalid.bpmn");

        assertTrue(net.isEmpty());
    }

    @Test
    void shouldWritePnmlNextToBpmnFile(@TempDir Path tempDir) throws IOException {
        Path bpmn = tempDir.resolve("order.bpmn");
        Files.copy(Path.of(MODELS + "sequential_process.bpmn"), bpmn);

        Path pnml = translator.convertBpmnFile(bpmn.toString());

        assertEquals(tempDir.resolve("order_petri_net.pnml"), pnml);
        assertTrue(Files.exists(pnml));
        assertEquals(translator.translateBpmnFile(bpmn.toString()), PnmlReader.readPnmlFile(pnml));
    }
}
