package org.processverify.engine.similarity;

import org.processverify.engine.bpmn.BpmnHelper;
import org.processverify.engine.bpmn.models.ProcessGraph;
import org.processverify.engine.errors.DiagramTypeException;
import org.processverify.engine.errors.Stage;
import org.processverify.engine.similarity.models.DistanceMatrix;
import org.processverify.engine.similarity.models.SsdtReport;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SsdtSimilarityTest {
    private static final String MODELS = "src/test/resources/models/";
    private static final int U = DistanceMatrix.UNREACHABLE;

    @Test
    void shouldBuildShortestDistances() {
        ProcessGraph graph = BpmnHelper.parseBpmnFile(MODELS + "gateway_process.bpmn");

        DistanceMatrix matrix = SsdtSimilarity.buildMatrix(graph);

        assertEquals(List.of("G1", "G2", "T1", "T2", "T3", "T4"), matrix.nodes());
        for (int i = 0; i < matrix.size(); i++) {
            assertEquals(0, matrix.get(i, i));
        }
        assertEquals(4, matrix.get(2, 5));
        assertEquals(1, matrix.get(0, 3));
        assertFalse(matrix.isReachable(5, 2));
    }

    @Test
    void shouldScoreDiagramAgainstItselfAsOne() {
        SsdtReport report = SsdtSimilarity.compareFiles(MODELS + "gateway_process.bpmn", MODELS + "gateway_process.bpmn");

        assertEquals(1.0, report.ssdtSimilarity());
        assertEquals(100.0, report.ssdtSimilarityPercentage());
        assertEquals(2, report.benchmarkGateways().size());
        assertEquals("parallelGateway", report.benchmarkGateways().get("G1"));
        assertEquals("Dispatch", report.targetActivities().get("T4"));
    }

    @Test
    void shouldCompareOverPaddedMatrices() {
        SsdtReport report = SsdtSimilarity.compareFiles(MODELS + "benchmark_process.bpmn", MODELS + "sequential_process.bpmn");

        assertEquals(6.0 / 9.0, report.ssdtSimilarity(), 1e-9);
        assertEquals(66.67, report.ssdtSimilarityPercentage());
        assertEquals(List.of("T1", "T2", "T3"), report.benchmarkNodes());
        assertEquals(List.of("T1", "T2"), report.targetNodes());
        assertEquals(2, report.targetSsdtMatrix().size());
        assertEquals(3, report.alignedTargetSsdtMatrix().size());
        assertEquals(Arrays.asList(0, 2, 1), report.benchmarkSsdtMatrix().get(0));
        assertEquals(Arrays.asList(null, null, 0), report.alignedTargetSsdtMatrix().get(2));
    }

    @Test
    void shouldPadWithUnreachableAndZeroDiagonal() {
        DistanceMatrix matrix = new DistanceMatrix(List.of("A"), new int[][]{{0}});

        DistanceMatrix padded = matrix.padTo(2);

        assertEquals(2, padded.size());
        assertEquals(List.of("A"), padded.nodes());
        assertEquals(0, padded.get(1, 1));
        assertEquals(U, padded.get(0, 1));
        assertEquals(U, padded.get(1, 0));
        assertThrows(IllegalArgumentException.class, () -> padded.padTo(1));
    }

    @Test
    void shouldTreatTwoEmptyMatricesAsIdentical() {
        assertEquals(1.0, SsdtSimilarity.similarity(DistanceMatrix.empty(), DistanceMatrix.empty()));
    }

    @Test
    void shouldRejectNonSquareMatrix() {
        assertThrows(IllegalArgumentException.class,
                () -> new DistanceMatrix(List.of("A", "B"), new int[][]{{0, 1}, {0}}));
    }

    @Test
    void shouldRejectCollaboration() {
        ProcessGraph collaboration = BpmnHelper.parseBpmnFile(MODELS + "collaboration.bpmn");
        ProcessGraph process = BpmnHelper.parseBpmnFile(MODELS + "sequential_process.bpmn");

        DiagramTypeException e = assertThrows(DiagramTypeException.class,
                () -> SsdtSimilarity.compare(process, collaboration));
        assertEquals(Stage.SIMILARITY, e.getStage());
        assertThrows(DiagramTypeException.class, () -> SsdtSimilarity.buildMatrix(collaboration));
    }
}
