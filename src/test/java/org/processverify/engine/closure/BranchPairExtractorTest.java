package org.processverify.engine.closure;

import org.processverify.engine.closure.models.BranchPair;
import org.processverify.engine.closure.models.BranchType;
import org.processverify.engine.closure.models.ControlFlow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BranchPairExtractorTest {

    @Test
    void shouldFindConvergentPairsBeforeDivergentPairs() {
        List<ControlFlow> flows = List.of(
                new ControlFlow("T1", "T3", "A1"),
                new ControlFlow("T1", "T2", "A1"),
                new ControlFlow("T3", "T4", "A1"),
                new ControlFlow("T2", "T4", "A1"));

        List<BranchPair> pairs = BranchPairExtractor.extract(flows);

        assertEquals(2, pairs.size());
        assertEquals(BranchType.CONVERGENT, pairs.get(0).type());
        assertEquals(List.of("T2", "T3"), pairs.get(0).fromTasks());
        assertEquals("T4", pairs.get(0).toTask());
        assertNull(pairs.get(0).fromTask());

        assertEquals(BranchType.DIVERGENT, pairs.get(1).type());
        assertEquals("T1", pairs.get(1).fromTask());
        assertEquals(List.of("T2", "T3"), pairs.get(1).toTasks());
    }

    @Test
    void shouldFindNothingInLinearFlow() {
        List<ControlFlow> flows = List.of(
                new ControlFlow("S1", "T1", "A1"),
                new ControlFlow("T1", "E1", "A1"));

        assertTrue(BranchPairExtractor.extract(flows).isEmpty());
    }

    @Test
    void shouldSkipFlowsWithMissingEndpoint() {
        List<ControlFlow> flows = List.of(
                new ControlFlow("T1", null, "A1"),
                new ControlFlow("T1", "T2", "A1"));

        assertTrue(BranchPairExtractor.extract(flows).isEmpty());
    }
}
