package org.processverify.engine.similarity;

import org.processverify.engine.bpmn.BpmnHelper;
import org.processverify.engine.bpmn.models.Edge;
import org.processverify.engine.bpmn.models.Node;
import org.processverify.engine.bpmn.models.ProcessGraph;
import org.processverify.engine.errors.DiagramTypeException;
import org.processverify.engine.errors.Stage;
import org.processverify.engine.errors.StructuralParseException;
import org.processverify.engine.similarity.models.DistanceMatrix;
import org.processverify.engine.similarity.models.SsdtReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Structural similarity of two process diagrams based on their shortest-successor-distance
 * matrices (SSDT).
 * <p>
 * Nodes are the activities and gateways of the diagram; every sequence flow between two of
 * them costs one hop regardless of gateway type. Matrices of different sizes are padded to the
 * larger dimension and compared cell by cell over the whole padded square.
 * Collaborations are rejected: distances across participants are not defined.
 */
public class SsdtSimilarity {
    private static final Logger log = LoggerFactory.getLogger(SsdtSimilarity.class);

    /**
     * @throws DiagramTypeException if the graph is a collaboration
     */
    public static DistanceMatrix buildMatrix(ProcessGraph graph) {
        requireProcess(graph, "graph");

        List<String> nodes = new ArrayList<>(new TreeSet<>(nodeIds(graph)));
        Map<String, Integer> indexOf = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            indexOf.put(nodes.get(i), i);
        }

        List<List<Integer>> adjacency = new ArrayList<>();
        nodes.forEach(n -> adjacency.add(new ArrayList<>()));
        for (Edge flow : graph.sequenceFlows()) {
            Integer source = indexOf.get(flow.sourceRef());
            Integer target = indexOf.get(flow.targetRef());
            if (source != null && target != null) {
                adjacency.get(source).add(target);
            }
        }

        int n = nodes.size();
        int[][] cells = new int[n][];
        for (int source = 0; source < n; source++) {
            cells[source] = breadthFirstDistances(source, adjacency);
        }
        return new DistanceMatrix(nodes, cells);
    }

    private static int[] breadthFirstDistances(int source, List<List<Integer>> adjacency) {
        int[] distances = new int[adjacency.size()];
        Arrays.fill(distances, DistanceMatrix.UNREACHABLE);
        distances[source] = 0;

        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(source);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int neighbor : adjacency.get(current)) {
                if (distances[neighbor] == DistanceMatrix.UNREACHABLE) {
                    distances[neighbor] = distances[current] + 1;
                    queue.add(neighbor);
                }
            }
        }
        return distances;
    }

    /**
     * Pads both matrices to the larger of the two dimensions.
     */
    public static AlignedMatrices align(DistanceMatrix first, DistanceMatrix second) {
        int dimension = Math.max(first.size(), second.size());
        return new AlignedMatrices(first.padTo(dimension), second.padTo(dimension));
    }

    /**
     * Fraction of equal cells over the aligned matrices. Two empty matrices are identical.
     */
    public static double similarity(DistanceMatrix first, DistanceMatrix second) {
        AlignedMatrices aligned = align(first, second);
        return similarity(aligned);
    }

    private static double similarity(AlignedMatrices aligned) {
        int dimension = aligned.first().size();
        if (dimension == 0) {
            return 1.0;
        }
        int matching = 0;
        for (int i = 0; i < dimension; i++) {
            for (int j = 0; j < dimension; j++) {
                if (aligned.first().get(i, j) == aligned.second().get(i, j)) {
                    matching++;
                }
            }
        }
        return (double) matching / (dimension * dimension);
    }

    /**
     * Compares a benchmark diagram with a target diagram.
     *
     * @throws DiagramTypeException if either diagram is a collaboration
     */
    public static SsdtReport compare(ProcessGraph benchmark, ProcessGraph target) {
        requireProcess(benchmark, "benchmark");
        requireProcess(target, "target");

        DistanceMatrix benchmarkMatrix = buildMatrix(benchmark);
        DistanceMatrix targetMatrix = buildMatrix(target);
        AlignedMatrices aligned = align(benchmarkMatrix, targetMatrix);
        double score = similarity(aligned);

        log.info("SSDT similarity: {}% ({} benchmark nodes, {} target nodes)",
                JaccardSimilarity.toPercentage(score), benchmarkMatrix.size(), targetMatrix.size());

        return SsdtReport.builder()
                .ssdtSimilarity(score)
                .ssdtSimilarityPercentage(JaccardSimilarity.toPercentage(score))
                .benchmarkBpmnType(benchmark.type())
                .targetBpmnType(target.type())
                .benchmarkActivities(activities(benchmark))
                .targetActivities(activities(target))
                .benchmarkGateways(gateways(benchmark))
                .targetGateways(gateways(target))
                .benchmarkSsdtMatrix(benchmarkMatrix.toRows())
                .targetSsdtMatrix(targetMatrix.toRows())
                .alignedBenchmarkSsdtMatrix(aligned.first().toRows())
                .alignedTargetSsdtMatrix(aligned.second().toRows())
                .benchmarkNodes(benchmarkMatrix.nodes())
                .targetNodes(targetMatrix.nodes())
                .build();
    }

    /**
     * Compares two BPMN files. An unreadable file counts as an empty process diagram.
     *
     * @throws DiagramTypeException if either file holds a collaboration
     */
    public static SsdtReport compareFiles(String benchmarkBpmnPath, String targetBpmnPath) {
        return compare(loadOrEmpty(benchmarkBpmnPath), loadOrEmpty(targetBpmnPath));
    }

    static ProcessGraph loadOrEmpty(String bpmnFilePath) {
        try {
            return BpmnHelper.parseBpmnFile(bpmnFilePath);
        } catch (StructuralParseException e) {
            log.warn("Cannot read '{}', comparing it as an empty diagram: {}", bpmnFilePath, e.getMessage());
            return ProcessGraph.empty();
        }
    }

    private static void requireProcess(ProcessGraph graph, String role) {
        if (graph.isCollaboration()) {
            throw new DiagramTypeException(
                    "SSDT is only defined for process diagrams, " + role + " is a collaboration",
                    graph.id(), Stage.SIMILARITY);
        }
    }

    private static List<String> nodeIds(ProcessGraph graph) {
        List<String> ids = new ArrayList<>();
        graph.tasks().forEach(node -> ids.add(node.id()));
        graph.gateways().forEach(node -> ids.add(node.id()));
        return ids;
    }

    private static Map<String, String> activities(ProcessGraph graph) {
        Map<String, String> activities = new LinkedHashMap<>();
        for (Node task : graph.tasks()) {
            activities.put(task.id(), task.label());
        }
        return activities;
    }

    private static Map<String, String> gateways(ProcessGraph graph) {
        Map<String, String> gateways = new LinkedHashMap<>();
        for (Node gateway : graph.gateways()) {
            gateways.put(gateway.id(), gateway.bpmnType());
        }
        return gateways;
    }

    /**
     * Two matrices padded to the same dimension.
     */
    public record AlignedMatrices(DistanceMatrix first, DistanceMatrix second) {
    }
}
