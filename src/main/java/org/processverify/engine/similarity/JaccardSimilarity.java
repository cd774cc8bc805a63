package org.processverify.engine.similarity;

import org.processverify.engine.bpmn.BpmnHelper;
import org.processverify.engine.bpmn.models.Edge;
import org.processverify.engine.bpmn.models.ProcessGraph;
import org.processverify.engine.config.models.SimilaritySettings;
import org.processverify.engine.errors.StructuralParseException;
import org.processverify.engine.similarity.models.JaccardReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Jaccard similarity of the flow-edge sets of two diagrams. Flows are compared by their
 * {@code source->target} key, separately for sequence flows, message flows and both together.
 */
public class JaccardSimilarity {
    private static final Logger log = LoggerFactory.getLogger(JaccardSimilarity.class);

    private final SimilaritySettings settings;

    public JaccardSimilarity() {
        this(new SimilaritySettings());
    }

    public JaccardSimilarity(SimilaritySettings settings) {
        this.settings = settings;
    }

    /**
     * |A ∩ B| / |A ∪ B|, with two empty sets counting as identical.
     */
    public static double jaccard(Set<String> first, Set<String> second) {
        if (first.isEmpty() && second.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(first);
        intersection.retainAll(second);
        Set<String> union = new HashSet<>(first);
        union.addAll(second);
        return (double) intersection.size() / union.size();
    }

    public static Set<String> flowKeys(List<Edge> flows) {
        Set<String> keys = new TreeSet<>();
        for (Edge flow : flows) {
            keys.add(flow.key());
        }
        return keys;
    }

    public JaccardReport compare(ProcessGraph benchmark, ProcessGraph target) {
        Set<String> benchmarkSequence = flowKeys(benchmark.sequenceFlows());
        Set<String> benchmarkMessage = flowKeys(benchmark.messageFlows());
        Set<String> targetSequence = flowKeys(target.sequenceFlows());
        Set<String> targetMessage = flowKeys(target.messageFlows());

        double sequenceSimilarity = jaccard(benchmarkSequence, targetSequence);
        double messageSimilarity = jaccard(benchmarkMessage, targetMessage);
        double overallSimilarity = jaccard(union(benchmarkSequence, benchmarkMessage),
                union(targetSequence, targetMessage));
        double weightedSimilarity = settings.sequenceFlowWeight * sequenceSimilarity
                + settings.messageFlowWeight * messageSimilarity;

        log.info("Jaccard similarity: sequence {}%, message {}%, overall {}%, weighted {}%",
                toPercentage(sequenceSimilarity), toPercentage(messageSimilarity),
                toPercentage(overallSimilarity), toPercentage(weightedSimilarity));

        return JaccardReport.builder()
                .sequenceFlowSimilarity(sequenceSimilarity)
                .messageFlowSimilarity(messageSimilarity)
                .overallSimilarity(overallSimilarity)
                .weightedSimilarity(weightedSimilarity)
                .sequenceFlowSimilarityPercentage(toPercentage(sequenceSimilarity))
                .messageFlowSimilarityPercentage(toPercentage(messageSimilarity))
                .overallSimilarityPercentage(toPercentage(overallSimilarity))
                .weightedSimilarityPercentage(toPercentage(weightedSimilarity))
                .benchmarkSequenceFlows(new ArrayList<>(benchmarkSequence))
                .benchmarkMessageFlows(new ArrayList<>(benchmarkMessage))
                .targetSequenceFlows(new ArrayList<>(targetSequence))
                .targetMessageFlows(new ArrayList<>(targetMessage))
                .benchmarkBpmnType(benchmark.type())
                .targetBpmnType(target.type())
                .build();
    }

    /**
     * Compares two BPMN files. An unreadable file counts as a diagram without flows.
     */
    public JaccardReport compareFiles(String benchmarkBpmnPath, String targetBpmnPath) {
        return compare(loadOrEmpty(benchmarkBpmnPath), loadOrEmpty(targetBpmnPath));
    }

    private static ProcessGraph loadOrEmpty(String bpmnFilePath) {
        try {
            return BpmnHelper.parseBpmnFile(bpmnFilePath);
        } catch (StructuralParseException e) {
            log.warn("Cannot read '{}', comparing it as an empty diagram: {}", bpmnFilePath, e.getMessage());
            return ProcessGraph.empty();
        }
    }

    private static Set<String> union(Set<String> first, Set<String> second) {
        Set<String> union = new TreeSet<>(first);
        union.addAll(second);
        return union;
    }

    static double toPercentage(double similarity) {
        return BigDecimal.valueOf(similarity * 100).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
