package org.processverify.engine.similarity.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import org.processverify.engine.bpmn.models.DiagramType;

import java.util.List;

/**
 * Result of comparing the flow-edge sets of a benchmark and a target diagram.
 * Similarities are in [0, 1]; percentages are rounded to two decimals.
 */
@Builder
public record JaccardReport(
        @JsonProperty("sequence_flow_similarity") double sequenceFlowSimilarity,
        @JsonProperty("message_flow_similarity") double messageFlowSimilarity,
        @JsonProperty("overall_similarity") double overallSimilarity,
        @JsonProperty("weighted_similarity") double weightedSimilarity,
        @JsonProperty("sequence_flow_similarity_percentage") double sequenceFlowSimilarityPercentage,
        @JsonProperty("message_flow_similarity_percentage") double messageFlowSimilarityPercentage,
        @JsonProperty("overall_similarity_percentage") double overallSimilarityPercentage,
        @JsonProperty("weighted_similarity_percentage") double weightedSimilarityPercentage,
        @JsonProperty("benchmark_sequence_flows") List<String> benchmarkSequenceFlows,
        @JsonProperty("benchmark_message_flows") List<String> benchmarkMessageFlows,
        @JsonProperty("target_sequence_flows") List<String> targetSequenceFlows,
        @JsonProperty("target_message_flows") List<String> targetMessageFlows,
        @JsonProperty("benchmark_bpmn_type") DiagramType benchmarkBpmnType,
        @JsonProperty("target_bpmn_type") DiagramType targetBpmnType
) {
}
