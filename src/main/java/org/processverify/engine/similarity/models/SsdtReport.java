package org.processverify.engine.similarity.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import org.processverify.engine.bpmn.models.DiagramType;

import java.util.List;
import java.util.Map;

/**
 * Result of comparing the shortest-distance matrices of two process diagrams.
 * Matrices are written row by row with {@code null} for unreachable pairs.
 */
@Builder
public record SsdtReport(
        @JsonProperty("ssdt_similarity") double ssdtSimilarity,
        @JsonProperty("ssdt_similarity_percentage") double ssdtSimilarityPercentage,
        @JsonProperty("benchmark_bpmn_type") DiagramType benchmarkBpmnType,
        @JsonProperty("target_bpmn_type") DiagramType targetBpmnType,
        @JsonProperty("benchmark_activities") Map<String, String> benchmarkActivities,
        @JsonProperty("target_activities") Map<String, String> targetActivities,
        @JsonProperty("benchmark_gateways") Map<String, String> benchmarkGateways,
        @JsonProperty("target_gateways") Map<String, String> targetGateways,
        @JsonProperty("benchmark_ssdt_matrix") List<List<Integer>> benchmarkSsdtMatrix,
        @JsonProperty("target_ssdt_matrix") List<List<Integer>> targetSsdtMatrix,
        @JsonProperty("aligned_benchmark_ssdt_matrix") List<List<Integer>> alignedBenchmarkSsdtMatrix,
        @JsonProperty("aligned_target_ssdt_matrix") List<List<Integer>> alignedTargetSsdtMatrix,
        @JsonProperty("benchmark_nodes") List<String> benchmarkNodes,
        @JsonProperty("target_nodes") List<String> targetNodes
) {
}
