package org.processverify.engine.unification;

import org.processverify.engine.bpmn.models.Actor;
import org.processverify.engine.bpmn.models.Edge;
import org.processverify.engine.bpmn.models.Lane;
import org.processverify.engine.bpmn.models.Node;
import org.processverify.engine.bpmn.models.ProcessGraph;
import org.processverify.engine.source.DocumentHelper;
import org.processverify.engine.unification.models.BpmnSymbols;
import org.processverify.engine.unification.models.BpmnTaskSymbol;
import org.processverify.engine.unification.models.MappingQuality;
import org.processverify.engine.unification.models.SymbolMapping;
import org.processverify.engine.unification.models.UnificationDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aligns the identifiers of a target diagram with those of a benchmark diagram, so that
 * structural metrics compare like with like.
 */
public class SymbolMappingHelper {
    private static final Logger log = LoggerFactory.getLogger(SymbolMappingHelper.class);

    public static final double DEFAULT_CONFIDENCE = 0.5;
    public static final double HIGH_CONFIDENCE = 0.8;

    /**
     * Named participants and lanes as actors, named tasks with their description and BPMN type.
     */
    public static BpmnSymbols extractSymbols(ProcessGraph graph) {
        List<BpmnTaskSymbol> tasks = new ArrayList<>();
        for (Node task : graph.tasks()) {
            if (task.name() != null && !task.name().isBlank()) {
                tasks.add(new BpmnTaskSymbol(task.id(), task.name(), task.bpmnType()));
            }
        }
        return new BpmnSymbols(graph.actors(), tasks);
    }

    public static UnificationDocument loadUnification(Path unificationFile) {
        return DocumentHelper.readDocument(unificationFile, UnificationDocument.class);
    }

    /**
     * Renames target symbols to benchmark symbols: actor mappings apply to lanes and actors,
     * task mappings to tasks, gateways and every flow endpoint.
     *
     * @return a new graph; the input is not changed
     */
    public static ProcessGraph applyMappings(ProcessGraph graph, List<SymbolMapping> actorMappings,
                                             List<SymbolMapping> taskMappings) {
        Map<String, String> actorMap = toRenameMap(actorMappings);
        Map<String, String> taskMap = toRenameMap(taskMappings);

        List<Lane> lanes = new ArrayList<>();
        for (Lane lane : graph.lanes()) {
            String laneId = rename(actorMap, lane.id());

            Map<String, Node> nodes = new LinkedHashMap<>();
            for (Node node : lane.nodesById().values()) {
                Node renamed = (node.isTask() || node.isGateway())
                        ? node.withId(rename(taskMap, node.id()))
                        : node;
                nodes.putIfAbsent(renamed.id(), renamed.withLaneId(laneId));
            }

            List<Edge> flows = new ArrayList<>();
            for (Edge flow : lane.sequenceFlows()) {
                flows.add(renameEdge(flow, taskMap, actorMap));
            }
            lanes.add(new Lane(laneId, lane.name(), lane.processRef(), nodes, flows));
        }

        List<Edge> messageFlows = new ArrayList<>();
        for (Edge flow : graph.messageFlows()) {
            messageFlows.add(renameEdge(flow, taskMap, actorMap));
        }

        List<Actor> actors = new ArrayList<>();
        for (Actor actor : graph.actors()) {
            actors.add(new Actor(rename(actorMap, actor.id()), actor.name(), actor.type()));
        }

        log.debug("Applied {} actor and {} task mappings to '{}'", actorMap.size(), taskMap.size(), graph.id());
        return new ProcessGraph(graph.id(), graph.type(), lanes, messageFlows, actors);
    }

    /**
     * Replaces confidences outside [0, 1] by {@value #DEFAULT_CONFIDENCE}. Absent confidences stay absent.
     */
    public static List<SymbolMapping> normalizeConfidence(List<SymbolMapping> mappings) {
        List<SymbolMapping> normalized = new ArrayList<>();
        for (SymbolMapping mapping : mappings) {
            Double confidence = mapping.confidence();
            if (confidence != null && (confidence.isNaN() || confidence < 0 || confidence > 1)) {
                log.warn("Invalid confidence {} for mapping {} -> {}, using {}",
                        confidence, mapping.targetSymbol(), mapping.benchSymbol(), DEFAULT_CONFIDENCE);
                normalized.add(mapping.withConfidence(DEFAULT_CONFIDENCE));
            } else {
                normalized.add(mapping);
            }
        }
        return normalized;
    }

    public static MappingQuality assessQuality(List<SymbolMapping> actorMappings, List<SymbolMapping> taskMappings) {
        List<SymbolMapping> actors = normalizeConfidence(actorMappings);
        List<SymbolMapping> tasks = normalizeConfidence(taskMappings);
        int highActors = countHighConfidence(actors);
        int highTasks = countHighConfidence(tasks);
        return new MappingQuality(
                actors.size(), highActors,
                tasks.size(), highTasks,
                actors.isEmpty() ? 0 : (double) highActors / actors.size(),
                tasks.isEmpty() ? 0 : (double) highTasks / tasks.size());
    }

    /**
     * Normalizes the confidences of a document and attaches its quality metrics.
     */
    public static UnificationDocument validateMappingQuality(UnificationDocument document) {
        List<SymbolMapping> actors = normalizeConfidence(document.actorMappings());
        List<SymbolMapping> tasks = normalizeConfidence(document.taskMappings());
        return new UnificationDocument(actors, tasks, document.reasoning(), assessQuality(actors, tasks));
    }

    private static int countHighConfidence(List<SymbolMapping> mappings) {
        return (int) mappings.stream()
                .filter(m -> m.confidence() != null && m.confidence() >= HIGH_CONFIDENCE)
                .count();
    }

    private static Map<String, String> toRenameMap(List<SymbolMapping> mappings) {
        Map<String, String> renames = new LinkedHashMap<>();
        for (SymbolMapping mapping : mappings) {
            if (mapping.targetSymbol() != null && mapping.benchSymbol() != null) {
                renames.put(mapping.targetSymbol(), mapping.benchSymbol());
            }
        }
        return renames;
    }

    private static Edge renameEdge(Edge flow, Map<String, String> taskMap, Map<String, String> actorMap) {
        String laneId = flow.laneId() == null ? null : rename(actorMap, flow.laneId());
        return flow.withEndpoints(rename(taskMap, flow.sourceRef()), rename(taskMap, flow.targetRef()))
                .withLaneId(laneId);
    }

    private static String rename(Map<String, String> renames, String id) {
        return renames.getOrDefault(id, id);
    }
}
