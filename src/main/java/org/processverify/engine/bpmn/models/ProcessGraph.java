package org.processverify.engine.bpmn.models;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Control-flow graph of a BPMN diagram, split into lanes.
 * A process diagram has one lane per process; a collaboration has one lane per participant
 * plus the message flows crossing between them.
 *
 * @param id           id of the BPMN definitions element
 * @param type         process or collaboration
 * @param lanes        partitions in document order
 * @param messageFlows cross-lane message flows
 * @param actors       named participants and lanes, used for symbol extraction
 */
public record ProcessGraph(
        String id,
        DiagramType type,
        List<Lane> lanes,
        List<Edge> messageFlows,
        List<Actor> actors
) {
    public ProcessGraph {
        type = type == null ? DiagramType.PROCESS : type;
        lanes = lanes == null ? List.of() : List.copyOf(lanes);
        messageFlows = messageFlows == null ? List.of() : List.copyOf(messageFlows);
        actors = actors == null ? List.of() : List.copyOf(actors);
    }

    /**
     * A graph with no lanes and no flows, used where an unreadable input degrades gracefully.
     */
    public static ProcessGraph empty() {
        return new ProcessGraph("", DiagramType.PROCESS, List.of(), List.of(), List.of());
    }

    public boolean isCollaboration() {
        return type == DiagramType.COLLABORATION;
    }

    public boolean isEmpty() {
        return lanes.isEmpty() && messageFlows.isEmpty();
    }

    public List<Edge> sequenceFlows() {
        List<Edge> flows = new ArrayList<>();
        for (Lane lane : lanes) {
            flows.addAll(lane.sequenceFlows());
        }
        return flows;
    }

    public Map<String, Node> nodesById() {
        Map<String, Node> nodes = new LinkedHashMap<>();
        for (Lane lane : lanes) {
            lane.nodesById().forEach(nodes::putIfAbsent);
        }
        return nodes;
    }

    public Optional<Node> findNode(String nodeId) {
        return Optional.ofNullable(nodesById().get(nodeId));
    }

    public List<Node> tasks() {
        return nodesById().values().stream().filter(Node::isTask).toList();
    }

    public List<Node> gateways() {
        return nodesById().values().stream().filter(Node::isGateway).toList();
    }
}
