package org.processverify.engine.bpmn.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A partition of the process graph: one participant of a collaboration, or one process
 * of a process diagram. Translation gives each lane its own start and end place.
 *
 * @param id            participant id (collaboration) or process id (process diagram)
 * @param name          participant or process name, falls back to the id
 * @param processRef    id of the BPMN process holding the lane's nodes
 * @param nodesById     tasks, events and gateways in document order
 * @param sequenceFlows sequence flows inside the lane
 */
public record Lane(
        String id,
        String name,
        String processRef,
        Map<String, Node> nodesById,
        List<Edge> sequenceFlows
) {
    public Lane {
        nodesById = nodesById == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(nodesById));
        sequenceFlows = sequenceFlows == null ? List.of() : List.copyOf(sequenceFlows);
    }

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }

    public List<Node> nodesOfKind(NodeKind kind) {
        return nodesById.values().stream()
                .filter(node -> node.kind() == kind)
                .toList();
    }

    public List<Node> tasks() {
        return nodesOfKind(NodeKind.TASK);
    }

    public List<Node> gateways() {
        return nodesOfKind(NodeKind.GATEWAY);
    }

    public boolean isStartEvent(String nodeId) {
        Node node = nodesById.get(nodeId);
        return node != null && node.kind() == NodeKind.START_EVENT;
    }

    public boolean isEndEvent(String nodeId) {
        Node node = nodesById.get(nodeId);
        return node != null && node.kind() == NodeKind.END_EVENT;
    }
}
