package org.processverify.engine.bpmn.models;

import lombok.Builder;

/**
 * A flow node of a process graph.
 *
 * @param id          identifier, unique within the graph
 * @param kind        structural role of the node
 * @param name        display label as written in the diagram, may be empty
 * @param laneId      id of the lane (participant or process) owning the node
 * @param bpmnType    BPMN element name, e.g. "userTask", "startEvent", "parallelGateway"
 * @param gatewayType routing type, only set for gateways
 */
@Builder
public record Node(
        String id,
        NodeKind kind,
        String name,
        String laneId,
        String bpmnType,
        GatewayType gatewayType
) {
    public Node(String id, NodeKind kind, String name) {
        this(id, kind, name, null, null, null);
    }

    public String label() {
        return name == null || name.isBlank() ? id : name;
    }

    public boolean isTask() {
        return kind == NodeKind.TASK;
    }

    public boolean isGateway() {
        return kind == NodeKind.GATEWAY;
    }

    public Node withId(String newId) {
        return new Node(newId, kind, name, laneId, bpmnType, gatewayType);
    }

    public Node withLaneId(String newLaneId) {
        return new Node(id, kind, name, newLaneId, bpmnType, gatewayType);
    }
}
