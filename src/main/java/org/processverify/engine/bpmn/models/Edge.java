package org.processverify.engine.bpmn.models;

/**
 * A directed flow between two nodes.
 *
 * @param id        BPMN flow id, synthesized when the document has none
 * @param sourceRef id of the source node
 * @param targetRef id of the target node
 * @param kind      sequence or message flow
 * @param laneId    lane owning the flow; for message flows the lane of the source
 */
public record Edge(
        String id,
        String sourceRef,
        String targetRef,
        FlowKind kind,
        String laneId
) {
    public static final String KEY_SEPARATOR = "->";

    /**
     * Set key of this flow. Two flows of the same kind with the same key are the same edge.
     */
    public String key() {
        return sourceRef + KEY_SEPARATOR + targetRef;
    }

    public Edge withEndpoints(String newSourceRef, String newTargetRef) {
        return new Edge(id, newSourceRef, newTargetRef, kind, laneId);
    }

    public Edge withLaneId(String newLaneId) {
        return new Edge(id, sourceRef, targetRef, kind, newLaneId);
    }
}
