package org.processverify.engine.bpmn.models;

/**
 * A named participant or lane of the diagram.
 *
 * @param type "participant" or "lane"
 */
public record Actor(
        String id,
        String name,
        String type
) {
    public static final String PARTICIPANT = "participant";
    public static final String LANE = "lane";
}
