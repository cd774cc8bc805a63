package org.processverify.engine.bpmn.models;

import java.util.Locale;

/**
 * Routing type of a gateway.
 * The structural transformations treat every type alike; the type is kept for reporting.
 */
public enum GatewayType {
    EXCLUSIVE("exclusiveGateway"),
    INCLUSIVE("inclusiveGateway"),
    PARALLEL("parallelGateway"),
    EVENT_BASED("eventBasedGateway");

    private final String elementName;

    GatewayType(String elementName) {
        this.elementName = elementName;
    }

    public String elementName() {
        return elementName;
    }

    /**
     * Resolves a BPMN element name ("parallelGateway") or a plain label
     * ("Parallel", "event_based") to a gateway type.
     *
     * @throws IllegalArgumentException if the value names no known routing type
     */
    public static GatewayType from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Gateway type must not be blank");
        }
        String normalized = value.trim()
                .replace("_", "")
                .replace("-", "")
                .toLowerCase(Locale.ROOT);
        if (normalized.endsWith("gateway")) {
            normalized = normalized.substring(0, normalized.length() - "gateway".length());
        }
        return switch (normalized) {
            case "exclusive", "xor" -> EXCLUSIVE;
            case "inclusive", "or" -> INCLUSIVE;
            case "parallel", "and" -> PARALLEL;
            case "eventbased" -> EVENT_BASED;
            default -> throw new IllegalArgumentException("Unknown gateway type: " + value);
        };
    }
}
