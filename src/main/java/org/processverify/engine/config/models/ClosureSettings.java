package org.processverify.engine.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ClosureSettings {
    /**
     * Actor written on flows synthesized by the closure reduction, distinguishing them
     * from flows asserted by the model author.
     */
    public String routingActor = "GATEWAY";
}
