package org.processverify.engine.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Root engine configuration.
 * Every field carries its default, so a partial engine-config.json only overrides what it names.
 * <p>
 * Example:
 * {
 * "workspace": "workplace",
 * "dataSource": "cached",
 * "namingConvention": { "transitionPrefix": "t_" }
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {
    public static final String DATA_SOURCE_CACHED = "cached";
    public static final String DATA_SOURCE_GENERATE = "generate";

    /**
     * Directory holding the pipeline artifacts (flow documents, PNML, reports).
     */
    public String workspace = "workplace";

    /**
     * Where flow data comes from: "cached" reads precomputed artifacts,
     * "generate" asks the generation service.
     */
    public String dataSource = DATA_SOURCE_CACHED;

    /**
     * Validate input BPMN files against the BPMN 2.0 schema before translation.
     */
    public boolean validateBpmnInput = false;

    public NamingConvention namingConvention = new NamingConvention();
    public PetriNetSettings petriNet = new PetriNetSettings();
    public SimilaritySettings similarity = new SimilaritySettings();
    public ClosureSettings closure = new ClosureSettings();
    public OutputFiles outputFiles = new OutputFiles();
}
