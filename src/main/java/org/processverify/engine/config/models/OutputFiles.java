package org.processverify.engine.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * File names of the artifacts exchanged through the workspace directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OutputFiles {
    public String seqOutputFile = "seq_output.json";
    public String gateOutputFile = "gate_output.json";
    public String symbolOutputFile = "symbol_output.json";
    public String ctlOutputFile = "ctl_output.json";
    public String updatedFlowOutputFile = "updated_flow_output.json";
    public String standardCtlConstraintsFile = "standard_ctl_constraints.json";
    public String transformedCtlOutputFile = "transformed_ctl_output.json";
    public String jaccardOutputFile = "jaccard_similarity.json";
    public String ssdtOutputFile = "ssdt_similarity.json";
    public String bpmnOutputFile = "bpmn_output.bpmn";

    /**
     * Appended to the BPMN base name to form the PNML file name: "order.bpmn" -> "order_petri_net.pnml".
     */
    public String pnmlSuffix = "_petri_net.pnml";
}
