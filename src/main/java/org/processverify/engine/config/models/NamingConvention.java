package org.processverify.engine.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Identifier prefixes of generated Petri-net elements.
 * A task "T1" becomes places "p_pre_T1", "p_post_T1" and transition "t_T1".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NamingConvention {
    public String prePlacePrefix = "p_pre_";
    public String postPlacePrefix = "p_post_";
    public String startPlacePrefix = "p_start_";
    public String endPlacePrefix = "p_end_";
    public String messagePlacePrefix = "p_msg_";
    public String transitionPrefix = "t_";
    public String arcPrefix = "arc_";

    public String prePlace(String nodeId) {
        return prePlacePrefix + nodeId;
    }

    public String postPlace(String nodeId) {
        return postPlacePrefix + nodeId;
    }

    public String startPlace(String laneName) {
        return startPlacePrefix + laneName;
    }

    public String endPlace(String laneName) {
        return endPlacePrefix + laneName;
    }

    public String messagePlace(String messageFlowId) {
        return messagePlacePrefix + messageFlowId;
    }

    public String transition(String nodeId) {
        return transitionPrefix + nodeId;
    }

    public String arc(int index) {
        return arcPrefix + index;
    }
}
