package org.processverify.engine.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Attributes of the PNML document written for a translated net.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PetriNetSettings {
    public static final String PNML_CORE_MODEL = "http://www.pnml.org/version-2009/grammar/pnmlcoremodel";

    public String netId = "bpmn_converted_net";
    public String netType = PNML_CORE_MODEL;
    public String pageId = "page1";

    /**
     * Namespace accepted when reading PNML. Elements without a namespace are accepted as well.
     */
    public String pnmlNamespace = PNML_CORE_MODEL;
}
