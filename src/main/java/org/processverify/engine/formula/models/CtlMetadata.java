package org.processverify.engine.formula.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CtlMetadata(
        @JsonProperty("format_version") String formatVersion,
        @JsonProperty("generation_timestamp") String generationTimestamp,
        @JsonProperty("constraint_count") int constraintCount,
        @JsonProperty("format") String format
) {
    public static final String FORMAT_VERSION = "1.0";
    public static final String STANDARD_FORMAT = "standard_ctl";
}
