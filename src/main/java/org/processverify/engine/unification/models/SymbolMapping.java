package org.processverify.engine.unification.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pairs a symbol of the target diagram with the benchmark symbol it stands for.
 *
 * @param confidence in [0, 1], may be absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SymbolMapping(
        @JsonProperty("bench_symbol") String benchSymbol,
        @JsonProperty("target_symbol") String targetSymbol,
        @JsonProperty("confidence") Double confidence
) {
    public SymbolMapping withConfidence(Double newConfidence) {
        return new SymbolMapping(benchSymbol, targetSymbol, newConfidence);
    }
}
