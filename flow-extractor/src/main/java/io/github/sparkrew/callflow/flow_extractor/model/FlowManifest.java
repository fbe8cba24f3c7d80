package io.github.sparkrew.callflow.flow_extractor.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Structured description of an extracted flow, written as {@code <target>_flow.json}.
 */
@JsonPropertyOrder({"target", "sequence"})
public record FlowManifest(
        @JsonProperty("target") String target,
        @JsonProperty("sequence") List<FlowEntry> sequence
) {
    public FlowManifest {
        sequence = List.copyOf(sequence);
    }
}
