package io.github.sparkrew.callflow.flow_extractor.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One visited class of a flow: where its declaration lives, in visiting order.
 */
@JsonPropertyOrder({"index", "class", "file", "start_line", "end_line"})
public record FlowEntry(
        @JsonProperty("index") int index,
        @JsonProperty("class") String className,
        @JsonProperty("file") String file,
        @JsonProperty("start_line") int startLine,
        @JsonProperty("end_line") int endLine
) {
}
