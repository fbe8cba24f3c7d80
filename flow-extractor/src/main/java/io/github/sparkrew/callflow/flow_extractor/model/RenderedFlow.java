package io.github.sparkrew.callflow.flow_extractor.model;

/**
 * Output of the renderer: the merged reference source and the manifest.
 */
public record RenderedFlow(String mergedSource, FlowManifest manifest) {
}
