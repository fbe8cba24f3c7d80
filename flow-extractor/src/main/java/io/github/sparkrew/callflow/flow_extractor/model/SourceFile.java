package io.github.sparkrew.callflow.flow_extractor.model;

import java.nio.file.Path;

/**
 * A Java file of the scanned tree: its path relative to the project root and its text.
 */
public record SourceFile(Path path, String text) {
}
