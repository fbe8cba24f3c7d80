package io.github.sparkrew.callflow.flow_extractor;

/**
 * How much of each visited class the merged source shows.
 */
public enum RenderMode {
    /**
     * Class header, the methods scanned during the traversal and a closing brace.
     */
    REACHED_METHODS,
    /**
     * The complete declaration as written.
     */
    FULL_CLASS
}
