package io.github.sparkrew.callflow.flow_extractor;

import io.github.sparkrew.callflow.flow_extractor.parser.ParserBackend;

import java.nio.file.Path;

/**
 * Settings of one extraction run.
 *
 * @param projectRoot       Root directory scanned for Java files.
 * @param target            Simple or qualified name of the entry class.
 * @param outputDir         Directory receiving the merged source and the manifest.
 * @param backend           Parser used for every file.
 * @param maxClasses        Traversal ceiling, 0 for no limit.
 * @param renderMode        How visited classes are rendered.
 * @param includeSupertypes Whether extends/implements edges are followed.
 */
public record ExtractionOptions(
        Path projectRoot,
        String target,
        Path outputDir,
        ParserBackend backend,
        int maxClasses,
        RenderMode renderMode,
        boolean includeSupertypes
) {
    public ExtractionOptions {
        if (maxClasses < 0) {
            throw new IllegalArgumentException("maxClasses must not be negative: " + maxClasses);
        }
        outputDir = outputDir == null ? Path.of(".") : outputDir;
        backend = backend == null ? ParserBackend.SPOON : backend;
        renderMode = renderMode == null ? RenderMode.REACHED_METHODS : renderMode;
    }

    /**
     * Defaults: Spoon parser, no ceiling, reached methods only, no supertype edges.
     */
    public static ExtractionOptions of(Path projectRoot, String target, Path outputDir) {
        return new ExtractionOptions(projectRoot, target, outputDir, ParserBackend.SPOON, 0,
                RenderMode.REACHED_METHODS, false);
    }
}
