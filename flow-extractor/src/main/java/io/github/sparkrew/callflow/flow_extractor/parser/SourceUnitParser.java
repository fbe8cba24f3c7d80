package io.github.sparkrew.callflow.flow_extractor.parser;

import io.github.sparkrew.callflow.flow_extractor.model.SourceUnit;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns the text of one source file into {@link SourceUnit}s.
 * <p>
 * Every named type declared in the file (top-level, nested or local) becomes one unit, in source
 * order, carrying the methods and constructors declared directly in its body. Implementations are
 * best effort: a malformed body still yields the methods that could be recognized. Line ranges are
 * 1-based and inclusive.
 */
public interface SourceUnitParser {

    /**
     * @param file path recorded in the units, usually relative to the project root
     * @param text raw file content
     * @return the declared types, never empty
     * @throws SourceParseException if the text declares no type at all
     */
    List<SourceUnit> parse(Path file, String text) throws SourceParseException;
}
