package io.github.sparkrew.callflow.flow_extractor.parser;

import java.nio.file.Path;

/**
 * Thrown when a file does not contain any recognizable type declaration.
 * The file is skipped; the rest of the run goes on.
 */
public class SourceParseException extends Exception {

    public SourceParseException(Path file, String message) {
        super(file + ": " + message);
    }
}
