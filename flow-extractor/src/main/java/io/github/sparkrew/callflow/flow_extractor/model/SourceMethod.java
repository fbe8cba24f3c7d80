package io.github.sparkrew.callflow.flow_extractor.model;

import java.util.List;

/**
 * A method or constructor declared directly in a type body.
 * Constructors carry the simple name of their class. The source is the exact slice of the file
 * between the start and end lines.
 */
public record SourceMethod(
        String owner,
        String name,
        String parameters,
        int startLine,
        int endLine,
        String source,
        List<Invocation> invocations
) {
    public SourceMethod {
        invocations = List.copyOf(invocations);
    }
}
