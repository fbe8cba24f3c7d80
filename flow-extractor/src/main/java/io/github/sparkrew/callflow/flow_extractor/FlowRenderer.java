package io.github.sparkrew.callflow.flow_extractor;

import io.github.sparkrew.callflow.flow_extractor.model.FlowEntry;
import io.github.sparkrew.callflow.flow_extractor.model.FlowManifest;
import io.github.sparkrew.callflow.flow_extractor.model.FlowSequence;
import io.github.sparkrew.callflow.flow_extractor.model.ImportRef;
import io.github.sparkrew.callflow.flow_extractor.model.RenderedFlow;
import io.github.sparkrew.callflow.flow_extractor.model.SourceMethod;
import io.github.sparkrew.callflow.flow_extractor.model.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a flow sequence into the merged reference source and its manifest.
 * The merged source is meant to be read, it is not expected to compile.
 */
public class FlowRenderer {

    private static final Logger log = LoggerFactory.getLogger(FlowRenderer.class);
    private static final String NL = "\n";

    private final RenderMode mode;

    public FlowRenderer(RenderMode mode) {
        this.mode = mode;
    }

    public FlowRenderer() {
        this(RenderMode.REACHED_METHODS);
    }

    public RenderedFlow render(FlowSequence sequence) {
        FlowManifest manifest = new FlowManifest(sequence.target(), sequence.entries());
        StringBuilder out = new StringBuilder();
        out.append("// Call flow of ").append(sequence.target())
                .append(", merged for reference only. This file is not meant to compile.").append(NL);
        if (sequence.truncated()) {
            out.append("// The flow was cut at ").append(sequence.entries().size()).append(" classes.").append(NL);
        }
        out.append(NL);

        Set<String> imports = mergedImports(sequence.units());
        if (!imports.isEmpty()) {
            imports.forEach(statement -> out.append(statement).append(NL));
            out.append(NL);
        }

        for (int i = 0; i < sequence.entries().size(); i++) {
            FlowEntry entry = sequence.entries().get(i);
            SourceUnit unit = sequence.units().get(i);
            out.append(NL);
            out.append("// === ").append(entry.index()).append(". ").append(entry.className())
                    .append("  (from ").append(entry.file())
                    .append(" lines ").append(entry.startLine()).append('-').append(entry.endLine()).append(')')
                    .append(NL);
            if (!unit.packageName().isEmpty()) {
                out.append("// package ").append(unit.packageName()).append(NL);
            }
            if (mode == RenderMode.FULL_CLASS) {
                out.append(unit.source()).append(NL);
            } else {
                appendReachedMethods(out, unit, sequence.scannedMethods(entry.className()));
            }
        }
        log.debug("Rendered {} classes of {} in {} mode", sequence.entries().size(), sequence.target(), mode);
        return new RenderedFlow(out.toString(), manifest);
    }

    private static void appendReachedMethods(StringBuilder out, SourceUnit unit, List<SourceMethod> methods) {
        out.append(unit.header()).append(NL);
        for (SourceMethod method : methods) {
            out.append(NL);
            out.append("    // ---- method: ").append(method.name()).append(NL);
            out.append(method.source()).append(NL);
        }
        out.append('}').append(NL);
    }

    /**
     * Import statements of all visited classes, deduplicated and sorted.
     */
    static Set<String> mergedImports(List<SourceUnit> units) {
        Set<String> statements = new TreeSet<>();
        for (SourceUnit unit : units) {
            for (ImportRef ref : unit.imports()) {
                statements.add(ref.toStatement());
            }
        }
        return statements;
    }
}
