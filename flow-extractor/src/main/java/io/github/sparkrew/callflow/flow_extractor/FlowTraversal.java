package io.github.sparkrew.callflow.flow_extractor;

import io.github.sparkrew.callflow.flow_extractor.SymbolCatalog.Lookup;
import io.github.sparkrew.callflow.flow_extractor.model.FlowEntry;
import io.github.sparkrew.callflow.flow_extractor.model.FlowSequence;
import io.github.sparkrew.callflow.flow_extractor.model.SourceMethod;
import io.github.sparkrew.callflow.flow_extractor.model.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks the call graph from an entry class and records every class reached, once, in pre-order.
 * <p>
 * The walk uses an explicit stack instead of recursion: each frame holds the class being scanned,
 * the index of its next method and the referenced classes of the current method not yet handled.
 * A class is marked visited before it is descended into, so cycles stop at the second encounter.
 */
public class FlowTraversal {

    private static final Logger log = LoggerFactory.getLogger(FlowTraversal.class);

    private final int maxClasses;
    private final boolean includeSupertypes;

    /**
     * @param maxClasses        Maximum number of classes in a sequence, 0 for no limit.
     * @param includeSupertypes Whether declared superclasses and interfaces are followed.
     */
    public FlowTraversal(int maxClasses, boolean includeSupertypes) {
        if (maxClasses < 0) {
            throw new IllegalArgumentException("maxClasses must not be negative: " + maxClasses);
        }
        this.maxClasses = maxClasses;
        this.includeSupertypes = includeSupertypes;
    }

    public FlowTraversal() {
        this(0, false);
    }

    /**
     * Extracts the flow of a target class.
     *
     * @param target  Simple or qualified name of the entry class.
     * @param catalog All types of the project.
     * @return The visited classes in order, with the target first.
     * @throws TargetNotFoundException if no declaration matches the target.
     */
    public FlowSequence extract(String target, SymbolCatalog catalog) {
        SourceUnit root = findTarget(target, catalog);
        InvocationResolver resolver = new InvocationResolver(catalog);

        Set<String> visited = new HashSet<>();
        List<FlowEntry> entries = new ArrayList<>();
        List<SourceUnit> units = new ArrayList<>();
        Map<String, List<SourceMethod>> scanned = new LinkedHashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();
        boolean truncated = false;

        visit(root, visited, entries, units, scanned);
        stack.push(newFrame(root, resolver));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.pending.hasNext()) {
                SourceUnit candidate = frame.pending.next();
                if (visited.contains(candidate.simpleName())) {
                    continue;
                }
                if (maxClasses > 0 && entries.size() >= maxClasses) {
                    truncated = true;
                    log.warn("Stopped the flow of {} at {} classes, {} and later classes are left out",
                            root.simpleName(), maxClasses, candidate.simpleName());
                    break;
                }
                log.debug("{} -> {}", frame.unit.simpleName(), candidate.simpleName());
                visit(candidate, visited, entries, units, scanned);
                stack.push(newFrame(candidate, resolver));
            } else if (frame.nextMethod < frame.unit.methods().size()) {
                SourceMethod method = frame.unit.methods().get(frame.nextMethod++);
                scanned.get(frame.unit.simpleName()).add(method);
                frame.pending = resolver.resolve(method, frame.unit).iterator();
            } else {
                stack.pop();
            }
        }

        log.info("Flow of {} reaches {} classes", root.simpleName(), entries.size());
        Map<String, List<SourceMethod>> frozen = new LinkedHashMap<>();
        scanned.forEach((name, methods) -> frozen.put(name, List.copyOf(methods)));
        return new FlowSequence(root.simpleName(), entries, units, frozen, truncated);
    }

    private Frame newFrame(SourceUnit unit, InvocationResolver resolver) {
        List<SourceUnit> supertypes = includeSupertypes ? resolver.resolveSupertypes(unit) : List.of();
        return new Frame(unit, supertypes.iterator());
    }

    private static void visit(SourceUnit unit, Set<String> visited, List<FlowEntry> entries,
                              List<SourceUnit> units, Map<String, List<SourceMethod>> scanned) {
        visited.add(unit.simpleName());
        units.add(unit);
        entries.add(new FlowEntry(entries.size() + 1, unit.simpleName(), unit.filePath(),
                unit.startLine(), unit.endLine()));
        scanned.put(unit.simpleName(), new ArrayList<>());
    }

    /**
     * A qualified target is looked up as written first and then by its simple name.
     */
    static SourceUnit findTarget(String target, SymbolCatalog catalog) {
        if (target == null || target.isBlank()) {
            throw new TargetNotFoundException(String.valueOf(target), catalog.simpleNames());
        }
        String name = target.trim();
        if (name.contains(".")) {
            Lookup qualified = catalog.lookupQualified(name);
            if (qualified instanceof Lookup.Resolved resolved) {
                return resolved.unit();
            }
            if (qualified instanceof Lookup.Ambiguous ambiguous) {
                return ambiguous.first();
            }
            name = name.substring(name.lastIndexOf('.') + 1);
            log.info("Mapping target {} -> {}", target, name);
        }
        Lookup lookup = catalog.lookup(name);
        if (lookup instanceof Lookup.Resolved resolved) {
            return resolved.unit();
        }
        if (lookup instanceof Lookup.Ambiguous ambiguous) {
            log.warn("Target {} is declared {} times, starting from {}", name, ambiguous.candidates().size(),
                    ambiguous.first().filePath());
            return ambiguous.first();
        }
        throw new TargetNotFoundException(target, catalog.simpleNames());
    }

    private static final class Frame {
        private final SourceUnit unit;
        private int nextMethod;
        private Iterator<SourceUnit> pending;

        private Frame(SourceUnit unit, Iterator<SourceUnit> pending) {
            this.unit = unit;
            this.pending = pending;
        }
    }
}
