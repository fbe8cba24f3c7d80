package io.github.sparkrew.callflow.flow_extractor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered result of one traversal.
 * Entries and units are parallel lists: {@code units.get(i)} is the declaration behind
 * {@code entries.get(i)}. {@code scannedMethods} maps a class simple name to the methods whose
 * invocations were followed, in declaration order.
 */
public record FlowSequence(
        String target,
        List<FlowEntry> entries,
        List<SourceUnit> units,
        Map<String, List<SourceMethod>> scannedMethods,
        boolean truncated
) {
    public FlowSequence {
        entries = List.copyOf(entries);
        units = List.copyOf(units);
        scannedMethods = Collections.unmodifiableMap(new LinkedHashMap<>(scannedMethods));
    }

    public List<String> classNames() {
        return entries.stream().map(FlowEntry::className).toList();
    }

    public List<SourceMethod> scannedMethods(String className) {
        return scannedMethods.getOrDefault(className, List.of());
    }
}
