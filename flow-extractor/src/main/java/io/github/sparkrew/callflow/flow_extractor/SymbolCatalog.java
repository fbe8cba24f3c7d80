package io.github.sparkrew.callflow.flow_extractor;

import io.github.sparkrew.callflow.flow_extractor.model.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Index of every parsed type of one run, by simple and by qualified name.
 * Units are kept in the order they were added, which is the file enumeration order; that order is
 * the tie-break between types sharing a simple name.
 */
public class SymbolCatalog {

    private static final Logger log = LoggerFactory.getLogger(SymbolCatalog.class);

    private final List<SourceUnit> units;
    private final Map<String, List<SourceUnit>> bySimpleName;
    private final Map<String, List<SourceUnit>> byQualifiedName;

    private SymbolCatalog(List<SourceUnit> units) {
        this.units = List.copyOf(units);
        Map<String, List<SourceUnit>> simple = new LinkedHashMap<>();
        Map<String, List<SourceUnit>> qualified = new LinkedHashMap<>();
        for (SourceUnit unit : this.units) {
            simple.computeIfAbsent(unit.simpleName(), k -> new ArrayList<>()).add(unit);
            qualified.computeIfAbsent(unit.qualifiedName(), k -> new ArrayList<>()).add(unit);
        }
        this.bySimpleName = freeze(simple);
        this.byQualifiedName = freeze(qualified);
    }

    public static SymbolCatalog build(List<SourceUnit> units) {
        SymbolCatalog catalog = new SymbolCatalog(units);
        catalog.collisions().forEach((name, candidates) ->
                log.warn("Class name {} is declared {} times ({}), the first one wins when a call site is ambiguous",
                        name, candidates.size(),
                        candidates.stream().map(SourceUnit::filePath).collect(Collectors.joining(", "))));
        log.info("Cataloged {} types under {} simple names", catalog.units.size(), catalog.bySimpleName.size());
        return catalog;
    }

    public Lookup lookup(String simpleName) {
        return toLookup(bySimpleName.get(simpleName));
    }

    public Lookup lookupQualified(String qualifiedName) {
        return toLookup(byQualifiedName.get(qualifiedName));
    }

    /**
     * Simple names declared more than once, with their declarations in catalog order.
     */
    public Map<String, List<SourceUnit>> collisions() {
        Map<String, List<SourceUnit>> collisions = new LinkedHashMap<>();
        bySimpleName.forEach((name, candidates) -> {
            if (candidates.size() > 1) {
                collisions.put(name, candidates);
            }
        });
        return Collections.unmodifiableMap(collisions);
    }

    /**
     * Every distinct simple name, in catalog order.
     */
    public List<String> simpleNames() {
        return List.copyOf(bySimpleName.keySet());
    }

    public List<SourceUnit> units() {
        return units;
    }

    private static Lookup toLookup(List<SourceUnit> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Lookup.Unresolved.INSTANCE;
        }
        if (candidates.size() == 1) {
            return new Lookup.Resolved(candidates.get(0));
        }
        return new Lookup.Ambiguous(candidates);
    }

    private static Map<String, List<SourceUnit>> freeze(Map<String, List<SourceUnit>> index) {
        Map<String, List<SourceUnit>> frozen = new LinkedHashMap<>();
        index.forEach((name, list) -> frozen.put(name, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }

    /**
     * Outcome of a name lookup.
     */
    public sealed interface Lookup {

        record Resolved(SourceUnit unit) implements Lookup {
        }

        record Ambiguous(List<SourceUnit> candidates) implements Lookup {
            public Ambiguous {
                candidates = List.copyOf(candidates);
            }

            /**
             * The candidate declared in the earliest file.
             */
            public SourceUnit first() {
                return candidates.get(0);
            }
        }

        final class Unresolved implements Lookup {
            static final Unresolved INSTANCE = new Unresolved();

            private Unresolved() {
            }

            @Override
            public String toString() {
                return "Unresolved";
            }
        }
    }
}
