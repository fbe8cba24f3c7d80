package io.github.sparkrew.callflow.flow_extractor;

import io.github.sparkrew.callflow.flow_extractor.SymbolCatalog.Lookup;
import io.github.sparkrew.callflow.flow_extractor.model.ImportRef;
import io.github.sparkrew.callflow.flow_extractor.model.Invocation;
import io.github.sparkrew.callflow.flow_extractor.model.SourceMethod;
import io.github.sparkrew.callflow.flow_extractor.model.SourceUnit;
import io.github.sparkrew.callflow.flow_extractor.utils.NameFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the invocations of a method to the cataloged types they reference.
 * <p>
 * Resolution is purely lexical: a receiver chain that starts with an uppercase-led segment names a
 * type ({@code Helper.log()}, {@code Color.RED}); a chain of lowercase package segments followed by
 * an uppercase-led one is a qualified type name ({@code com.acme.Helper.log()}). Anything else
 * (locals, fields, {@code this}, call results) is not followed, since no variable types are
 * tracked.
 */
public class InvocationResolver {

    private static final Logger log = LoggerFactory.getLogger(InvocationResolver.class);

    private final SymbolCatalog catalog;

    public InvocationResolver(SymbolCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Resolves the types referenced from a method body.
     *
     * @param method The method whose invocations are resolved.
     * @param owner  The type declaring the method, used for import and package preference.
     * @return Referenced types, distinct by simple name, in order of first occurrence.
     */
    public List<SourceUnit> resolve(SourceMethod method, SourceUnit owner) {
        Map<String, SourceUnit> resolved = new LinkedHashMap<>();
        for (Invocation invocation : method.invocations()) {
            Optional<SourceUnit> target = resolve(invocation, owner);
            if (target.isPresent()) {
                resolved.putIfAbsent(target.get().simpleName(), target.get());
            } else {
                log.trace("{}.{} line {}: {} {}.{} not followed", owner.simpleName(), method.name(),
                        invocation.line(), invocation.kind(), invocation.receiver(), invocation.name());
            }
        }
        return new ArrayList<>(resolved.values());
    }

    /**
     * Resolves the declared superclass and interfaces of a type.
     */
    public List<SourceUnit> resolveSupertypes(SourceUnit owner) {
        Map<String, SourceUnit> resolved = new LinkedHashMap<>();
        for (String supertype : owner.supertypes()) {
            resolveTypeChain(supertype, owner)
                    .ifPresent(unit -> resolved.putIfAbsent(unit.simpleName(), unit));
        }
        return new ArrayList<>(resolved.values());
    }

    Optional<SourceUnit> resolve(Invocation invocation, SourceUnit owner) {
        if (!invocation.hasReceiver()) {
            return Optional.empty();
        }
        String receiver = invocation.receiver();
        if (invocation.kind() == Invocation.Kind.CONSTRUCTOR_CALL) {
            return resolveConstructedType(receiver, owner);
        }
        return resolveTypeChain(receiver, owner);
    }

    /**
     * A chain such as {@code Outer.Inner} or {@code com.acme.Outer.Inner} names the type of its
     * first uppercase-led segment.
     */
    private Optional<SourceUnit> resolveTypeChain(String chain, SourceUnit owner) {
        String[] segments = chain.split("\\.");
        if (isSelfReference(segments[0])) {
            return Optional.empty();
        }
        if (NameFilter.isTypeLike(segments[0])) {
            return bySimpleName(segments[0], owner);
        }
        for (int i = 1; i < segments.length; i++) {
            if (NameFilter.isTypeLike(segments[i])) {
                return byQualifiedName(String.join(".", List.of(segments).subList(0, i + 1)));
            }
        }
        return Optional.empty();
    }

    /**
     * {@code new Outer.Inner()} instantiates {@code Inner}, so the last segment is the type; a package
     * prefix written before the first type segment qualifies it.
     */
    private Optional<SourceUnit> resolveConstructedType(String written, SourceUnit owner) {
        String[] segments = written.split("\\.");
        String simpleName = segments[segments.length - 1];
        if (!NameFilter.isTypeLike(simpleName) || isSelfReference(segments[0])) {
            return Optional.empty();
        }
        if (NameFilter.isTypeLike(segments[0])) {
            return bySimpleName(simpleName, owner);
        }
        int firstType = 1;
        while (!NameFilter.isTypeLike(segments[firstType])) {
            firstType++;
        }
        String packageName = String.join(".", List.of(segments).subList(0, firstType));
        return byQualifiedName(packageName + "." + simpleName);
    }

    private Optional<SourceUnit> bySimpleName(String simpleName, SourceUnit owner) {
        Lookup lookup = catalog.lookup(simpleName);
        if (lookup instanceof Lookup.Resolved resolved) {
            return Optional.of(resolved.unit());
        }
        if (lookup instanceof Lookup.Ambiguous ambiguous) {
            return Optional.of(disambiguate(ambiguous, owner));
        }
        return Optional.empty();
    }

    private Optional<SourceUnit> byQualifiedName(String qualifiedName) {
        Lookup lookup = catalog.lookupQualified(qualifiedName);
        if (lookup instanceof Lookup.Resolved resolved) {
            return Optional.of(resolved.unit());
        }
        if (lookup instanceof Lookup.Ambiguous ambiguous) {
            return Optional.of(ambiguous.first());
        }
        return Optional.empty();
    }

    /**
     * Picks a candidate by the owner's explicit import, then its wildcard imports, then its own
     * package, then the earliest file.
     */
    private SourceUnit disambiguate(Lookup.Ambiguous ambiguous, SourceUnit owner) {
        List<SourceUnit> candidates = ambiguous.candidates();
        String simpleName = ambiguous.first().simpleName();
        Optional<ImportRef> explicit = owner.findImport(simpleName);
        if (explicit.isPresent()) {
            for (SourceUnit candidate : candidates) {
                if (candidate.qualifiedName().equals(explicit.get().qualifiedName())) {
                    return candidate;
                }
            }
        }
        for (ImportRef ref : owner.imports()) {
            if (!ref.wildcard() || ref.isStatic()) {
                continue;
            }
            for (SourceUnit candidate : candidates) {
                if (candidate.packageName().equals(ref.packageName())) {
                    return candidate;
                }
            }
        }
        for (SourceUnit candidate : candidates) {
            if (candidate.packageName().equals(owner.packageName())) {
                return candidate;
            }
        }
        log.warn("Reference to {} from {} is ambiguous, using {}", simpleName, owner.qualifiedName(),
                ambiguous.first().filePath());
        return ambiguous.first();
    }

    private static boolean isSelfReference(String segment) {
        return "this".equals(segment) || "super".equals(segment);
    }
}
