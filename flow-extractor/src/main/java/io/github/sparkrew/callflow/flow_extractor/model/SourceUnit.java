package io.github.sparkrew.callflow.flow_extractor.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Normalized view of one type declaration (class, interface, enum, record or annotation).
 * Line numbers are 1-based and inclusive; slicing the file by them gives back {@link #source()}.
 */
public record SourceUnit(
        String simpleName,
        String packageName,
        Path file,
        String kind,
        int startLine,
        int endLine,
        String header,
        String source,
        List<ImportRef> imports,
        List<String> supertypes,
        List<SourceMethod> methods
) {
    public SourceUnit {
        packageName = packageName == null ? "" : packageName;
        imports = List.copyOf(imports);
        supertypes = List.copyOf(supertypes);
        methods = List.copyOf(methods);
    }

    /**
     * Package-qualified name. Nested types are qualified by package only, the same way they are
     * looked up from call sites.
     */
    public String qualifiedName() {
        return packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
    }

    /**
     * The file path with forward slashes, as written to the manifest.
     */
    public String filePath() {
        return file.toString().replace('\\', '/');
    }

    public Optional<ImportRef> findImport(String simpleName) {
        return imports.stream()
                .filter(i -> !i.isStatic() && simpleName.equals(i.simpleName()))
                .findFirst();
    }
}
