package io.github.sparkrew.callflow.flow_extractor.model;

/**
 * A single import statement of a compilation unit.
 * For a wildcard import the qualified name is the imported package (or class, for static wildcards).
 */
public record ImportRef(String qualifiedName, boolean isStatic, boolean wildcard) {

    /**
     * Simple name bound by a single-type import, or null for wildcard imports.
     */
    public String simpleName() {
        if (wildcard) {
            return null;
        }
        int lastDot = qualifiedName.lastIndexOf('.');
        return lastDot < 0 ? qualifiedName : qualifiedName.substring(lastDot + 1);
    }

    /**
     * The package whose types this import makes visible.
     * For {@code import a.b.C;} this is {@code a.b}, for {@code import a.b.*;} it is {@code a.b}.
     */
    public String packageName() {
        if (wildcard) {
            return qualifiedName;
        }
        int lastDot = qualifiedName.lastIndexOf('.');
        return lastDot < 0 ? "" : qualifiedName.substring(0, lastDot);
    }

    /**
     * Renders the import back as a Java statement.
     */
    public String toStatement() {
        return "import " + (isStatic ? "static " : "") + qualifiedName + (wildcard ? ".*" : "") + ";";
    }
}
