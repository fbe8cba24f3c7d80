package io.github.sparkrew.callflow.flow_extractor.utils;

import java.util.Set;

/**
 * Helpers for the dotted names and receiver chains found in source text.
 */
public class NameFilter {

    private static final Set<String> KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null"
    );

    /**
     * Reserved words only. Contextual keywords such as {@code record} or {@code var} are valid
     * method names and are not reported.
     */
    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }

    /**
     * Whether a name segment looks like a type name, i.e. starts with an uppercase letter.
     */
    public static boolean isTypeLike(String segment) {
        return segment != null && !segment.isEmpty() && Character.isUpperCase(segment.charAt(0));
    }

    public static String simpleName(String name) {
        int lastDot = name.lastIndexOf('.');
        return lastDot < 0 ? name : name.substring(lastDot + 1);
    }

    /**
     * Normalizes a receiver or type as written: drops whitespace, type-use annotations,
     * type arguments and array brackets. {@code Map<String, List<X>>} becomes {@code Map},
     * {@code com.x . Foo} becomes {@code com.x.Foo}.
     */
    public static String filterName(String name) {
        if (name == null) {
            return "";
        }
        // Annotations on type uses, e.g. "@NonNull Foo"
        String filtered = name.replaceAll("@[\\w.]+(\\([^)]*\\))?\\s*", "");
        filtered = filtered.replaceAll("\\s+", "");
        // Strip type arguments, innermost first
        String previous;
        do {
            previous = filtered;
            filtered = filtered.replaceAll("<[^<>]*>", "");
        } while (!filtered.equals(previous));
        return filtered.replace("[]", "");
    }

    /**
     * Whether the text is a plain dotted chain of identifiers such as {@code a.b.C}.
     */
    public static boolean isDottedName(String text) {
        return text != null && text.matches("[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)*");
    }
}
