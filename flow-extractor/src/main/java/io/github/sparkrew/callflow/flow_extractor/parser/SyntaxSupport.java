package io.github.sparkrew.callflow.flow_extractor.parser;

import io.github.sparkrew.callflow.flow_extractor.model.ImportRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by both parser backends. Methods taking a {@code masked} argument expect
 * text produced by {@link io.github.sparkrew.callflow.flow_extractor.utils.SourceMasker}.
 */
public class SyntaxSupport {

    static final Pattern IMPORT_PATTERN = Pattern.compile(
            "import\\s+(static\\s+)?([\\w$]+(?:\\s*\\.\\s*[\\w$]+)*)(\\s*\\.\\s*\\*)?\\s*;");

    /**
     * Parses a single import statement such as {@code import static a.b.C.*;}.
     */
    public static Optional<ImportRef> parseImport(String statement) {
        if (statement == null) {
            return Optional.empty();
        }
        Matcher m = IMPORT_PATTERN.matcher(statement.trim());
        if (!m.lookingAt()) {
            return Optional.empty();
        }
        String qualifiedName = m.group(2).replaceAll("\\s+", "");
        return Optional.of(new ImportRef(qualifiedName, m.group(1) != null, m.group(3) != null));
    }

    /**
     * Index of the bracket closing the one at {@code open}, or -1 if it is never closed.
     */
    public static int findMatching(String masked, int open, char openChar, char closeChar) {
        int depth = 0;
        for (int i = open; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == openChar) {
                depth++;
            } else if (c == closeChar) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * The opening brace of a type body: the first '{' after the name outside any parentheses.
     * Returns -1 when a ';' comes first, which is not a declaration.
     */
    public static int findBodyStart(String masked, int from) {
        int parens = 0;
        for (int i = from; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                parens++;
            } else if (c == ')') {
                parens--;
            } else if (parens == 0 && c == '{') {
                return i;
            } else if (parens == 0 && (c == ';' || c == '}')) {
                return -1;
            }
        }
        return -1;
    }

    /**
     * For each offset, the number of braces opened and not yet closed before it.
     */
    public static int[] braceDepths(String masked) {
        int[] depths = new int[masked.length() + 1];
        int depth = 0;
        for (int i = 0; i < masked.length(); i++) {
            depths[i] = depth;
            char c = masked.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}' && depth > 0) {
                depth--;
            }
        }
        depths[masked.length()] = depth;
        return depths;
    }

    /**
     * Moves left from {@code from} past whitespace, returning the first non-blank index or
     * {@code lowerBound - 1}.
     */
    public static int skipWhitespaceBackward(String text, int from, int lowerBound) {
        int i = from;
        while (i >= lowerBound && Character.isWhitespace(text.charAt(i))) {
            i--;
        }
        return i;
    }

    /**
     * Splits a comma separated list of types at top level, ignoring commas inside type arguments.
     */
    public static List<String> splitTopLevel(String list) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (char c : list.toCharArray()) {
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            }
            if (c == ',' && depth == 0) {
                parts.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (!current.toString().isBlank()) {
            parts.add(current.toString().trim());
        }
        return parts;
    }

    public static String normalizeWhitespace(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }
}
