package io.github.sparkrew.callflow.flow_extractor.utils;

/**
 * Blanks out comments and the contents of string, character and text-block literals.
 * The result has the same length as the input and keeps every line terminator, so offsets and
 * line numbers computed on the masked text are valid for the original one. Quotes are kept, so a
 * literal still reads as an expression.
 */
public class SourceMasker {

    public static String mask(String text) {
        StringBuilder sb = new StringBuilder(text);
        int i = 0;
        int length = text.length();
        while (i < length) {
            char c = text.charAt(i);
            char next = i + 1 < length ? text.charAt(i + 1) : '\0';
            if (c == '/' && next == '/') {
                int end = i;
                while (end < length && text.charAt(end) != '\n' && text.charAt(end) != '\r') {
                    end++;
                }
                blank(sb, i, end);
                i = end;
            } else if (c == '/' && next == '*') {
                int end = text.indexOf("*/", i + 2);
                end = end < 0 ? length : end + 2;
                blank(sb, i, end);
                i = end;
            } else if (text.startsWith("\"\"\"", i)) {
                int end = findTextBlockEnd(text, i + 3);
                blank(sb, i + 3, end);
                i = Math.min(length, end + 3);
            } else if (c == '"' || c == '\'') {
                int end = findLiteralEnd(text, i + 1, c);
                blank(sb, i + 1, end);
                i = end < length && text.charAt(end) == c ? end + 1 : end;
            } else {
                i++;
            }
        }
        return sb.toString();
    }

    private static int findTextBlockEnd(String text, int from) {
        int i = from;
        while (i < text.length()) {
            if (text.charAt(i) == '\\') {
                i += 2;
            } else if (text.startsWith("\"\"\"", i)) {
                return i;
            } else {
                i++;
            }
        }
        return text.length();
    }

    // Index of the closing quote. A plain literal never spans lines; an unterminated one stops at
    // the end of its line.
    private static int findLiteralEnd(String text, int from, char quote) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i;
            } else if (c == '\n' || c == '\r') {
                return i;
            } else {
                i++;
            }
        }
        return text.length();
    }

    private static void blank(StringBuilder sb, int start, int end) {
        for (int i = start; i < end && i < sb.length(); i++) {
            char c = sb.charAt(i);
            if (c != '\n' && c != '\r') {
                sb.setCharAt(i, ' ');
            }
        }
    }
}
