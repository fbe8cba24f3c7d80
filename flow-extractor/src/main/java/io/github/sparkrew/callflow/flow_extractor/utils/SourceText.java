package io.github.sparkrew.callflow.flow_extractor.utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw file text with a line index, so offsets can be turned into 1-based line numbers and
 * line ranges back into text. Recognizes {@code \n}, {@code \r\n} and {@code \r} terminators.
 */
public class SourceText {

    private final String text;
    private final int[] lineStarts;

    public SourceText(String text) {
        this.text = text;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                starts.add(i + 1);
            } else if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public String text() {
        return text;
    }

    /**
     * The 1-based line containing the given offset. Offsets past the end map to the last line.
     */
    public int lineOf(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    public int lineStart(int line) {
        return lineStarts[clamp(line) - 1];
    }

    /**
     * Offset just before the terminator of the given line.
     */
    public int lineEnd(int line) {
        int index = clamp(line);
        int end = index < lineStarts.length ? lineStarts[index] : text.length();
        while (end > lineStarts[index - 1] && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return end;
    }

    /**
     * Text of the lines {@code startLine..endLine}, both inclusive, without the final terminator.
     */
    public String slice(int startLine, int endLine) {
        if (endLine < startLine) {
            return "";
        }
        return text.substring(lineStart(startLine), lineEnd(endLine));
    }

    public String line(int line) {
        return slice(line, line);
    }

    private int clamp(int line) {
        return Math.max(1, Math.min(line, lineStarts.length));
    }
}
