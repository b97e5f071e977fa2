package org.pragmatica.markup.tree;

import java.util.Arrays;

/**
 * Maps raw offsets to line/column positions.
 *
 * <p>Built once per document by scanning for newlines, so every parser derives
 * positions the same way.
 */
public final class LineIndex {
    private final String text;
    private final int[] lineStarts;

    private LineIndex(String text, int[] lineStarts) {
        this.text = text;
        this.lineStarts = lineStarts;
    }

    public static LineIndex of(String text) {
        var starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return new LineIndex(text, Arrays.copyOf(starts, count));
    }

    /**
     * Location of the given offset. Offsets past the end are clamped to the buffer length.
     */
    public SourceLocation location(int offset) {
        int clamped = Math.max(0, Math.min(offset, text.length()));
        int idx = Arrays.binarySearch(lineStarts, clamped);
        int lineIdx = idx >= 0 ? idx : -idx - 2;
        return SourceLocation.at(lineIdx + 1, clamped - lineStarts[lineIdx], clamped);
    }

    public SourceSpan span(int start, int end) {
        return SourceSpan.of(location(start), location(end));
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Offset of the first character of a 1-based line.
     */
    public int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /**
     * Offset just past the last character of a 1-based line, newline excluded.
     */
    public int lineEnd(int line) {
        return line < lineStarts.length ? lineStarts[line] - 1 : text.length();
    }

    /**
     * Text of a 1-based line without its newline.
     */
    public String line(int line) {
        return text.substring(lineStart(line), lineEnd(line));
    }
}
