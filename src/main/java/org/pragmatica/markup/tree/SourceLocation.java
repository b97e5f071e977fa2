package org.pragmatica.markup.tree;

/**
 * A position in source text. Line is 1-based, column is 0-based and counted from the
 * preceding newline, offset is the 0-based index into the raw buffer.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 0, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
