package org.pragmatica.markup.tree;

import java.util.EnumSet;
import java.util.Set;

import static org.pragmatica.markup.tree.NodeKind.*;

/**
 * Input dialects and the closed set of node kinds each one produces.
 */
public enum Dialect {
    /**
     * LaTeX-like macro/environment markup.
     */
    MARKUP(EnumSet.of(TEXT, MACRO, CITATION, ENVIRONMENT, MATH, COMMENT, GROUP, ERROR)),

    /**
     * Lightweight block markup (Markdown-like).
     */
    BLOCK_MARKUP(EnumSet.of(TEXT, HEADING, PARAGRAPH, LINK, IMAGE, CITATION, CODE_INLINE, CODE_BLOCK,
                            EMPHASIS, STRONG, BLOCKQUOTE, LIST, LIST_ITEM, TABLE, TABLE_ROW, TABLE_CELL,
                            THEMATIC_BREAK, HTML, MATH, ERROR)),

    /**
     * Bibliographic-entry records (BibTeX-like).
     */
    BIB_ENTRY(EnumSet.of(ENTRY, FIELD, STRING_DEFINITION, PREAMBLE, COMMENT, TEXT, ERROR));

    private final Set<NodeKind> kinds;

    Dialect(Set<NodeKind> kinds) {
        this.kinds = kinds;
    }

    public boolean permits(NodeKind kind) {
        return kinds.contains(kind);
    }

    public Set<NodeKind> kinds() {
        return EnumSet.copyOf(kinds);
    }
}
