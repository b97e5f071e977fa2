package org.pragmatica.markup.transform;

import org.pragmatica.markup.tree.Dialect;

import java.util.List;

/**
 * Named tree-rewrite passes, declared in their default pipeline order.
 *
 * <p>{@link #LINK_TO_CITATION} expects {@link #SHORTHAND_MACRO} to have run first: a link whose
 * anchor text is still a verbatim shorthand has no plain text to derive a citation key from.
 */
public enum PassId {
    SHORTHAND_MACRO(Dialect.MARKUP),
    NESTED_EMPHASIS(Dialect.MARKUP),
    EMPTY_CAPTION(Dialect.MARKUP),
    LINK_TO_CITATION(Dialect.MARKUP),
    HEADING_CLEANUP(Dialect.BLOCK_MARKUP);

    /**
     * All passes in the order the pipeline runs them by default.
     */
    public static final List<PassId> DEFAULT_ORDER = List.of(values());

    private final Dialect dialect;

    PassId(Dialect dialect) {
        this.dialect = dialect;
    }

    public boolean appliesTo(Dialect target) {
        return dialect == target;
    }
}
