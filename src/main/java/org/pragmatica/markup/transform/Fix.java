package org.pragmatica.markup.transform;

import org.pragmatica.markup.tree.SourceSpan;

/**
 * Audit record of one rewrite: which pass, what changed, and where in the original input.
 */
public record Fix(PassId pass, String description, SourceSpan span) {
    @Override
    public String toString() {
        return pass + " at " + span.start() + ": " + description;
    }
}
