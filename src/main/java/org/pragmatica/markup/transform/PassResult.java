package org.pragmatica.markup.transform;

import org.pragmatica.markup.tree.Document;

import java.util.List;

/**
 * Outcome of one pass run. The document is the one passed in, mutated in place.
 */
public record PassResult(Document document, List<Fix> fixes) {
    public PassResult {
        fixes = List.copyOf(fixes);
    }

    public static PassResult unchanged(Document document) {
        return new PassResult(document, List.of());
    }

    public boolean changed() {
        return !fixes.isEmpty();
    }
}
