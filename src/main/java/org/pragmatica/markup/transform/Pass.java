package org.pragmatica.markup.transform;

import org.pragmatica.markup.tree.Document;

/**
 * One named tree rewrite.
 *
 * <p>A pass inspects a node and at most a bounded window of its following siblings, rewrites
 * matches in place and reports them as {@link Fix}es. Passes never fail: a node that does not
 * match is left exactly as parsed. Running a pass on its own output finds nothing to fix.
 */
public interface Pass {
    PassId id();

    PassResult apply(Document document);
}
