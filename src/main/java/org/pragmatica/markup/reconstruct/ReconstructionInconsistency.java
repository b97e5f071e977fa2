package org.pragmatica.markup.reconstruct;

import org.pragmatica.markup.tree.NodeKind;

/**
 * Position bookkeeping conflict found while reconstructing a rewritten node. The node was
 * emitted verbatim instead; reported for diagnostics only.
 */
public record ReconstructionInconsistency(NodeKind kind, int start, int end, int correctedEnd, String reason) {
    public String message() {
        return kind.display() + " at " + start + ": " + reason
               + " (recorded end " + end + ", corrected end " + correctedEnd + ")";
    }
}
