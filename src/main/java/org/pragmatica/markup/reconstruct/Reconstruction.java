package org.pragmatica.markup.reconstruct;

import java.util.List;

/**
 * Reconstructed text plus the trace of how it was produced.
 *
 * @param text             regenerated source
 * @param ranges           top-level ranges of the original input, in order, covering all of it
 * @param inconsistencies  nodes that fell back to their verbatim span
 */
public record Reconstruction(String text, List<EmittedRange> ranges, List<ReconstructionInconsistency> inconsistencies) {
    public Reconstruction {
        ranges = List.copyOf(ranges);
        inconsistencies = List.copyOf(inconsistencies);
    }

    public boolean isConsistent() {
        return inconsistencies.isEmpty();
    }
}
