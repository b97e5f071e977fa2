package org.pragmatica.markup.transform;

import org.pragmatica.markup.tree.Document;

import java.util.List;

/**
 * Document after a sequence of passes, with the fixes of every pass in run order.
 */
public record PipelineResult(Document document, List<Fix> fixes) {
    public PipelineResult {
        fixes = List.copyOf(fixes);
    }

    public List<String> descriptions() {
        return fixes.stream()
                    .map(Fix::description)
                    .toList();
    }
}
