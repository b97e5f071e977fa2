package org.pragmatica.markup.transform;

import org.pragmatica.markup.transform.pass.EmptyCaptionPass;
import org.pragmatica.markup.transform.pass.HeadingCleanupPass;
import org.pragmatica.markup.transform.pass.LinkToCitationPass;
import org.pragmatica.markup.transform.pass.NestedEmphasisPass;
import org.pragmatica.markup.transform.pass.ShorthandMacroPass;
import org.pragmatica.markup.tree.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs passes over a document in the order the caller lists them.
 *
 * <p>Fixes are collected per run and returned; the pipeline keeps no state between runs.
 * Passes written for another dialect are skipped.
 */
public final class PassPipeline {
    private static final Logger log = LoggerFactory.getLogger(PassPipeline.class);

    private final Map<PassId, Pass> passes;

    private PassPipeline(Map<PassId, Pass> passes) {
        this.passes = passes;
    }

    public static PassPipeline create() {
        return create(PassConfig.DEFAULT);
    }

    public static PassPipeline create(PassConfig config) {
        var passes = new EnumMap<PassId, Pass>(PassId.class);
        passes.put(PassId.SHORTHAND_MACRO, new ShorthandMacroPass(config));
        passes.put(PassId.NESTED_EMPHASIS, new NestedEmphasisPass(config));
        passes.put(PassId.EMPTY_CAPTION, new EmptyCaptionPass(config));
        passes.put(PassId.LINK_TO_CITATION, new LinkToCitationPass(config));
        passes.put(PassId.HEADING_CLEANUP, new HeadingCleanupPass());
        return new PassPipeline(passes);
    }

    public Pass pass(PassId id) {
        return passes.get(id);
    }

    public PipelineResult run(Document document) {
        return run(document, PassId.DEFAULT_ORDER);
    }

    public PipelineResult run(Document document, List<PassId> order) {
        var fixes = new ArrayList<Fix>();

        for (var id : order) {
            if (!id.appliesTo(document.dialect())) {
                log.debug("Skipping {}: not applicable to {}", id, document.dialect());
                continue;
            }
            var result = passes.get(id).apply(document);
            log.debug("{} applied {} fixes", id, result.fixes().size());
            fixes.addAll(result.fixes());
        }
        return new PipelineResult(document, fixes);
    }
}
