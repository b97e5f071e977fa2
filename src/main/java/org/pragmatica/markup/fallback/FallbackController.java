package org.pragmatica.markup.fallback;

import org.pragmatica.markup.error.Diagnostic;
import org.pragmatica.markup.parser.DocumentParser;
import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.reconstruct.ReconstructionInconsistency;
import org.pragmatica.markup.reconstruct.Reconstructor;
import org.pragmatica.markup.transform.PassConfig;
import org.pragmatica.markup.transform.PassId;
import org.pragmatica.markup.transform.PassPipeline;
import org.pragmatica.markup.tree.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Processes one document end to end and picks the recovery path.
 *
 * <p>Text that parses goes through the tree passes and the reconstructor. Text that does not
 * parse goes through {@link TextualCleanup}. Nothing is thrown: when both paths fail the input
 * is returned unchanged with {@link ProcessingOutcome.Status#FAILED}.
 */
public final class FallbackController {
    private static final Logger log = LoggerFactory.getLogger(FallbackController.class);

    private final ParserConfig parserConfig;
    private final PassConfig passConfig;
    private final PassPipeline pipeline;
    private final TextualCleanup cleanup;

    public FallbackController() {
        this(ParserConfig.DEFAULT, PassConfig.DEFAULT);
    }

    public FallbackController(ParserConfig parserConfig, PassConfig passConfig) {
        this.parserConfig = parserConfig;
        this.passConfig = passConfig;
        this.pipeline = PassPipeline.create(passConfig);
        this.cleanup = new TextualCleanup(passConfig);
    }

    public ProcessingOutcome process(String text, Dialect dialect) {
        return process(text, dialect, PassId.DEFAULT_ORDER);
    }

    public ProcessingOutcome process(String text, Dialect dialect, List<PassId> passes) {
        try {
            var result = DocumentParser.forDialect(dialect, parserConfig).parse(text);
            if (result instanceof ParseResult.Failure failure) {
                var error = failure.error();
                log.warn("Tree parsing failed at offset {}, falling back to textual cleanup: {}",
                         error.offset(), error.message());
                return degrade(text, dialect, "Parse error at offset " + error.offset() + ": " + error.message());
            }
            return processTree((ParseResult.Success) result, passes);
        } catch (RuntimeException e) {
            log.error("Tree processing failed, falling back to textual cleanup", e);
            return degrade(text, dialect, "Tree processing failed: " + e.getMessage());
        }
    }

    private ProcessingOutcome processTree(ParseResult.Success parsed, List<PassId> passes) {
        var warnings = new ArrayList<String>();
        parsed.diagnostics().stream()
              .map(Diagnostic::formatSimple)
              .forEach(warnings::add);

        var pipelineResult = pipeline.run(parsed.document(), passes);
        var reconstruction = Reconstructor.reconstructTraced(pipelineResult.document());
        reconstruction.inconsistencies().stream()
                      .map(ReconstructionInconsistency::message)
                      .forEach(warnings::add);

        var fixes = new ArrayList<>(pipelineResult.descriptions());
        var text = reconstruction.text();
        if (passConfig.collapseBlankLines() && parsed.document().dialect() == Dialect.MARKUP) {
            var collapsed = TextualCleanup.collapseBlankLines(text);
            if (!collapsed.equals(text)) {
                fixes.add("Cleaned excessive line breaks");
                text = collapsed;
            }
        }

        if (fixes.isEmpty()) {
            log.info("No fixes needed");
        } else {
            log.info("Applied {} fixes", fixes.size());
            fixes.forEach(fix -> log.debug("  - {}", fix));
        }
        return ProcessingOutcome.success(text, fixes, warnings);
    }

    private ProcessingOutcome degrade(String text, Dialect dialect, String reason) {
        try {
            var cleaned = cleanup.apply(text, dialect);
            log.info("Textual cleanup applied {} fixes", cleaned.fixes().size());
            return ProcessingOutcome.degraded(cleaned.text(), cleaned.fixes(), List.of(reason), reason);
        } catch (RuntimeException e) {
            log.error("Textual cleanup failed, returning input unchanged", e);
            return ProcessingOutcome.failed(text, reason + "; textual cleanup failed: " + e.getMessage());
        }
    }
}
