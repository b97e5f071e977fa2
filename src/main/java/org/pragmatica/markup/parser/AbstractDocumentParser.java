package org.pragmatica.markup.parser;

import org.pragmatica.markup.error.RecoveryStrategy;
import org.pragmatica.markup.tree.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Shared parse entry points. Subclasses always build a best-effort tree; the configured
 * recovery strategy decides whether recorded errors turn the result into a failure.
 */
public abstract class AbstractDocumentParser implements DocumentParser {
    private static final Logger log = LoggerFactory.getLogger(AbstractDocumentParser.class);

    protected final ParserConfig config;

    protected AbstractDocumentParser(ParserConfig config) {
        this.config = config;
    }

    public ParserConfig config() {
        return config;
    }

    /**
     * Build the document tree, recording any syntax errors in the context.
     */
    protected abstract Document buildDocument(ParsingContext ctx);

    @Override
    public final ParseResult parse(String input) {
        var ctx = ParsingContext.create(input);
        var document = buildDocument(ctx);

        if (ctx.hasErrors() && config.recoveryStrategy() == RecoveryStrategy.FAIL_FAST) {
            var error = ctx.firstError().orElseThrow();
            log.debug("{} parse failed at offset {}: {}", dialect(), error.offset(), error.message());
            return new ParseResult.Failure(error, ctx.diagnostics());
        }

        log.debug("{} parse produced {} top-level nodes from {} chars",
                  dialect(), document.nodes().size(), input.length());
        return new ParseResult.Success(document, ctx.diagnostics());
    }

    @Override
    public final ParseResultWithDiagnostics parseWithDiagnostics(String input) {
        var ctx = ParsingContext.create(input);
        var document = buildDocument(ctx);
        return ParseResultWithDiagnostics.withDiagnostics(Optional.of(document), ctx.diagnostics(), input);
    }
}
