package org.pragmatica.markup;

import org.pragmatica.markup.error.ErrorReporter;
import org.pragmatica.markup.error.RecoveryStrategy;
import org.pragmatica.markup.fallback.FallbackController;
import org.pragmatica.markup.fallback.ProcessingOutcome;
import org.pragmatica.markup.parser.DocumentParser;
import org.pragmatica.markup.parser.MacroSignatures;
import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.reconstruct.Reconstructor;
import org.pragmatica.markup.transform.PassConfig;
import org.pragmatica.markup.transform.PassId;
import org.pragmatica.markup.transform.PassPipeline;
import org.pragmatica.markup.transform.PipelineResult;
import org.pragmatica.markup.tree.Dialect;
import org.pragmatica.markup.tree.Document;
import org.pragmatica.markup.validate.EntryValidator;

import java.util.List;
import java.util.Set;

/**
 * Entry point: parse, rewrite and reconstruct markup documents.
 *
 * <p>Example usage:
 * <pre>{@code
 * var document = MarkupEngine.parse("\\passthrough{\\lstinline!x!}", Dialect.MARKUP).unwrap();
 * var engine = MarkupEngine.create();
 * engine.runPasses(document);
 * var text = MarkupEngine.reconstruct(document);   // \texttt{x}
 *
 * var outcome = engine.process(source, Dialect.MARKUP);   // never throws
 * }</pre>
 */
public final class MarkupEngine {
    private final ParserConfig parserConfig;
    private final PassPipeline pipeline;
    private final FallbackController fallback;

    private MarkupEngine(ParserConfig parserConfig, PassConfig passConfig) {
        this.parserConfig = parserConfig;
        this.pipeline = PassPipeline.create(passConfig);
        this.fallback = new FallbackController(parserConfig, passConfig);
    }

    public static MarkupEngine create() {
        return new MarkupEngine(ParserConfig.DEFAULT, PassConfig.DEFAULT);
    }

    public static MarkupEngine create(ParserConfig parserConfig, PassConfig passConfig) {
        return new MarkupEngine(parserConfig, passConfig);
    }

    /**
     * Parse text with the default configuration.
     */
    public static ParseResult parse(String text, Dialect dialect) {
        return DocumentParser.forDialect(dialect).parse(text);
    }

    public static String reconstruct(Document document) {
        return Reconstructor.reconstruct(document);
    }

    public DocumentParser parser(Dialect dialect) {
        return DocumentParser.forDialect(dialect, parserConfig);
    }

    public ParseResult parseDocument(String text, Dialect dialect) {
        return parser(dialect).parse(text);
    }

    /**
     * Run the default passes that apply to the document's dialect, rewriting it in place.
     */
    public PipelineResult runPasses(Document document) {
        return pipeline.run(document);
    }

    public PipelineResult runPasses(Document document, List<PassId> order) {
        return pipeline.run(document, order);
    }

    /**
     * Parse, rewrite and reconstruct, degrading to textual cleanup when parsing fails.
     */
    public ProcessingOutcome process(String text, Dialect dialect) {
        return fallback.process(text, dialect);
    }

    public ProcessingOutcome process(String text, Dialect dialect, List<PassId> passes) {
        return fallback.process(text, dialect, passes);
    }

    /**
     * Collect every diagnostic for the text into a reporter: recovered syntax problems and,
     * for bibliographic records, missing or duplicate fields.
     */
    public ErrorReporter inspect(String text, Dialect dialect, String filePath) {
        var reporter = new ErrorReporter(text, filePath);
        var parsed = parser(dialect).parseWithDiagnostics(text);
        parsed.diagnostics().forEach(reporter::report);
        if (dialect == Dialect.BIB_ENTRY) {
            parsed.document()
                  .map(EntryValidator::validate)
                  .ifPresent(issues -> issues.forEach(reporter::report));
        }
        return reporter;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RecoveryStrategy recoveryStrategy = ParserConfig.DEFAULT.recoveryStrategy();
        private MacroSignatures macroSignatures = ParserConfig.DEFAULT.macroSignatures();
        private Set<String> academicDomains = PassConfig.DEFAULT.academicDomains();
        private boolean collapseBlankLines = PassConfig.DEFAULT.collapseBlankLines();

        private Builder() {}

        public Builder recovery(RecoveryStrategy strategy) {
            this.recoveryStrategy = strategy;
            return this;
        }

        public Builder macroSignatures(MacroSignatures signatures) {
            this.macroSignatures = signatures;
            return this;
        }

        public Builder academicDomains(Set<String> domains) {
            this.academicDomains = domains;
            return this;
        }

        public Builder collapseBlankLines(boolean collapse) {
            this.collapseBlankLines = collapse;
            return this;
        }

        public MarkupEngine build() {
            var parserConfig = ParserConfig.DEFAULT.withRecovery(recoveryStrategy)
                                                   .withMacroSignatures(macroSignatures);
            var passConfig = PassConfig.DEFAULT.withAcademicDomains(academicDomains)
                                               .withCollapseBlankLines(collapseBlankLines);
            return new MarkupEngine(parserConfig, passConfig);
        }
    }
}
