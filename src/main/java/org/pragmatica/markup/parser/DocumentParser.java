package org.pragmatica.markup.parser;

import org.pragmatica.markup.parser.bib.BibEntryParser;
import org.pragmatica.markup.parser.block.BlockMarkupParser;
import org.pragmatica.markup.parser.markup.MarkupParser;
import org.pragmatica.markup.tree.Dialect;

import java.util.List;

/**
 * Parser interface - turns raw text of one dialect into a positioned document tree.
 *
 * <p>Implementations are pure functions of their input: no I/O, no state kept between calls.
 */
public interface DocumentParser {

    static DocumentParser forDialect(Dialect dialect, ParserConfig config) {
        return switch (dialect) {
            case MARKUP -> new MarkupParser(config);
            case BLOCK_MARKUP -> new BlockMarkupParser(config);
            case BIB_ENTRY -> new BibEntryParser(config);
        };
    }

    static DocumentParser forDialect(Dialect dialect) {
        return forDialect(dialect, ParserConfig.DEFAULT);
    }

    Dialect dialect();

    /**
     * Parse input. Syntax errors are returned as {@link ParseResult.Failure}, unless the parser
     * is configured to keep partial trees.
     */
    ParseResult parse(String input);

    /**
     * Parse input with error recovery and return the partial tree along with diagnostics.
     */
    ParseResultWithDiagnostics parseWithDiagnostics(String input);

    /**
     * Check input for dialect-specific problems and return human-readable messages.
     */
    List<String> validate(String input);
}
