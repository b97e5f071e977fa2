package org.pragmatica.markup.parser;

import org.pragmatica.markup.error.RecoveryStrategy;

import java.util.Set;

/**
 * Parser configuration options.
 *
 * @param recoveryStrategy      what {@code parse} does with syntax errors
 * @param macroSignatures       argument signatures of known macros
 * @param citationMacros        macros that produce citation nodes
 * @param verbatimMacros        inline verbatim shorthands ({@code \lstinline!x!})
 * @param verbatimEnvironments  environments whose body is not parsed
 */
public record ParserConfig(
    RecoveryStrategy recoveryStrategy,
    MacroSignatures macroSignatures,
    Set<String> citationMacros,
    Set<String> verbatimMacros,
    Set<String> verbatimEnvironments
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        RecoveryStrategy.FAIL_FAST,
        MacroSignatures.DEFAULT,
        Set.of("cite", "citep", "citet", "textcite", "parencite", "autocite", "citeauthor", "citeyear", "nocite"),
        Set.of("lstinline", "verb"),
        Set.of("verbatim", "lstlisting", "comment", "minted")
    );

    public ParserConfig {
        citationMacros = Set.copyOf(citationMacros);
        verbatimMacros = Set.copyOf(verbatimMacros);
        verbatimEnvironments = Set.copyOf(verbatimEnvironments);
    }

    public ParserConfig withRecovery(RecoveryStrategy strategy) {
        return new ParserConfig(strategy, macroSignatures, citationMacros, verbatimMacros, verbatimEnvironments);
    }

    public ParserConfig withMacroSignatures(MacroSignatures signatures) {
        return new ParserConfig(recoveryStrategy, signatures, citationMacros, verbatimMacros, verbatimEnvironments);
    }
}
