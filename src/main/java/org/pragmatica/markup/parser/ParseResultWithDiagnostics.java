package org.pragmatica.markup.parser;

import org.pragmatica.markup.error.Diagnostic;
import org.pragmatica.markup.error.Diagnostic.Severity;
import org.pragmatica.markup.tree.Document;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Result of parsing with error recovery - the best-effort partial tree and every diagnostic.
 *
 * <p>The partial tree always covers the whole input: unparseable regions become error nodes,
 * unclosed groups end at the end of input. Reconstructing it without passes therefore still
 * returns the input unchanged.
 *
 * @param document    The parsed tree (may contain error nodes)
 * @param diagnostics Accumulated diagnostic messages (empty on full success)
 * @param source      The original source text (for formatting diagnostics)
 */
public record ParseResultWithDiagnostics(
    Optional<Document> document,
    List<Diagnostic> diagnostics,
    String source
) {
    public static ParseResultWithDiagnostics success(Document document, String source) {
        return new ParseResultWithDiagnostics(Optional.of(document), List.of(), source);
    }

    public static ParseResultWithDiagnostics withDiagnostics(Optional<Document> document,
                                                             List<Diagnostic> diagnostics,
                                                             String source) {
        return new ParseResultWithDiagnostics(document, List.copyOf(diagnostics), source);
    }

    /**
     * Check if parsing succeeded without any errors.
     */
    public boolean isSuccess() {
        return document.isPresent() && errorCount() == 0;
    }

    public boolean hasErrors() {
        return errorCount() > 0;
    }

    public boolean hasDocument() {
        return document.isPresent();
    }

    /**
     * Format all diagnostics in Rust style, in source order.
     *
     * @param filename Optional filename for display
     * @return Formatted diagnostics string, empty when there is nothing to report
     */
    public String formatDiagnostics(String filename) {
        return diagnostics.stream()
                          .sorted(Comparator.comparingInt(diagnostic -> diagnostic.span().startOffset()))
                          .map(diagnostic -> diagnostic.format(source, filename) + "\n")
                          .collect(Collectors.joining());
    }

    /**
     * Format all diagnostics with default filename "input".
     */
    public String formatDiagnostics() {
        return formatDiagnostics("input");
    }

    public int errorCount() {
        return count(Severity.ERROR);
    }

    public int warningCount() {
        return count(Severity.WARNING);
    }

    private int count(Severity severity) {
        return (int) diagnostics.stream()
                                .filter(diagnostic -> diagnostic.severity() == severity)
                                .count();
    }
}
