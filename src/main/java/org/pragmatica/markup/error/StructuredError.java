package org.pragmatica.markup.error;

import org.pragmatica.markup.error.Diagnostic.Severity;
import org.pragmatica.markup.tree.NodeKind;
import org.pragmatica.markup.tree.SourceSpan;

import java.util.Optional;

/**
 * A reported problem with its precise position and the surrounding source lines.
 *
 * @param message    Primary message
 * @param errorType  Category such as {@code ValidationError} or {@code ParsingError}
 * @param location   Span the problem refers to
 * @param filePath   File the source came from, empty when unknown
 * @param severity   Severity level
 * @param context    Source lines around the problem with a {@code >} marker and {@code ^} pointer
 * @param nodeKind   Kind of the offending node, null for position-only reports
 * @param suggestion Optional hint, empty when there is none
 */
public record StructuredError(
    String message,
    String errorType,
    SourceSpan location,
    String filePath,
    Severity severity,
    String context,
    NodeKind nodeKind,
    String suggestion
) {
    public Optional<NodeKind> kind() {
        return Optional.ofNullable(nodeKind);
    }

    public int line() {
        return location.start().line();
    }

    public int column() {
        return location.start().column();
    }
}
