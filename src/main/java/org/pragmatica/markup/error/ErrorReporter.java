package org.pragmatica.markup.error;

import org.pragmatica.markup.error.Diagnostic.Severity;
import org.pragmatica.markup.tree.LineIndex;
import org.pragmatica.markup.tree.Node;
import org.pragmatica.markup.tree.NodeKind;
import org.pragmatica.markup.tree.SourceSpan;
import org.pragmatica.markup.validate.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Collects errors and warnings against one source text and formats them with the
 * surrounding lines.
 *
 * <p>Example output:
 * <pre>
 * ERROR: Unclosed '{' at 3:8, expected '}'
 *   --> paper.tex:3:8
 *
 *           1: \documentclass{article}
 *           2: \begin{document}
 *       >    3: \section{Intro
 *                    ^
 *
 *   Suggestion: add the missing '}'
 * </pre>
 */
public final class ErrorReporter {
    private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);

    private static final int ERROR_CONTEXT_LINES = 2;
    private static final int WARNING_CONTEXT_LINES = 1;

    private final String sourceText;
    private final String filePath;
    private final LineIndex lineIndex;
    private final List<StructuredError> errors = new ArrayList<>();
    private final List<StructuredError> warnings = new ArrayList<>();

    public ErrorReporter(String sourceText, String filePath) {
        this.sourceText = sourceText == null ? "" : sourceText;
        this.filePath = filePath == null ? "" : filePath;
        this.lineIndex = LineIndex.of(this.sourceText);
    }

    public ErrorReporter(String sourceText) {
        this(sourceText, "");
    }

    // === Reporting ===

    public StructuredError reportError(Node node, String message, String errorType, String suggestion) {
        var error = new StructuredError(message, errorType, node.span(), filePath, Severity.ERROR,
                                        context(node.span(), ERROR_CONTEXT_LINES), node.kind(), suggestion);
        errors.add(error);
        return error;
    }

    public StructuredError reportError(Node node, String message) {
        return reportError(node, message, "ValidationError", "");
    }

    public StructuredError reportWarning(Node node, String message, String suggestion) {
        var warning = new StructuredError(message, "Warning", node.span(), filePath, Severity.WARNING,
                                          context(node.span(), WARNING_CONTEXT_LINES), node.kind(), suggestion);
        warnings.add(warning);
        return warning;
    }

    public StructuredError reportWarning(Node node, String message) {
        return reportWarning(node, message, "");
    }

    /**
     * Report an error where no node is available, for example when parsing stopped.
     */
    public StructuredError reportPositionError(int startOffset, int endOffset, String message,
                                               String errorType, String suggestion) {
        var span = lineIndex.span(startOffset, Math.max(startOffset, endOffset));
        var error = new StructuredError(message, errorType, span, filePath, Severity.ERROR,
                                        context(span, ERROR_CONTEXT_LINES), null, suggestion);
        errors.add(error);
        return error;
    }

    public StructuredError report(ParseError parseError) {
        return reportPositionError(parseError.offset(), parseError.offset(), parseError.message(),
                                   "ParsingError", parseError.suggestion());
    }

    public StructuredError report(Diagnostic diagnostic) {
        var span = diagnostic.span();
        var type = diagnostic.code() == null ? "Diagnostic" : diagnostic.code();
        var reported = new StructuredError(diagnostic.message(), type, span, filePath, diagnostic.severity(),
                                           context(span, diagnostic.isError() ? ERROR_CONTEXT_LINES : WARNING_CONTEXT_LINES),
                                           null, diagnostic.help());
        if (diagnostic.isError()) {
            errors.add(reported);
        } else {
            warnings.add(reported);
        }
        return reported;
    }

    public StructuredError report(ValidationIssue issue) {
        if (issue.node() == null) {
            var span = lineIndex.span(0, 0);
            var reported = new StructuredError(issue.message(), "ValidationError", span, filePath, issue.severity(),
                                               "", null, "");
            (issue.isError() ? errors : warnings).add(reported);
            return reported;
        }
        return issue.isError()
               ? reportError(issue.node(), issue.message())
               : reportWarning(issue.node(), issue.message());
    }

    // === Context ===

    /**
     * Source lines around the span. The line holding the span start is marked with {@code >}
     * when it has content, followed by a {@code ^} under the start column.
     */
    private String context(SourceSpan span, int contextLines) {
        if (sourceText.isEmpty()) {
            return "";
        }
        var lines = sourceText.split("\n", -1);
        int errorLine = span.start().line() - 1;
        int column = span.start().column();
        int first = Math.max(0, errorLine - contextLines);
        int last = Math.min(lines.length, errorLine + contextLines + 1);

        var out = new ArrayList<String>();
        for (int i = first; i < last; i++) {
            var content = lines[i];
            if (i == errorLine) {
                var marker = content.isBlank() ? "" : ">";
                out.add(String.format("%2s %4d: %s", marker, i + 1, content));
                if (column > 0) {
                    out.add(" ".repeat(9 + column) + "^");
                }
            } else {
                out.add(String.format("  %4d: %s", i + 1, content));
            }
        }
        return String.join("\n", out);
    }

    // === Formatting ===

    public String formatError(StructuredError error) {
        var lines = new ArrayList<String>();
        lines.add(error.severity().display().toUpperCase(Locale.ROOT) + ": " + error.message());

        var location = error.filePath().isEmpty() ? "" : error.filePath() + ":";
        lines.add("  --> " + location + error.line() + ":" + error.column());

        error.kind().map(NodeKind::display).ifPresent(kind -> lines.add("  Node type: " + kind));

        if (!error.context().isEmpty()) {
            lines.add("");
            for (var line : error.context().split("\n", -1)) {
                lines.add("     " + line);
            }
        }
        if (!error.suggestion().isEmpty()) {
            lines.add("");
            lines.add("  Suggestion: " + error.suggestion());
        }
        return String.join("\n", lines);
    }

    public String formatAll() {
        var output = new ArrayList<String>();
        appendSection(output, "ERRORS:", errors);
        appendSection(output, "WARNINGS:", warnings);
        return String.join("\n", output);
    }

    private void appendSection(List<String> output, String title, List<StructuredError> reported) {
        if (reported.isEmpty()) {
            return;
        }
        output.add(title);
        output.add("=".repeat(50));
        for (var error : reported) {
            output.add(formatError(error));
            output.add("");
        }
    }

    public void logAll() {
        errors.forEach(error -> log.error(formatError(error)));
        warnings.forEach(warning -> log.warn(formatError(warning)));
    }

    // === State ===

    public List<StructuredError> errors() {
        return List.copyOf(errors);
    }

    public List<StructuredError> warnings() {
        return List.copyOf(warnings);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public void clear() {
        errors.clear();
        warnings.clear();
    }
}
