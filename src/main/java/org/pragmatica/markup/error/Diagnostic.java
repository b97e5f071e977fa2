package org.pragmatica.markup.error;

import org.pragmatica.markup.tree.LineIndex;
import org.pragmatica.markup.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rich diagnostic message in Rust style.
 *
 * <p>Example output:
 * <pre>
 * error[E001]: Unclosed '{' at 3:8, expected '}'
 *   --> paper.tex:3:8
 *    |
 *  3 | \section{Intro
 *    |         ^ opened here
 *    |
 *    = help: add the missing '}'
 * </pre>
 *
 * <p>Lines are shown without their line terminator, so CRLF input renders like LF input.
 * Columns are 0-based, as everywhere else in the tree.
 *
 * @param severity    Severity level
 * @param code        Optional error code (e.g., "E001"), may be null
 * @param message     Primary message
 * @param span        Source span where the problem occurred
 * @param labels      Additional labeled spans for context
 * @param notes       Additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String code,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    private static final String HELP = "help: ";

    /**
     * Severity levels.
     */
    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        INFO("info");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labeled span providing additional context.
     *
     * @param span    Source span for this label
     * @param message Label message
     * @param primary Whether this is the primary label (shown with ^^^)
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }

        char marker() {
            return primary ? '^' : '-';
        }
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, null, message, span, List.of(), List.of());
    }

    public static Diagnostic error(String code, String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, code, message, span, List.of(), List.of());
    }

    public static Diagnostic warning(String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, null, message, span, List.of(), List.of());
    }

    /**
     * Diagnostic for a parse error, pointing at the offending offset and carrying the
     * error's label and suggestion when it has them.
     */
    public static Diagnostic fromParseError(ParseError error) {
        var diagnostic = error(error.code(), error.message(), SourceSpan.at(error.location()));
        if (!error.label().isEmpty()) {
            diagnostic = diagnostic.withLabel(error.label());
        }
        return error.suggestion().isEmpty() ? diagnostic : diagnostic.withHelp(error.suggestion());
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public Diagnostic withLabel(String message) {
        return withAddedLabel(Label.primary(span, message));
    }

    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String message) {
        return withAddedLabel(Label.secondary(labelSpan, message));
    }

    private Diagnostic withAddedLabel(Label label) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(label);
        return new Diagnostic(severity, code, message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, code, message, span, labels, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote(HELP + help);
    }

    /**
     * The first help note without its prefix, empty when there is none.
     */
    public String help() {
        return notes.stream()
                    .filter(note -> note.startsWith(HELP))
                    .map(note -> note.substring(HELP.length()))
                    .findFirst()
                    .orElse("");
    }

    /**
     * Format this diagnostic in Rust style.
     *
     * @param source   The source text
     * @param filename Optional filename for display, may be null
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var lines = LineIndex.of(source);
        var shown = shownLabels();

        int firstLine = span.start().line();
        int lastLine = span.end().line();
        for (var label : shown) {
            firstLine = Math.min(firstLine, label.span().start().line());
            lastLine = Math.max(lastLine, label.span().end().line());
        }
        lastLine = Math.min(lastLine, lines.lineCount());

        var gutter = " ".repeat(String.valueOf(lastLine).length() + 1);
        var sb = new StringBuilder();

        sb.append(severity.display());
        if (code != null) {
            sb.append('[').append(code).append(']');
        }
        sb.append(": ").append(message).append('\n');
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(':');
        }
        sb.append(span.start()).append('\n');
        sb.append(gutter).append("|\n");

        for (int line = firstLine; line <= lastLine; line++) {
            var text = stripCarriageReturn(lines.line(line));
            sb.append(String.format("%" + gutter.length() + "d | ", line)).append(text).append('\n');
            for (var label : labelsOn(shown, line)) {
                sb.append(gutter).append("| ").append(underline(label, line, text.length())).append('\n');
            }
        }

        sb.append(gutter).append("|\n");
        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append('\n');
        }
        return sb.toString();
    }

    /**
     * Explicit labels, or an unlabeled primary one over the whole span when none were given.
     */
    private List<Label> shownLabels() {
        return labels.isEmpty() ? List.of(Label.primary(span, "")) : labels;
    }

    private static List<Label> labelsOn(List<Label> labels, int line) {
        return labels.stream()
                     .filter(label -> label.span().start().line() <= line && line <= label.span().end().line())
                     .sorted(Comparator.comparingInt(label -> label.span().start().line() == line
                                                              ? label.span().start().column()
                                                              : 0))
                     .toList();
    }

    /**
     * One underline row per label; a span running past this line is underlined to its end.
     */
    private static String underline(Label label, int line, int lineLength) {
        int from = label.span().start().line() == line ? label.span().start().column() : 0;
        int to = label.span().end().line() == line ? label.span().end().column() : lineLength;
        var row = new StringBuilder(" ".repeat(from));
        row.append(String.valueOf(label.marker()).repeat(Math.max(1, to - from)));
        if (!label.message().isEmpty()) {
            row.append(' ').append(label.message());
        }
        return row.toString();
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /**
     * Single-line format for log output.
     */
    public String formatSimple() {
        return String.format("%s:%s: %s: %s", "input", span.start(), severity.display(), message);
    }
}
