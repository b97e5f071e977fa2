package org.pragmatica.markup.parser;

import org.pragmatica.markup.error.Diagnostic;
import org.pragmatica.markup.error.ParseError;
import org.pragmatica.markup.tree.LineIndex;
import org.pragmatica.markup.tree.SourceLocation;
import org.pragmatica.markup.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mutable cursor and error collector shared by the hand-written dialect parsers.
 */
public final class ParsingContext {

    private final String input;
    private final LineIndex lineIndex;
    private final List<ParseError> errors;
    private final List<Diagnostic> diagnostics;

    private int pos;

    private ParsingContext(String input) {
        this.input = input;
        this.lineIndex = LineIndex.of(input);
        this.errors = new ArrayList<>();
        this.diagnostics = new ArrayList<>();
        this.pos = 0;
    }

    public static ParsingContext create(String input) {
        return new ParsingContext(input);
    }

    // === Position Management ===

    public String input() {
        return input;
    }

    public LineIndex lineIndex() {
        return lineIndex;
    }

    public int pos() {
        return pos;
    }

    public void setPos(int pos) {
        this.pos = pos;
    }

    public int length() {
        return input.length();
    }

    public SourceLocation location() {
        return lineIndex.location(pos);
    }

    public SourceLocation location(int offset) {
        return lineIndex.location(offset);
    }

    public SourceSpan span(int start, int end) {
        return lineIndex.span(start, end);
    }

    public SourceSpan spanFrom(int start) {
        return lineIndex.span(start, pos);
    }

    public boolean isAtEnd() {
        return pos >= input.length();
    }

    // === Character Access ===

    public char peek() {
        return input.charAt(pos);
    }

    /**
     * Character at {@code pos + offset}, or {@code '\0'} past the end.
     */
    public char peek(int offset) {
        int at = pos + offset;
        return at < input.length() ? input.charAt(at) : '\0';
    }

    public boolean at(char expected) {
        return !isAtEnd() && input.charAt(pos) == expected;
    }

    public boolean startsWith(String prefix) {
        return input.startsWith(prefix, pos);
    }

    public char advance() {
        return input.charAt(pos++);
    }

    public void advance(int count) {
        pos = Math.min(input.length(), pos + count);
    }

    public String substring(int start, int end) {
        return input.substring(start, end);
    }

    public int indexOf(String needle, int from) {
        return input.indexOf(needle, from);
    }

    // === Error Collection ===

    /**
     * Record a syntax error and its diagnostic. Parsing continues with a best-effort tree.
     */
    public void addError(ParseError error) {
        errors.add(error);
        diagnostics.add(Diagnostic.fromParseError(error));
    }

    /**
     * Record a syntax error whose diagnostic also points at a related construct, such as the
     * opener an unexpected closer was checked against.
     */
    public void addError(ParseError error, SourceSpan related, String relatedLabel) {
        errors.add(error);
        diagnostics.add(Diagnostic.fromParseError(error).withSecondaryLabel(related, relatedLabel));
    }

    /**
     * Record a non-fatal observation.
     */
    public void addWarning(String message, int start, int end) {
        diagnostics.add(Diagnostic.warning(message, span(start, end)));
    }

    public void addWarning(String message, int start, int end, String help) {
        diagnostics.add(Diagnostic.warning(message, span(start, end)).withHelp(help));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public Optional<ParseError> firstError() {
        return errors.isEmpty() ? Optional.empty() : Optional.of(errors.get(0));
    }

    public List<ParseError> errors() {
        return List.copyOf(errors);
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }
}
