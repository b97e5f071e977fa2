package org.pragmatica.markup.parser;

import org.pragmatica.markup.error.Diagnostic;
import org.pragmatica.markup.error.ParseError;
import org.pragmatica.markup.tree.Document;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of parsing a whole document - either a tree or the syntax error that prevented it.
 *
 * <p>Parse errors are returned, never thrown, so callers can choose to retry through the
 * fallback controller.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * All diagnostics gathered while parsing, warnings included.
     */
    List<Diagnostic> diagnostics();

    /**
     * The document when parsing succeeded.
     */
    default Optional<Document> documentOption() {
        return this instanceof Success success ? Optional.of(success.document()) : Optional.empty();
    }

    /**
     * The error that stopped parsing, if any.
     */
    default Optional<ParseError> errorOption() {
        return this instanceof Failure failure ? Optional.of(failure.error()) : Optional.empty();
    }

    /**
     * The parsed document.
     *
     * @throws IllegalStateException if parsing failed
     */
    default Document unwrap() {
        if (this instanceof Success success) {
            return success.document();
        }
        throw new IllegalStateException("Parsing failed: " + ((Failure) this).error().message());
    }

    default <R> R fold(Function<ParseError, R> onFailure, Function<Document, R> onSuccess) {
        if (this instanceof Success success) {
            return onSuccess.apply(success.document());
        }
        return onFailure.apply(((Failure) this).error());
    }

    /**
     * Successful parse. {@code diagnostics} may carry warnings, and errors when the parser
     * was configured to keep partial trees.
     */
    record Success(Document document, List<Diagnostic> diagnostics) implements ParseResult {
        public Success {
            diagnostics = List.copyOf(diagnostics);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        public static Success of(Document document) {
            return new Success(document, List.of());
        }
    }

    /**
     * Failed parse with the first unrecoverable error.
     */
    record Failure(ParseError error, List<Diagnostic> diagnostics) implements ParseResult {
        public Failure {
            diagnostics = List.copyOf(diagnostics);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        public static Failure of(ParseError error) {
            return new Failure(error, List.of(Diagnostic.fromParseError(error)));
        }
    }
}
