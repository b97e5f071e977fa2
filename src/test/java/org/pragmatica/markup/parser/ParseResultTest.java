package org.pragmatica.markup.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.error.ParseError;
import org.pragmatica.markup.tree.Dialect;

import static org.junit.jupiter.api.Assertions.*;

class ParseResultTest {

    private final DocumentParser parser = DocumentParser.forDialect(Dialect.MARKUP);

    @Test
    void success_exposesDocumentThroughInterface() {
        ParseResult result = parser.parse("\\emph{x}");

        assertTrue(result.isSuccess());
        assertTrue(result.documentOption().isPresent());
        assertTrue(result.errorOption().isEmpty());
        assertSame(result.unwrap(), result.documentOption().orElseThrow());
        assertEquals("\\emph{x}", result.fold(ParseError::message, document -> document.rawText()));
    }

    @Test
    void failure_exposesErrorThroughInterface() {
        ParseResult result = parser.parse("ab {cd");

        assertTrue(result.isFailure());
        assertTrue(result.documentOption().isEmpty());
        var error = result.errorOption().orElseThrow();
        assertInstanceOf(ParseError.UnclosedGroup.class, error);
        assertEquals(3, result.fold(ParseError::offset, document -> -1));
        assertEquals(1, result.diagnostics().size());
        assertThrows(IllegalStateException.class, result::unwrap);
    }

    @Test
    void recordAccessors_returnPlainValues() {
        var failure = (ParseResult.Failure) parser.parse("a}");
        ParseError error = failure.error();

        assertEquals(1, error.offset());
        var success = (ParseResult.Success) parser.parse("a");
        assertEquals("a", success.document().rawText());
    }
}
