package org.pragmatica.markup.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.tree.LineIndex;
import org.pragmatica.markup.tree.SourceLocation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    @Test
    void diagnosticFormatsRustStyle() {
        var source = "\\documentclass{article}\n\\section{Intro\nSome text";
        var span = LineIndex.of(source).span(32, 33);

        var diagnostic = Diagnostic.error("E001", "unclosed group", span)
                                   .withLabel("opened here")
                                   .withHelp("add the missing '}'");

        assertEquals("""
            error[E001]: unclosed group
              --> paper.tex:2:8
              |
             2 | \\section{Intro
              |         ^ opened here
              |
              = help: add the missing '}'
            """, diagnostic.format(source, "paper.tex"));
    }

    @Test
    void withoutLabels_underlinesWholeSpan() {
        var source = "ab \\foo cd";
        var span = LineIndex.of(source).span(3, 7);

        var formatted = Diagnostic.warning("unknown macro", span).format(source, null);

        assertEquals("warning: unknown macro\n  --> 1:3\n  |\n 1 | ab \\foo cd\n  |    ^^^^\n  |\n", formatted);
    }

    @Test
    void eachLabel_getsItsOwnRow() {
        var source = "\\begin{a}x\\end{b}";
        var index = LineIndex.of(source);

        var formatted = Diagnostic.error("E005", "mismatched environment", index.span(10, 17))
                                  .withLabel("closes 'b'")
                                  .withSecondaryLabel(index.span(0, 9), "opened 'a'")
                                  .format(source, null);

        assertThat(formatted).contains("  | --------- opened 'a'\n  |           ^^^^^^^ closes 'b'\n");
        assertThat(formatted.indexOf("opened 'a'")).isLessThan(formatted.indexOf("closes 'b'"));
    }

    @Test
    void crlfSource_rendersWithoutCarriageReturns() {
        var source = "a\r\n{b\r\nc";
        var index = LineIndex.of(source);

        var formatted = Diagnostic.error("E001", "unclosed group", index.span(3, 4)).format(source, null);

        assertThat(formatted).contains(" 2 | {b\n").doesNotContain("\r");
    }

    @Test
    void fromParseError_carriesLabelAndHelp() {
        var error = new ParseError.UnterminatedMath(SourceLocation.at(3, 4, 20), "$");

        var diagnostic = Diagnostic.fromParseError(error);

        assertTrue(diagnostic.isError());
        assertEquals("E003", diagnostic.code());
        assertEquals(20, diagnostic.span().startOffset());
        assertTrue(diagnostic.span().isEmpty());
        assertEquals("opened here", diagnostic.labels().get(0).message());
        assertEquals("close the math span with the matching '$'", diagnostic.help());
        assertEquals("input:3:4: error: Unterminated math span opened with '$' at 3:4", diagnostic.formatSimple());
    }

    @Test
    void parseErrorWithoutSuggestion_hasNoHelp() {
        var diagnostic = Diagnostic.fromParseError(new ParseError.MalformedEntry(SourceLocation.START, "Expected field name"));

        assertEquals("", diagnostic.help());
        assertTrue(diagnostic.labels().isEmpty());
    }

    @Test
    void parseErrorMessages_nameTheConstruct() {
        var at = SourceLocation.at(1, 2, 2);

        assertEquals("Unclosed '[' at 1:2, expected ']'", new ParseError.UnclosedGroup(at, '[').message());
        assertEquals("add the missing ']'", new ParseError.UnclosedGroup(at, '[').suggestion());
        assertEquals("Unexpected \\end{x} at 1:2 with no open environment",
                     new ParseError.MismatchedEnvironment(at, "", "x").message());
        assertEquals("Mismatched \\end{x} at 1:2, expected \\end{y}",
                     new ParseError.MismatchedEnvironment(at, "y", "x").message());
        assertEquals("add \\end{fig}", new ParseError.UnterminatedEnvironment(at, "fig").suggestion());
        assertEquals("E006", new ParseError.UnterminatedVerbatim(at, "verb", '|').code());
    }
}
