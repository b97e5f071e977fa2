package org.pragmatica.markup;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.error.ParseError;
import org.pragmatica.markup.error.RecoveryStrategy;
import org.pragmatica.markup.fallback.ProcessingOutcome;
import org.pragmatica.markup.transform.PassId;
import org.pragmatica.markup.tree.Dialect;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behavior: parse, rewrite, reconstruct.
 */
class MarkupEngineTest {

    private final MarkupEngine engine = MarkupEngine.create();

    @Test
    void shorthandInsidePassthrough_becomesTypewriter() {
        var document = MarkupEngine.parse("\\passthrough{\\lstinline!some_code!}", Dialect.MARKUP).unwrap();

        var result = engine.runPasses(document);

        assertEquals("\\texttt{some_code}", MarkupEngine.reconstruct(document));
        assertEquals(List.of("Fixed passthrough command"), result.descriptions());
    }

    @Test
    void nestedEmphasis_isFlattened() {
        var document = MarkupEngine.parse("\\emph{\\emph{inner} outer}", Dialect.MARKUP).unwrap();

        engine.runPasses(document);
        var text = MarkupEngine.reconstruct(document);

        assertEquals("\\emph{{inner} outer}", text);
        assertEquals(1, text.split("\\\\emph\\{", -1).length - 1);
    }

    @Test
    void emptyCaption_isReplacedByComment() {
        var document = MarkupEngine.parse("\\begin{figure}\\caption{}\\end{figure}", Dialect.MARKUP).unwrap();

        engine.runPasses(document);

        assertEquals("\\begin{figure}% Empty caption removed\n\\end{figure}", MarkupEngine.reconstruct(document));
    }

    @Test
    void academicLink_becomesCitation() {
        var document = MarkupEngine.parse("\\href{https://doi.org/10.1/x}{Smith 2020}", Dialect.MARKUP).unwrap();

        var result = engine.runPasses(document);

        assertEquals("\\citep{Smith2020}", MarkupEngine.reconstruct(document));
        assertEquals(List.of("Converted href to citation: Smith2020"), result.descriptions());
    }

    @Test
    void unterminatedGroup_failsParseAndDegrades() {
        var input = "\\section{Intro\nSome text";

        var parsed = MarkupEngine.parse(input, Dialect.MARKUP);
        assertTrue(parsed.isFailure());
        var error = parsed.errorOption().orElseThrow();
        assertInstanceOf(ParseError.UnclosedGroup.class, error);
        assertEquals(8, error.offset());

        var outcome = engine.process(input, Dialect.MARKUP);
        assertEquals(ProcessingOutcome.Status.DEGRADED, outcome.status());
        assertFalse(outcome.text().isEmpty());
        assertThat(outcome.message()).contains("offset 8");
    }

    @Test
    void process_withoutFixes_returnsInputUnchanged() {
        var input = "\\section{Intro}\nPlain $x^2$ text % note\n";

        var outcome = engine.process(input, Dialect.MARKUP);

        assertTrue(outcome.isSuccess());
        assertEquals(input, outcome.text());
        assertTrue(outcome.fixes().isEmpty());
        assertFalse(outcome.changed(input));
    }

    @Test
    void process_collectsFixesInPassOrder() {
        var input = "See \\href{https://arxiv.org/abs/1}{Doe 2019} and \\passthrough{\\lstinline!x!}.";

        var outcome = engine.process(input, Dialect.MARKUP);

        assertEquals("See \\citep{Doe2019} and \\texttt{x}.", outcome.text());
        assertEquals(List.of("Fixed passthrough command", "Converted href to citation: Doe2019"), outcome.fixes());
    }

    @Test
    void process_withSelectedPasses_runsOnlyThose() {
        var input = "\\emph{\\emph{a}} \\passthrough{\\lstinline!x!}";

        var outcome = engine.process(input, Dialect.MARKUP, List.of(PassId.NESTED_EMPHASIS));

        assertEquals("\\emph{{a}} \\passthrough{\\lstinline!x!}", outcome.text());
    }

    @Test
    void blockMarkupHeadings_areCleaned() {
        var outcome = engine.process("## **1. Introduction**\n\nBody text.\n", Dialect.BLOCK_MARKUP);

        assertTrue(outcome.isSuccess());
        assertEquals("## Introduction\n\nBody text.\n", outcome.text());
        assertEquals(List.of("Cleaned heading: Introduction"), outcome.fixes());
    }

    @Test
    void builder_configuresRecoveryAndDomains() {
        var engine = MarkupEngine.builder()
                                 .recovery(RecoveryStrategy.PARTIAL_TREE)
                                 .academicDomains(Set.of("example.edu"))
                                 .collapseBlankLines(false)
                                 .build();

        var partial = engine.parseDocument("\\emph{open", Dialect.MARKUP);
        assertTrue(partial.isSuccess());
        assertFalse(partial.diagnostics().isEmpty());

        var outcome = engine.process("\\href{https://lab.example.edu/p}{Lee 2001}\n\n\n\n\nend", Dialect.MARKUP);
        assertEquals("\\citep{Lee2001}\n\n\n\n\nend", outcome.text());
    }

    @Test
    void defaultEngine_collapsesBlankLineRuns() {
        var outcome = engine.process("a\n\n\n\n\nb", Dialect.MARKUP);

        assertEquals("a\n\n\nb", outcome.text());
        assertEquals(List.of("Cleaned excessive line breaks"), outcome.fixes());
    }
}
