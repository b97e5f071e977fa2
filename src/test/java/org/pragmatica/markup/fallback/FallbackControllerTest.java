package org.pragmatica.markup.fallback;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.error.RecoveryStrategy;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.transform.PassConfig;
import org.pragmatica.markup.transform.PassId;
import org.pragmatica.markup.tree.Dialect;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class FallbackControllerTest {

    private final FallbackController controller = new FallbackController();

    @Test
    void parseFailure_degradesToTextualCleanup() {
        var input = "\\section{Intro\n\\passthrough{\\lstinline!x!}";

        var outcome = controller.process(input, Dialect.MARKUP);

        assertTrue(outcome.isDegraded());
        assertEquals("\\section{Intro\n\\texttt{x}", outcome.text());
        assertEquals(List.of("Fixed passthrough command"), outcome.fixes());
        assertThat(outcome.message()).startsWith("Parse error at offset 8: Unclosed '{'");
        assertEquals(List.of(outcome.message()), outcome.warnings());
    }

    @Test
    void degradedRecords_areReturnedUnchanged() {
        var input = "@article{a, title = {open\n";

        var outcome = controller.process(input, Dialect.BIB_ENTRY);

        assertEquals(ProcessingOutcome.Status.DEGRADED, outcome.status());
        assertEquals(input, outcome.text());
        assertTrue(outcome.fixes().isEmpty());
        assertFalse(outcome.changed(input));
    }

    @Test
    void partialTree_runsPassesAndKeepsDiagnosticsAsWarnings() {
        var partial = new FallbackController(ParserConfig.DEFAULT.withRecovery(RecoveryStrategy.PARTIAL_TREE),
                                             PassConfig.DEFAULT);

        var outcome = partial.process("\\passthrough{\\lstinline!x!} {open", Dialect.MARKUP);

        assertTrue(outcome.isSuccess());
        assertEquals("\\texttt{x} {open", outcome.text());
        assertThat(outcome.warnings()).isNotEmpty()
                                      .allMatch(warning -> warning.startsWith("input:1:"));
    }

    @Test
    void successMessage_countsFixes() {
        var outcome = controller.process("\\emph{\\emph{a}}", Dialect.MARKUP, List.of(PassId.NESTED_EMPHASIS));

        assertEquals("Applied 1 fixes", outcome.message());
        assertTrue(outcome.warnings().isEmpty());
    }

    @Test
    void blankLineCollapse_skipsBlockMarkupOnSuccess() {
        var input = "# A\n\n\n\n\nText\n";

        var outcome = controller.process(input, Dialect.BLOCK_MARKUP);

        assertEquals(input, outcome.text());
        assertTrue(outcome.fixes().isEmpty());
    }

    @Test
    void failedOutcome_keepsInput() {
        var outcome = ProcessingOutcome.failed("text", "both paths failed");

        assertEquals(ProcessingOutcome.Status.FAILED, outcome.status());
        assertEquals("text", outcome.text());
        assertFalse(outcome.isSuccess());
        assertFalse(outcome.isDegraded());
    }
}
