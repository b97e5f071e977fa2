package org.pragmatica.markup.reconstruct;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.markup.error.RecoveryStrategy;
import org.pragmatica.markup.parser.DocumentParser;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.transform.PassPipeline;
import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.Dialect;
import org.pragmatica.markup.tree.Document;
import org.pragmatica.markup.tree.NodeKind;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReconstructorTest {

    private static final ParserConfig PARTIAL = ParserConfig.DEFAULT.withRecovery(RecoveryStrategy.PARTIAL_TREE);

    private static final String PAPER = """
        \\documentclass[11pt]{article}
        \\usepackage{amsmath}
        % preamble comment
        \\begin{document}
        \\section*{Introduction}\\label{sec:intro}
        We cite \\citep[p.~4]{smith2020, doe2019} and show $a^2 + b^2$ inline,
        \\[ E = mc^2 \\]
        \\begin{verbatim}
        raw {unbalanced
        \\end{verbatim}
        \\begin{itemize}
          \\item first \\emph{one}
          \\item[b)] second
        \\end{itemize}
        \\end{document}
        """;

    private static final String NOTES = """
        # Title

        Paragraph with *emphasis*, **strong**, `code` and a [link](https://example.com "Example").
        See [@smith2020; @doe2019] and ![figure](img/fig.png).

        > quoted
        > lines

        - one
        - two

        1. first
        2. second

        ```java
        int x = 1;
        ```

            indented code

        | a | b |
        |---|:-:|
        | 1 | 2 |

        ---

        <div>html</div>

        $$
        x = y
        $$
        """;

    private static final String REFERENCES = """
        @string{acm = "ACM Press"}
        @comment{ignored}
        @preamble{"\\newcommand{\\x}{y}"}

        @article{smith2020,
          author = {Smith, John},
          title = "A {Study}",
          journal = acm,
          year = 2020,
          month = jan
        }

        Loose text between records.
        @book(doe2019, title = {Book}, publisher = "Pub", year = {2019})
        """;

    // === Round trip ===

    @Test
    void untouchedMarkup_isReproducedExactly() {
        assertEquals(PAPER, Reconstructor.reconstruct(parse(Dialect.MARKUP, PAPER)));
    }

    @Test
    void untouchedBlockMarkup_isReproducedExactly() {
        assertEquals(NOTES, Reconstructor.reconstruct(parse(Dialect.BLOCK_MARKUP, NOTES)));
    }

    @Test
    void untouchedRecords_areReproducedExactly() {
        assertEquals(REFERENCES, Reconstructor.reconstruct(parse(Dialect.BIB_ENTRY, REFERENCES)));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "\\section{Intro",
        "text } stray",
        "$unterminated math",
        "\\begin{figure}\\caption{x}",
        "\\begin{a}\\end{b}",
        "\\lstinline!never closed\n",
        "",
        "\r\n\\emph{crlf}\r\n"
    })
    void partialTrees_areReproducedExactly(String input) {
        var document = DocumentParser.forDialect(Dialect.MARKUP, PARTIAL).parse(input).unwrap();

        assertEquals(input, Reconstructor.reconstruct(document));
    }

    @Test
    void unterminatedRecord_isReproducedExactly() {
        var input = "@article{broken,\n  title = {Open\n@book{ok, title = {B}}\n";
        var document = DocumentParser.forDialect(Dialect.BIB_ENTRY, PARTIAL).parse(input).unwrap();

        assertEquals(input, Reconstructor.reconstruct(document));
    }

    // === Ranges ===

    @Test
    void ranges_coverInputInOrderWithoutOverlap() {
        var document = parse(Dialect.MARKUP, PAPER);
        PassPipeline.create().run(document);

        var reconstruction = Reconstructor.reconstructTraced(document);

        assertRangesCover(reconstruction.ranges(), PAPER.length());
        assertTrue(reconstruction.isConsistent());
    }

    @Test
    void rewrittenMacro_consumesItsAbsorbedArguments() {
        var input = "before \\caption{} after";
        var config = ParserConfig.DEFAULT.withMacroSignatures(ParserConfig.DEFAULT.macroSignatures().without("caption"));
        var document = DocumentParser.forDialect(Dialect.MARKUP, config).parse(input).unwrap();
        PassPipeline.create().run(document);

        var reconstruction = Reconstructor.reconstructTraced(document);

        assertEquals("before % Empty caption removed\n after", reconstruction.text());
        assertRangesCover(reconstruction.ranges(), input.length());
        assertTrue(reconstruction.ranges().stream().anyMatch(range -> range.origin() == EmittedRange.Origin.SYNTHESIZED));
    }

    @Test
    void touchedContainer_keepsItsFrame() {
        var input = "\\begin{quote}\n  \\passthrough{\\lstinline|a|}  \n\\end{quote}";
        var document = parse(Dialect.MARKUP, input);
        PassPipeline.create().run(document);

        var reconstruction = Reconstructor.reconstructTraced(document);

        assertEquals("\\begin{quote}\n  \\texttt{a}  \n\\end{quote}", reconstruction.text());
        assertEquals(EmittedRange.Origin.REBUILT, reconstruction.ranges().get(0).origin());
    }

    // === Synthesis ===

    @Test
    void modifiedBlockNodes_areSynthesizedFromAttributes() {
        var document = parse(Dialect.BLOCK_MARKUP, "# Old\n\n[text](https://a.b)\n");
        var heading = document.nodes().get(0);
        heading.replaceChildren(List.of());
        heading.setContent("New");
        var link = document.nodes().get(1).children().get(0);
        link.put(Attribute.HREF, "https://c.d");
        link.put(Attribute.TITLE, "T");

        assertEquals("# New\n\n[text](https://c.d \"T\")\n", Reconstructor.reconstruct(document));
    }

    @Test
    void modifiedEntry_isSynthesizedFromFields() {
        var document = parse(Dialect.BIB_ENTRY, "@misc{k, title = {T}}\n");
        var entry = document.nodes().get(0);
        assertEquals(NodeKind.ENTRY, entry.kind());
        entry.put(Attribute.ENTRY_KEY, "renamed");

        assertEquals("@misc{renamed,\n  title = {T}\n}\n", Reconstructor.reconstruct(document));
    }

    @Test
    void modifiedMath_keepsItsDelimiters() {
        var document = parse(Dialect.MARKUP, "a \\(x\\) b");
        var math = document.nodes().get(1);
        assertEquals(NodeKind.MATH, math.kind());
        math.setContent("y");

        var reconstruction = Reconstructor.reconstructTraced(document);

        assertEquals("a \\(y\\) b", reconstruction.text());
        assertTrue(reconstruction.isConsistent());
    }

    @Test
    void passes_areIdempotentAfterReconstruction() {
        var input = "\\passthrough{\\lstinline!x!} \\emph{a \\emph{b}} \\href{https://doi.org/1}{Roe 2011}\n"
                    + "\\begin{figure}\\caption{ }\\end{figure}\n";
        var first = parse(Dialect.MARKUP, input);
        assertFalse(PassPipeline.create().run(first).fixes().isEmpty());
        var once = Reconstructor.reconstruct(first);

        var second = parse(Dialect.MARKUP, once);
        var rerun = PassPipeline.create().run(second);

        assertTrue(rerun.fixes().isEmpty(), () -> "unexpected fixes: " + rerun.fixes());
        assertEquals(once, Reconstructor.reconstruct(second));
    }

    private static Document parse(Dialect dialect, String input) {
        return DocumentParser.forDialect(dialect).parse(input).unwrap();
    }

    private static void assertRangesCover(List<EmittedRange> ranges, int length) {
        int cursor = 0;
        for (var range : ranges) {
            assertEquals(cursor, range.start(), "gap or overlap before " + range);
            assertTrue(range.end() >= range.start(), "negative range " + range);
            cursor = range.end();
        }
        assertEquals(length, cursor);
    }
}
