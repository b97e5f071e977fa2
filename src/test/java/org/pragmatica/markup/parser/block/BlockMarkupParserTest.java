package org.pragmatica.markup.parser.block;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.Document;
import org.pragmatica.markup.tree.Metadata;
import org.pragmatica.markup.tree.Node;
import org.pragmatica.markup.tree.NodeKind;
import org.pragmatica.markup.tree.TreeInvariants;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class BlockMarkupParserTest {

    private final BlockMarkupParser parser = new BlockMarkupParser();

    // === Blocks ===

    @Test
    void heading_recordsLevelAndContent() {
        var document = parse("### Results ###\n");
        var heading = document.nodes().get(0);

        assertEquals(NodeKind.HEADING, heading.kind());
        assertEquals(3, heading.get(Attribute.LEVEL).orElseThrow());
        assertEquals("Results", heading.content());
        assertEquals(0, heading.start());
        assertEquals(15, heading.end());
    }

    @Test
    void hashWithoutSpace_isParagraph() {
        assertEquals(NodeKind.PARAGRAPH, parse("#hashtag").nodes().get(0).kind());
    }

    @Test
    void paragraph_spansConsecutiveLines() {
        var document = parse("one\ntwo\n\nthree");

        assertEquals(2, document.nodes().size());
        assertEquals("one\ntwo", document.nodes().get(0).content());
        assertEquals("three", document.nodes().get(1).content());
    }

    @Test
    void fencedCode_keepsLanguageAndBody() {
        var document = parse("```python\nprint(1)\n# not a heading\n```\n");
        var code = document.nodes().get(0);

        assertEquals(1, document.nodes().size());
        assertEquals(NodeKind.CODE_BLOCK, code.kind());
        assertEquals("python", code.get(Attribute.LANGUAGE).orElseThrow());
        assertEquals("print(1)\n# not a heading", code.content());
        assertEquals("```", code.get(Attribute.DELIMITER).orElseThrow());
    }

    @Test
    void unterminatedFence_isWarningOnly() {
        var result = parser.parse("```\ncode\nmore");

        assertTrue(result.isSuccess());
        assertEquals(1, result.diagnostics().size());
        assertFalse(result.diagnostics().get(0).isError());
        assertEquals("code\nmore", result.unwrap().nodes().get(0).content());
    }

    @Test
    void unterminatedFence_suggestsClosingLine() {
        var source = "~~~\ncode";
        var warning = parser.parse(source).diagnostics().get(0);

        assertEquals("close the block with a ~~~ line", warning.help());
        assertEquals(List.of("help: close the block with a ~~~ line"), warning.notes());
        assertThat(warning.format(source, null)).contains("= help: close the block with a ~~~ line");
    }

    @Test
    void unterminatedFence_countsAsWarningWithDiagnostics() {
        var result = parser.parseWithDiagnostics("```\ncode");

        assertTrue(result.isSuccess());
        assertEquals(0, result.errorCount());
        assertEquals(1, result.warningCount());
    }

    @Test
    void indentedCode_stripsIndent() {
        var code = parse("    a\n    b\n").nodes().get(0);

        assertEquals(NodeKind.CODE_BLOCK, code.kind());
        assertEquals("a\nb", code.content());
        assertEquals("", code.get(Attribute.DELIMITER).orElseThrow());
    }

    @Test
    void lists_recordOrderAndMarkers() {
        var document = parse("- a\n- b\n\n3. x\n4. y\n");

        var bullets = document.nodes().get(0);
        assertEquals(NodeKind.LIST, bullets.kind());
        assertFalse(bullets.get(Attribute.LIST_ORDERED).orElseThrow());
        assertEquals(List.of("a", "b"), bullets.children().stream().map(Node::content).toList());

        var ordered = document.nodes().get(1);
        assertTrue(ordered.get(Attribute.LIST_ORDERED).orElseThrow());
        assertEquals(3, ordered.get(Attribute.LIST_START).orElseThrow());
        assertEquals("4.", ordered.children().get(1).get(Attribute.MARKER).orElseThrow());
    }

    @Test
    void blockquote_collectsMarkedLines() {
        var quote = parse("> one\n> two\n").nodes().get(0);

        assertEquals(NodeKind.BLOCKQUOTE, quote.kind());
        assertEquals("one\ntwo", quote.content());
    }

    @Test
    void table_splitsRowsAndCells() {
        var table = parse("| a | b |\n|:--|--:|\n| 1 | 2 |\n").nodes().get(0);

        assertEquals(NodeKind.TABLE, table.kind());
        assertEquals(List.of("left", "right"), table.get(Attribute.TABLE_ALIGNMENTS).orElseThrow());
        assertEquals(2, table.children().size());
        var header = table.children().get(0);
        assertTrue(header.get(Attribute.HEADER).orElseThrow());
        assertEquals(List.of("a", "b"), header.children().stream().map(Node::content).toList());
        assertEquals(List.of("1", "2"), table.children().get(1).children().stream().map(Node::content).toList());
    }

    @Test
    void thematicBreakAndHtml_areLeafBlocks() {
        var document = parse("***\n\n<div>\nx\n</div>\n");

        assertEquals(List.of(NodeKind.THEMATIC_BREAK, NodeKind.HTML), kinds(document.nodes()));
        assertEquals("<div>\nx\n</div>", document.nodes().get(1).content());
    }

    @Test
    void displayMath_isBlock() {
        var math = parse("$$\na + b\n$$\n").nodes().get(0);

        assertEquals(NodeKind.MATH, math.kind());
        assertEquals("\na + b\n", math.content());
    }

    // === Inline ===

    @Test
    void inline_recognizesEmphasisStrongAndCode() {
        var paragraph = parse("*a* **b** `c`").nodes().get(0);

        assertEquals(List.of(NodeKind.EMPHASIS, NodeKind.TEXT, NodeKind.STRONG, NodeKind.TEXT, NodeKind.CODE_INLINE),
                     kinds(paragraph.children()));
    }

    @Test
    void inline_linkAndImageCarryTargets() {
        var paragraph = parse("[docs](https://x.io \"X\") ![alt](p.png)").nodes().get(0);
        var link = paragraph.children().get(0);
        var image = paragraph.children().get(2);

        assertEquals("https://x.io", link.get(Attribute.HREF).orElseThrow());
        assertEquals("X", link.get(Attribute.TITLE).orElseThrow());
        assertEquals(NodeKind.IMAGE, image.kind());
        assertEquals("p.png", image.get(Attribute.SRC).orElseThrow());
        assertEquals("alt", image.get(Attribute.ALT).orElseThrow());
    }

    @Test
    void inline_bracketedCitation_collectsKeys() {
        var paragraph = parse("As shown [see @smith2020, p. 4; @doe2019].").nodes().get(0);
        var citation = paragraph.children().get(1);

        assertEquals(NodeKind.CITATION, citation.kind());
        assertEquals(List.of("smith2020", "doe2019"), citation.get(Attribute.CITATION_KEYS).orElseThrow());
    }

    @Test
    void inline_plainBrackets_stayText() {
        var paragraph = parse("[not a link] here").nodes().get(0);

        assertEquals(List.of(NodeKind.TEXT), kinds(paragraph.children()));
    }

    @Test
    void inline_autolink() {
        var link = parse("<https://x.io/a>").nodes().get(0).children().get(0);

        assertEquals(NodeKind.LINK, link.kind());
        assertEquals("https://x.io/a", link.get(Attribute.HREF).orElseThrow());
    }

    // === Document ===

    @Test
    void metadata_describesDocument() {
        var metadata = parse("# T\n\n[l](u) ![i](s) `c` [@k]\n").metadata();

        assertEquals(2, metadata.count(Metadata.NUM_BLOCKS));
        assertTrue(metadata.flag(Metadata.HAS_HEADINGS));
        assertTrue(metadata.flag(Metadata.HAS_LINKS));
        assertTrue(metadata.flag(Metadata.HAS_IMAGES));
        assertTrue(metadata.flag(Metadata.HAS_CODE));
        assertTrue(metadata.flag(Metadata.HAS_CITATIONS));
    }

    @Test
    void crlfInput_keepsCarriageReturnsOutOfContent() {
        var document = parse("# A\r\n\r\ntext\r\n");

        assertEquals("A", document.nodes().get(0).content());
        assertEquals("text", document.nodes().get(1).content());
        assertTrue(TreeInvariants.holds(document));
    }

    @Test
    void mixedDocument_satisfiesTreeInvariants() {
        var document = parse("# H\n\n- *a* [b](c)\n  more\n- d\n\n> q `x`\n\n| a |\n|---|\n| **b** |\n");

        assertEquals(List.of(), TreeInvariants.check(document));
    }

    @Test
    void validate_reportsBracketsAndHeadingSkips() {
        var errors = parser.validate("# A\n\n### C [x\n");

        assertThat(errors).containsExactly("Unmatched brackets: 1 [ vs 0 ]",
                                           "Heading level skip at line 3: h1 -> h3");
    }

    @Test
    void validate_firstHeadingBelowTopLevel_isSkip() {
        assertEquals(List.of("Heading level skip at line 1: h0 -> h2"), parser.validate("## Start\n"));
    }

    private Document parse(String input) {
        return parser.parse(input).unwrap();
    }

    private static List<NodeKind> kinds(List<Node> nodes) {
        return nodes.stream().map(Node::kind).toList();
    }
}
