package org.pragmatica.markup.query;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.parser.DocumentParser;
import org.pragmatica.markup.tree.Dialect;
import org.pragmatica.markup.tree.Document;
import org.pragmatica.markup.tree.NodeKind;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DocumentQueriesTest {

    // === Markup ===

    @Test
    void markupHeadings_followSectioningMacros() {
        var document = parse(Dialect.MARKUP, "\\section{Intro}\n\\subsection*{\\emph{Deep} dive}\n\\chapter{ }\n\\part{P}");

        var headings = DocumentQueries.extractHeadings(document);

        assertEquals(List.of("section", "subsection", "part"), headings.stream().map(HeadingRecord::type).toList());
        assertEquals(List.of(1, 2, -1), headings.stream().map(HeadingRecord::level).toList());
        assertEquals(List.of("Intro", "Deep dive", "P"), headings.stream().map(HeadingRecord::text).toList());
    }

    @Test
    void markupCitations_keepCommandAndRawText() {
        var document = parse(Dialect.MARKUP, "See \\begin{quote}\\citep[p.~4]{a, b}\\end{quote}");

        var citations = DocumentQueries.extractCitations(document);

        assertEquals(1, citations.size());
        var citation = citations.get(0);
        assertEquals("citep", citation.command());
        assertEquals(List.of("a", "b"), citation.keys());
        assertEquals("\\citep[p.~4]{a, b}", citation.rawText());
        assertEquals(17, citation.span().startOffset());
    }

    @Test
    void labels_areCollected() {
        var document = parse(Dialect.MARKUP, "\\section{A}\\label{sec:a} \\label{ }");

        var labels = DocumentQueries.extractLabels(document);

        assertEquals(List.of("sec:a"), labels.stream().map(LabelRecord::label).toList());
    }

    @Test
    void findNodesByKind_searchesEveryDepth() {
        var document = parse(Dialect.MARKUP, "$a$ \\emph{$b$ \\textbf{$c$}}");

        assertEquals(3, DocumentQueries.findNodesByKind(document, NodeKind.MATH).size());
        assertTrue(DocumentQueries.findNodesByKind(document, NodeKind.ENTRY).isEmpty());
    }

    // === Block markup ===

    @Test
    void blockHeadings_useMarkerLevelAndPlainText() {
        var document = parse(Dialect.BLOCK_MARKUP, "# Top\n\n## **Bold** `code` title\n");

        var headings = DocumentQueries.extractHeadings(document);

        assertEquals(2, headings.size());
        assertEquals(new HeadingRecord("heading", 2, "Bold code title", headings.get(1).span()), headings.get(1));
        assertEquals(1, headings.get(0).level());
    }

    @Test
    void blockLinksImagesAndCode_areExtracted() {
        var document = parse(Dialect.BLOCK_MARKUP,
                             "A [*site*](https://x.io \"X\") and ![fig](f.png).\n\n```sh\nls\n```\n\n[@k1; @k2]\n");

        var links = DocumentQueries.extractLinks(document);
        assertEquals(1, links.size());
        assertEquals("site", links.get(0).text());
        assertEquals("https://x.io", links.get(0).href());
        assertEquals("X", links.get(0).title());

        var images = DocumentQueries.extractImages(document);
        assertEquals("f.png", images.get(0).src());
        assertEquals("fig", images.get(0).alt());

        var code = DocumentQueries.extractCodeBlocks(document);
        assertEquals("sh", code.get(0).language());
        assertEquals("ls", code.get(0).content());

        var citations = DocumentQueries.extractCitations(document);
        assertEquals("citation", citations.get(0).command());
        assertEquals(List.of("k1", "k2"), citations.get(0).keys());
    }

    // === Records ===

    @Test
    void entries_areLookedUpByKey() {
        var document = parse(Dialect.BIB_ENTRY, """
            @article{smith2020, author = {Smith}, year = 2020}
            @comment{not an entry}
            @book{doe, title = {Book}}
            """);

        var entries = DocumentQueries.extractEntries(document);

        assertEquals(List.of("smith2020", "doe"), entries.stream().map(EntryRecord::key).toList());
        assertEquals(List.of("author", "year"), List.copyOf(entries.get(0).fields().keySet()));
        assertEquals("book", DocumentQueries.findEntry(document, "doe").orElseThrow().type());
        assertEquals(Optional.of("2020"), DocumentQueries.extractField(document, "smith2020", "year"));
        assertEquals(Optional.empty(), DocumentQueries.extractField(document, "smith2020", "title"));
        assertEquals(Optional.empty(), DocumentQueries.findEntry(document, "missing"));
    }

    private static Document parse(Dialect dialect, String input) {
        return DocumentParser.forDialect(dialect).parse(input).unwrap();
    }
}
