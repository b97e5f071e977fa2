package org.pragmatica.markup.query;

import org.pragmatica.markup.transform.NodeWalker;
import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.Dialect;
import org.pragmatica.markup.tree.Document;
import org.pragmatica.markup.tree.Node;
import org.pragmatica.markup.tree.NodeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookups over a parsed document. All searches visit every depth in document order.
 */
public final class DocumentQueries {
    private static final Map<String, Integer> SECTION_LEVELS = Map.of(
        "part", -1,
        "chapter", 0,
        "section", 1,
        "subsection", 2,
        "subsubsection", 3,
        "paragraph", 4);

    private DocumentQueries() {}

    public static List<Node> findNodesByKind(Document document, NodeKind kind) {
        var found = new ArrayList<Node>();
        NodeWalker.preOrder(document.nodes(), node -> {
            if (node.is(kind)) {
                found.add(node);
            }
        });
        return found;
    }

    // === Markup and block markup ===

    public static List<CitationRecord> extractCitations(Document document) {
        var command = document.dialect() == Dialect.BLOCK_MARKUP ? "citation" : null;
        return findNodesByKind(document, NodeKind.CITATION).stream()
                                                           .map(node -> new CitationRecord(command == null ? node.content() : command,
                                                                                           node.getOrDefault(Attribute.CITATION_KEYS, List.of()),
                                                                                           document.textOf(node),
                                                                                           node.span()))
                                                           .toList();
    }

    /**
     * Block headings, or sectioning macros with a non-blank title for markup.
     */
    public static List<HeadingRecord> extractHeadings(Document document) {
        if (document.dialect() == Dialect.BLOCK_MARKUP) {
            return findNodesByKind(document, NodeKind.HEADING).stream()
                                                              .map(node -> new HeadingRecord("heading",
                                                                                             node.getOrDefault(Attribute.LEVEL, 1),
                                                                                             plainText(node).strip(),
                                                                                             node.span()))
                                                              .toList();
        }

        var headings = new ArrayList<HeadingRecord>();
        for (var node : findNodesByKind(document, NodeKind.MACRO)) {
            var level = SECTION_LEVELS.get(node.content());
            if (level == null) {
                continue;
            }
            firstArgument(node).map(DocumentQueries::plainText)
                               .map(String::strip)
                               .filter(title -> !title.isEmpty())
                               .ifPresent(title -> headings.add(new HeadingRecord(node.content(), level, title, node.span())));
        }
        return headings;
    }

    public static List<LabelRecord> extractLabels(Document document) {
        var labels = new ArrayList<LabelRecord>();
        for (var node : findNodesByKind(document, NodeKind.MACRO)) {
            if (!node.content().equals("label")) {
                continue;
            }
            firstArgument(node).map(DocumentQueries::plainText)
                               .map(String::strip)
                               .filter(label -> !label.isEmpty())
                               .ifPresent(label -> labels.add(new LabelRecord(label, node.span())));
        }
        return labels;
    }

    public static List<LinkRecord> extractLinks(Document document) {
        return findNodesByKind(document, NodeKind.LINK).stream()
                                                       .map(node -> new LinkRecord(linkText(node),
                                                                                   node.getOrDefault(Attribute.HREF, ""),
                                                                                   node.getOrDefault(Attribute.TITLE, ""),
                                                                                   node.span()))
                                                       .toList();
    }

    public static List<ImageRecord> extractImages(Document document) {
        return findNodesByKind(document, NodeKind.IMAGE).stream()
                                                        .map(node -> new ImageRecord(node.getOrDefault(Attribute.SRC, ""),
                                                                                     node.getOrDefault(Attribute.ALT, ""),
                                                                                     node.span()))
                                                        .toList();
    }

    public static List<CodeBlockRecord> extractCodeBlocks(Document document) {
        return findNodesByKind(document, NodeKind.CODE_BLOCK).stream()
                                                             .map(node -> new CodeBlockRecord(node.getOrDefault(Attribute.LANGUAGE, ""),
                                                                                              node.content(),
                                                                                              node.span()))
                                                             .toList();
    }

    // === Bib entries ===

    public static List<EntryRecord> extractEntries(Document document) {
        return document.nodes().stream()
                       .filter(node -> node.is(NodeKind.ENTRY))
                       .map(DocumentQueries::entry)
                       .toList();
    }

    public static Optional<EntryRecord> findEntry(Document document, String key) {
        return extractEntries(document).stream()
                                       .filter(entry -> entry.key().equals(key))
                                       .findFirst();
    }

    public static Optional<String> extractField(Document document, String key, String field) {
        return findEntry(document, key).flatMap(entry -> entry.field(field));
    }

    private static EntryRecord entry(Node node) {
        return new EntryRecord(node.getOrDefault(Attribute.ENTRY_KEY, node.content()),
                               node.getOrDefault(Attribute.ENTRY_TYPE, ""),
                               node.getOrDefault(Attribute.FIELDS, Map.of()),
                               node.span());
    }

    // === Text ===

    /**
     * Text runs and inline code below the node, concatenated in order.
     */
    public static String plainText(Node node) {
        var text = new StringBuilder();
        NodeWalker.preOrder(List.of(node), visited -> {
            if (visited.is(NodeKind.TEXT) || visited.is(NodeKind.CODE_INLINE)) {
                text.append(visited.content());
            }
        });
        return text.toString();
    }

    private static String linkText(Node link) {
        return link.hasChildren() ? plainText(link).strip() : link.content().strip();
    }

    private static Optional<Node> firstArgument(Node macro) {
        return macro.children().stream()
                    .filter(child -> child.is(NodeKind.GROUP) && !child.getOrDefault(Attribute.OPTIONAL, false))
                    .findFirst();
    }
}
