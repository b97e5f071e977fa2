package org.pragmatica.markup.parser.markup;

import org.pragmatica.markup.parser.AbstractDocumentParser;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.parser.ParsingContext;
import org.pragmatica.markup.tree.Dialect;
import org.pragmatica.markup.tree.Document;
import org.pragmatica.markup.tree.Metadata;
import org.pragmatica.markup.tree.Node;
import org.pragmatica.markup.tree.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for the LaTeX-like macro/environment dialect.
 *
 * <p>Macro arguments are attached to the macro node at parse time according to
 * {@link org.pragmatica.markup.parser.MacroSignatures}. Syntax errors never stop the scan:
 * the tree always covers the whole input, and the configured recovery strategy decides
 * whether errors fail the parse.
 */
public final class MarkupParser extends AbstractDocumentParser {

    public MarkupParser() {
        this(ParserConfig.DEFAULT);
    }

    public MarkupParser(ParserConfig config) {
        super(config);
    }

    @Override
    public Dialect dialect() {
        return Dialect.MARKUP;
    }

    @Override
    protected Document buildDocument(ParsingContext ctx) {
        var nodes = new MarkupScanner(ctx, config).scanDocument();
        return Document.create(Dialect.MARKUP, ctx.input(), ctx.lineIndex(), nodes, collectMetadata(ctx.input(), nodes));
    }

    private static Metadata collectMetadata(String input, List<Node> nodes) {
        var all = new ArrayList<Node>();
        flatten(nodes, all);

        return new Metadata()
            .put(Metadata.TOTAL_LENGTH, input.length())
            .put(Metadata.NUM_NODES, nodes.size())
            .put(Metadata.HAS_MATH, all.stream().anyMatch(node -> node.is(NodeKind.MATH)))
            .put(Metadata.HAS_CITATIONS, all.stream().anyMatch(node -> node.is(NodeKind.CITATION)))
            .put(Metadata.HAS_ENVIRONMENTS, all.stream().anyMatch(node -> node.is(NodeKind.ENVIRONMENT)));
    }

    private static void flatten(List<Node> nodes, List<Node> into) {
        for (var node : nodes) {
            into.add(node);
            flatten(node.children(), into);
        }
    }

    @Override
    public List<String> validate(String input) {
        var errors = new ArrayList<String>();

        var ctx = ParsingContext.create(input);
        buildDocument(ctx);
        ctx.errors().forEach(error -> errors.add("Parse error: " + error.message()));

        int open = 0;
        int close = 0;
        int dollars = 0;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c == '\\') {
                // escaped character does not count
                i++;
                continue;
            }
            switch (c) {
                case '{' -> open++;
                case '}' -> close++;
                case '$' -> dollars++;
                default -> {
                }
            }
        }
        if (open != close) {
            errors.add("Unmatched braces: " + open + " { vs " + close + " }");
        }
        if (dollars % 2 != 0) {
            errors.add("Unmatched $ math delimiter");
        }
        return errors;
    }
}
