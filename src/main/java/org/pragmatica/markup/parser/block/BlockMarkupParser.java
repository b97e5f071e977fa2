package org.pragmatica.markup.parser.block;

import org.pragmatica.markup.parser.AbstractDocumentParser;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.parser.ParsingContext;
import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.Dialect;
import org.pragmatica.markup.tree.Document;
import org.pragmatica.markup.tree.Metadata;
import org.pragmatica.markup.tree.Node;
import org.pragmatica.markup.tree.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for the lightweight block-markup dialect.
 *
 * <p>Block markup has no unrecoverable syntax: every input yields a tree. Suspicious input,
 * such as a code fence that is never closed, is reported as a warning diagnostic.
 */
public final class BlockMarkupParser extends AbstractDocumentParser {

    public BlockMarkupParser() {
        this(ParserConfig.DEFAULT);
    }

    public BlockMarkupParser(ParserConfig config) {
        super(config);
    }

    @Override
    public Dialect dialect() {
        return Dialect.BLOCK_MARKUP;
    }

    @Override
    protected Document buildDocument(ParsingContext ctx) {
        var blocks = new BlockScanner(ctx).scanDocument();
        return Document.create(Dialect.BLOCK_MARKUP, ctx.input(), ctx.lineIndex(), blocks, collectMetadata(blocks));
    }

    private static Metadata collectMetadata(List<Node> blocks) {
        var all = flatten(blocks);
        return new Metadata()
            .put(Metadata.NUM_BLOCKS, blocks.size())
            .put(Metadata.HAS_HEADINGS, all.stream().anyMatch(node -> node.is(NodeKind.HEADING)))
            .put(Metadata.HAS_LINKS, all.stream().anyMatch(node -> node.is(NodeKind.LINK)))
            .put(Metadata.HAS_IMAGES, all.stream().anyMatch(node -> node.is(NodeKind.IMAGE)))
            .put(Metadata.HAS_CODE, all.stream().anyMatch(node -> node.is(NodeKind.CODE_BLOCK) || node.is(NodeKind.CODE_INLINE)))
            .put(Metadata.HAS_CITATIONS, all.stream().anyMatch(node -> node.is(NodeKind.CITATION)));
    }

    private static List<Node> flatten(List<Node> nodes) {
        var all = new ArrayList<Node>();
        for (var node : nodes) {
            all.add(node);
            all.addAll(flatten(node.children()));
        }
        return all;
    }

    @Override
    public List<String> validate(String input) {
        var errors = new ArrayList<String>();

        long open = input.chars().filter(c -> c == '[').count();
        long close = input.chars().filter(c -> c == ']').count();
        if (open != close) {
            errors.add("Unmatched brackets: " + open + " [ vs " + close + " ]");
        }

        var ctx = ParsingContext.create(input);
        var document = buildDocument(ctx);
        int previous = 0;
        for (var node : flatten(document.nodes())) {
            if (!node.is(NodeKind.HEADING)) {
                continue;
            }
            int level = node.getOrDefault(Attribute.LEVEL, 1);
            if (level > previous + 1) {
                errors.add("Heading level skip at line " + node.line() + ": h" + previous + " -> h" + level);
            }
            previous = level;
        }
        return errors;
    }
}
