package org.pragmatica.markup.parser.bib;

import org.pragmatica.markup.parser.AbstractDocumentParser;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.parser.ParsingContext;
import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.Dialect;
import org.pragmatica.markup.tree.Document;
import org.pragmatica.markup.tree.Metadata;
import org.pragmatica.markup.tree.Node;
import org.pragmatica.markup.validate.EntryValidator;
import org.pragmatica.markup.validate.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Parser for bibliographic-entry records.
 *
 * <p>Each record becomes one {@code ENTRY} node holding its key, type and resolved field map,
 * with one {@code FIELD} child per field. Missing required fields are not a parse concern;
 * see {@link EntryValidator}.
 */
public final class BibEntryParser extends AbstractDocumentParser {
    private static final Logger log = LoggerFactory.getLogger(BibEntryParser.class);

    public BibEntryParser() {
        this(ParserConfig.DEFAULT);
    }

    public BibEntryParser(ParserConfig config) {
        super(config);
    }

    @Override
    public Dialect dialect() {
        return Dialect.BIB_ENTRY;
    }

    @Override
    protected Document buildDocument(ParsingContext ctx) {
        var nodes = new BibScanner(ctx).scanDocument();
        return Document.create(Dialect.BIB_ENTRY, ctx.input(), ctx.lineIndex(), nodes, collectMetadata(nodes));
    }

    private static Metadata collectMetadata(List<Node> nodes) {
        int entries = 0;
        int comments = 0;
        int strings = 0;
        int emptyIds = 0;
        var types = new TreeSet<String>();

        for (var node : nodes) {
            switch (node.kind()) {
                case ENTRY -> {
                    entries++;
                    types.add(node.getOrDefault(Attribute.ENTRY_TYPE, ""));
                    if (node.getOrDefault(Attribute.ENTRY_KEY, "").isEmpty()) {
                        emptyIds++;
                    }
                }
                case COMMENT -> comments++;
                case STRING_DEFINITION -> strings++;
                default -> {
                }
            }
        }
        if (emptyIds > 0) {
            log.debug("Found {} entries with empty ID", emptyIds);
        }

        return new Metadata()
            .put(Metadata.NUM_ENTRIES, entries)
            .put(Metadata.NUM_COMMENTS, comments)
            .put(Metadata.NUM_STRINGS, strings)
            .put(Metadata.ENTRY_TYPES, List.copyOf(types))
            .put(Metadata.HAS_EMPTY_IDS, emptyIds > 0)
            .put(Metadata.EMPTY_ID_COUNT, emptyIds);
    }

    @Override
    public List<String> validate(String input) {
        var ctx = ParsingContext.create(input);
        var document = buildDocument(ctx);

        var errors = new ArrayList<String>();
        if (ctx.hasErrors()) {
            ctx.errors().forEach(error -> errors.add("Parse error: " + error.message()));
            return errors;
        }
        EntryValidator.validate(document).stream()
                      .map(ValidationIssue::message)
                      .forEach(errors::add);
        return errors;
    }
}
