package org.pragmatica.markup.reconstruct;

import org.pragmatica.markup.reconstruct.EmittedRange.Origin;
import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.Dialect;
import org.pragmatica.markup.tree.Document;
import org.pragmatica.markup.tree.Node;
import org.pragmatica.markup.tree.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Regenerates source text from a possibly rewritten document.
 *
 * <p>Untouched nodes and the text between nodes are copied from the raw input. A node whose
 * descendants were rewritten keeps its own raw frame around the rebuilt children. A rewritten
 * node is synthesized from its kind, content and attributes, at any depth. Each byte of the
 * input is emitted at most once; a node whose position bookkeeping does not add up is emitted
 * verbatim and reported in {@link Reconstruction#inconsistencies()}.
 */
public final class Reconstructor {
    private static final Logger log = LoggerFactory.getLogger(Reconstructor.class);

    // kinds a pass may produce from a macro and its argument groups
    private static final Set<NodeKind> MACRO_DERIVED = EnumSet.of(NodeKind.MACRO, NodeKind.CITATION,
                                                                  NodeKind.GROUP, NodeKind.COMMENT);

    private final Document document;
    private final String raw;
    private final List<ReconstructionInconsistency> inconsistencies = new ArrayList<>();

    private Reconstructor(Document document) {
        this.document = document;
        this.raw = document.rawText();
    }

    public static String reconstruct(Document document) {
        return reconstructTraced(document).text();
    }

    public static Reconstruction reconstructTraced(Document document) {
        return new Reconstructor(document).run();
    }

    private Reconstruction run() {
        var out = new StringBuilder(raw.length());
        var ranges = new ArrayList<EmittedRange>();
        int cursor = 0;

        for (var node : document.nodes()) {
            if (node.start() < cursor) {
                // already covered by a rewritten node that consumed its arguments
                continue;
            }
            if (node.start() > cursor) {
                out.append(raw, cursor, node.start());
                ranges.add(new EmittedRange(cursor, node.start(), Origin.VERBATIM));
            }
            var emitted = emit(node);
            out.append(emitted.text());
            ranges.add(new EmittedRange(node.start(), emitted.end(), emitted.origin()));
            cursor = emitted.end();
        }
        if (cursor < raw.length()) {
            out.append(raw, cursor, raw.length());
            ranges.add(new EmittedRange(cursor, raw.length(), Origin.VERBATIM));
        }

        if (!inconsistencies.isEmpty()) {
            log.warn("Reconstruction fell back to verbatim text for {} node(s)", inconsistencies.size());
        }
        return new Reconstruction(out.toString(), ranges, inconsistencies);
    }

    /**
     * Text produced for one node and the raw offset it covers up to.
     */
    private record Emitted(String text, int end, Origin origin) {}

    private Emitted emit(Node node) {
        if (!node.isTouched()) {
            return new Emitted(raw.substring(node.start(), node.end()), node.end(), Origin.VERBATIM);
        }
        if (!node.isModified()) {
            return new Emitted(rebuild(node), node.end(), Origin.REBUILT);
        }

        int correctedEnd = correctedEnd(node);
        var problem = inconsistency(node, correctedEnd);
        if (problem != null) {
            var inconsistency = new ReconstructionInconsistency(node.kind(), node.start(), node.end(), correctedEnd, problem);
            log.warn("Emitting verbatim: {}", inconsistency.message());
            inconsistencies.add(inconsistency);
            return new Emitted(raw.substring(node.start(), node.end()), node.end(), Origin.VERBATIM);
        }

        var text = synthesize(node);
        if (node.is(NodeKind.COMMENT) && document.dialect() != Dialect.BIB_ENTRY
            && !endsLine(correctedEnd)) {
            text += "\n";
        }
        return new Emitted(text, correctedEnd, Origin.SYNTHESIZED);
    }

    private int correctedEnd(Node node) {
        if (document.dialect() != Dialect.MARKUP || !MACRO_DERIVED.contains(node.kind()) || node.has(Attribute.VERBATIM)) {
            return node.end();
        }
        return ArgumentScanner.macroEnd(raw, node.start(), node.end());
    }

    private String inconsistency(Node node, int correctedEnd) {
        if (correctedEnd < node.start()) {
            return "corrected end precedes start";
        }
        if (correctedEnd > raw.length()) {
            return "corrected end beyond input";
        }
        if (correctedEnd < node.end()) {
            return "corrected end inside recorded span";
        }
        return null;
    }

    private boolean endsLine(int offset) {
        return offset >= raw.length() || raw.charAt(offset) == '\n' || raw.charAt(offset) == '\r';
    }

    /**
     * The node's own raw frame with its children emitted in place.
     */
    private String rebuild(Node node) {
        var out = new StringBuilder();
        int cursor = node.start();
        for (var child : node.children()) {
            if (child.start() < cursor) {
                continue;
            }
            out.append(raw, cursor, child.start());
            var emitted = emit(child);
            out.append(emitted.text());
            cursor = emitted.end();
        }
        if (cursor < node.end()) {
            out.append(raw, cursor, node.end());
        }
        return out.toString();
    }

    /**
     * Children emitted in order with the raw text between them, without the text before the
     * first child or after the last one.
     */
    private String children(Node node) {
        var out = new StringBuilder();
        int cursor = -1;
        for (var child : node.children()) {
            if (cursor > child.start()) {
                continue;
            }
            if (cursor >= 0) {
                out.append(raw, cursor, child.start());
            }
            var emitted = emit(child);
            out.append(emitted.text());
            cursor = emitted.end();
        }
        return out.toString();
    }

    // === Synthesis ===

    private String synthesize(Node node) {
        return switch (node.kind()) {
            case TEXT, HTML, ERROR -> node.content();
            case MACRO -> macro(node);
            case CITATION -> citation(node);
            case ENVIRONMENT -> "\\begin{" + node.content() + "}" + children(node) + "\\end{" + node.content() + "}";
            case MATH -> mathDelimiter(node, true) + node.content() + mathDelimiter(node, false);
            case COMMENT -> document.dialect() == Dialect.BIB_ENTRY
                            ? "@comment{" + node.content() + "}"
                            : "%" + node.content();
            case GROUP -> node.getOrDefault(Attribute.OPTIONAL, false)
                          ? "[" + children(node) + "]"
                          : "{" + children(node) + "}";
            case HEADING -> heading(node);
            case PARAGRAPH, TABLE_CELL -> node.hasChildren() ? children(node) : node.content();
            case LINK -> "[" + (node.hasChildren() ? children(node) : node.content()) + "]("
                         + node.getOrDefault(Attribute.HREF, "") + title(node) + ")";
            case IMAGE -> "![" + node.getOrDefault(Attribute.ALT, node.content()) + "]("
                          + node.getOrDefault(Attribute.SRC, "") + title(node) + ")";
            case CODE_INLINE -> {
                var delimiter = node.getOrDefault(Attribute.DELIMITER, "`");
                yield delimiter + node.content() + delimiter;
            }
            case CODE_BLOCK -> codeBlock(node);
            case EMPHASIS, STRONG -> {
                var delimiter = node.getOrDefault(Attribute.DELIMITER, node.is(NodeKind.STRONG) ? "**" : "*");
                yield delimiter + (node.hasChildren() ? children(node) : node.content()) + delimiter;
            }
            case BLOCKQUOTE -> prefixLines(node.content(), node.getOrDefault(Attribute.MARKER, ">") + " ");
            case LIST, TABLE -> children(node);
            case LIST_ITEM -> node.getOrDefault(Attribute.MARKER, "-") + " "
                              + (node.hasChildren() ? children(node) : node.content());
            case TABLE_ROW -> "| " + children(node) + " |";
            case THEMATIC_BREAK -> node.content().isEmpty() ? "---" : node.content();
            case ENTRY -> entry(node);
            case FIELD -> node.getOrDefault(Attribute.FIELD_NAME, "") + " = {" + node.content() + "}";
            case STRING_DEFINITION -> "@string{" + node.getOrDefault(Attribute.FIELD_NAME, "") + " = {" + node.content() + "}}";
            case PREAMBLE -> "@preamble{\"" + node.content() + "\"}";
        };
    }

    private String macro(Node node) {
        var out = new StringBuilder("\\").append(node.content());
        if (node.getOrDefault(Attribute.STARRED, false)) {
            out.append('*');
        }

        var verbatim = node.get(Attribute.VERBATIM);
        if (verbatim.isPresent()) {
            var delimiter = node.getOrDefault(Attribute.DELIMITER, "|");
            return out.append(children(node))
                      .append(delimiter)
                      .append(verbatim.get())
                      .append(delimiter.equals("{") ? "}" : delimiter)
                      .toString();
        }

        var arguments = node.get(Attribute.ARGUMENTS);
        if (arguments.isPresent()) {
            arguments.get().forEach(argument -> out.append('{').append(argument).append('}'));
            return out.toString();
        }
        return out.append(children(node)).toString();
    }

    private String citation(Node node) {
        var keys = node.getOrDefault(Attribute.CITATION_KEYS, List.of());
        if (document.dialect() == Dialect.BLOCK_MARKUP) {
            return "[" + String.join("; ", keys.stream().map(key -> "@" + key).toList()) + "]";
        }
        var out = new StringBuilder("\\").append(node.content());
        if (node.getOrDefault(Attribute.STARRED, false)) {
            out.append('*');
        }
        node.children().stream()
            .filter(child -> child.getOrDefault(Attribute.OPTIONAL, false))
            .forEach(option -> out.append(emit(option).text()));
        return out.append('{').append(String.join(",", keys)).append('}').toString();
    }

    private static String mathDelimiter(Node node, boolean opening) {
        var delimiter = node.getOrDefault(Attribute.DELIMITER, node.getOrDefault(Attribute.DISPLAY, false) ? "$$" : "$");
        if (opening) {
            return delimiter;
        }
        return switch (delimiter) {
            case "\\(" -> "\\)";
            case "\\[" -> "\\]";
            default -> delimiter;
        };
    }

    /**
     * Raw marker prefix and closing sequence around the synthesized heading text.
     */
    private String heading(Node node) {
        var body = node.hasChildren() ? children(node) : node.content();
        int prefixEnd = ArgumentScanner.headingPrefixEnd(raw, node.start(), node.end());
        if (prefixEnd == node.start()) {
            return "#".repeat(node.getOrDefault(Attribute.LEVEL, 1)) + " " + body;
        }
        int suffixStart = Math.max(prefixEnd, ArgumentScanner.headingSuffixStart(raw, node.start(), node.end()));
        return raw.substring(node.start(), prefixEnd) + body + raw.substring(suffixStart, node.end());
    }

    private static String title(Node node) {
        return node.get(Attribute.TITLE)
                   .map(title -> " \"" + title + "\"")
                   .orElse("");
    }

    private static String codeBlock(Node node) {
        var fence = node.getOrDefault(Attribute.DELIMITER, "```");
        if (fence.isEmpty()) {
            return prefixLines(node.content(), "    ");
        }
        return fence + node.getOrDefault(Attribute.LANGUAGE, "") + "\n" + node.content() + "\n" + fence;
    }

    private static String prefixLines(String text, String prefix) {
        var lines = text.split("\n", -1);
        var out = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            out.append(prefix).append(lines[i]);
        }
        return out.toString();
    }

    private static String entry(Node node) {
        var out = new StringBuilder("@").append(node.getOrDefault(Attribute.ENTRY_TYPE, "misc"))
                                        .append('{')
                                        .append(node.getOrDefault(Attribute.ENTRY_KEY, node.content()));
        Map<String, String> fields = node.getOrDefault(Attribute.FIELDS, Map.of());
        fields.forEach((name, value) -> out.append(",\n  ").append(name).append(" = {").append(value).append('}'));
        return out.append("\n}").toString();
    }
}
