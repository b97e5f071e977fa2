package org.pragmatica.markup.parser.bib;

import org.pragmatica.markup.error.ParseError;
import org.pragmatica.markup.parser.ParsingContext;
import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.Node;
import org.pragmatica.markup.tree.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scanner for one bibliographic-record parse. {@code @string} definitions are resolved in
 * document order, so a new instance is created for every input.
 */
final class BibScanner {
    private static final Map<String, String> MONTHS = Map.ofEntries(
        Map.entry("jan", "January"), Map.entry("feb", "February"), Map.entry("mar", "March"),
        Map.entry("apr", "April"), Map.entry("may", "May"), Map.entry("jun", "June"),
        Map.entry("jul", "July"), Map.entry("aug", "August"), Map.entry("sep", "September"),
        Map.entry("oct", "October"), Map.entry("nov", "November"), Map.entry("dec", "December"));

    private final ParsingContext ctx;
    private final String input;
    private final Map<String, String> strings = new HashMap<>();

    BibScanner(ParsingContext ctx) {
        this.ctx = ctx;
        this.input = ctx.input();
    }

    List<Node> scanDocument() {
        var nodes = new ArrayList<Node>();
        int textStart = 0;

        while (!ctx.isAtEnd()) {
            if (ctx.peek() != '@') {
                ctx.advance();
                continue;
            }
            int at = ctx.pos();
            var record = record(at);
            if (record == null) {
                ctx.setPos(at + 1);
                continue;
            }
            addText(nodes, textStart, at);
            nodes.add(record);
            textStart = ctx.pos();
        }
        addText(nodes, textStart, input.length());
        return nodes;
    }

    /**
     * Free text between records, surrounding whitespace left out.
     */
    private void addText(List<Node> nodes, int from, int to) {
        while (from < to && Character.isWhitespace(input.charAt(from))) {
            from++;
        }
        while (to > from && Character.isWhitespace(input.charAt(to - 1))) {
            to--;
        }
        if (from < to) {
            nodes.add(Node.builder(NodeKind.TEXT, ctx.span(from, to))
                          .content(input.substring(from, to))
                          .build());
        }
    }

    // === Records ===

    private Node record(int at) {
        int typeStart = at + 1;
        int typeEnd = typeStart;
        while (typeEnd < input.length() && isNameChar(input.charAt(typeEnd))) {
            typeEnd++;
        }
        if (typeEnd == typeStart) {
            return null;
        }
        int open = skipWhitespace(typeEnd);
        if (open >= input.length() || (input.charAt(open) != '{' && input.charAt(open) != '(')) {
            return null;
        }

        var type = input.substring(typeStart, typeEnd).toLowerCase(Locale.ROOT);
        char closer = input.charAt(open) == '{' ? '}' : ')';
        int close = findCloser(open, closer);
        boolean terminated = close >= 0;
        if (!terminated) {
            ctx.addError(new ParseError.UnterminatedEntry(ctx.location(at), type));
            close = recoveryPoint(open + 1);
        }
        int end = terminated ? close + 1 : close;
        ctx.setPos(end);

        return switch (type) {
            case "comment" -> Node.builder(NodeKind.COMMENT, ctx.span(at, end))
                                  .content(input.substring(open + 1, close))
                                  .build();
            case "preamble" -> Node.builder(NodeKind.PREAMBLE, ctx.span(at, end))
                                   .content(stripDelimiters(input.substring(open + 1, close).trim()))
                                   .build();
            case "string" -> stringDefinition(at, open + 1, close, end);
            default -> entry(at, type, open + 1, close, end);
        };
    }

    private Node stringDefinition(int at, int bodyStart, int bodyEnd, int end) {
        var fields = new ArrayList<Node>();
        var values = new LinkedHashMap<String, String>();
        parseFields(bodyStart, bodyEnd, "string", "", fields, values);

        var builder = Node.builder(NodeKind.STRING_DEFINITION, ctx.span(at, end));
        if (values.isEmpty()) {
            return builder.content("").build();
        }
        var definition = values.entrySet().iterator().next();
        strings.put(definition.getKey(), definition.getValue());
        return builder.content(definition.getValue())
                      .attribute(Attribute.FIELD_NAME, definition.getKey())
                      .build();
    }

    private Node entry(int at, String type, int bodyStart, int bodyEnd, int end) {
        int keyEnd = bodyStart;
        while (keyEnd < bodyEnd && input.charAt(keyEnd) != ',') {
            keyEnd++;
        }
        var key = input.substring(bodyStart, keyEnd).trim();

        var fields = new ArrayList<Node>();
        var values = new LinkedHashMap<String, String>();
        if (keyEnd < bodyEnd) {
            parseFields(keyEnd + 1, bodyEnd, type, key, fields, values);
        }

        return Node.builder(NodeKind.ENTRY, ctx.span(at, end))
                   .content(key)
                   .attribute(Attribute.ENTRY_KEY, key)
                   .attribute(Attribute.ENTRY_TYPE, type)
                   .attribute(Attribute.FIELDS, Collections.unmodifiableMap(values))
                   .children(fields)
                   .build();
    }

    // === Fields ===

    private void parseFields(int from, int to, String type, String key,
                             List<Node> fields, Map<String, String> values) {
        int pos = from;
        while (true) {
            pos = skipSeparators(pos, to);
            if (pos >= to) {
                return;
            }
            int nameStart = pos;
            while (pos < to && isNameChar(input.charAt(pos))) {
                pos++;
            }
            if (pos == nameStart) {
                ctx.addError(new ParseError.MalformedEntry(ctx.location(pos),
                                                           "Unexpected '" + input.charAt(pos) + "' in @" + type + describeKey(key)));
                pos = nextSeparator(pos, to);
                continue;
            }
            var name = input.substring(nameStart, pos).toLowerCase(Locale.ROOT);
            pos = Math.min(skipWhitespace(pos), to);
            if (pos >= to || input.charAt(pos) != '=') {
                ctx.addError(new ParseError.MalformedEntry(ctx.location(pos),
                                                           "Expected '=' after field '" + name + "' in @" + type + describeKey(key)));
                pos = nextSeparator(pos, to);
                continue;
            }
            var value = new StringBuilder();
            pos = value(pos + 1, to, value);

            int fieldEnd = pos;
            while (fieldEnd > nameStart && Character.isWhitespace(input.charAt(fieldEnd - 1))) {
                fieldEnd--;
            }
            var resolved = value.toString();
            values.put(name, resolved);
            fields.add(Node.builder(NodeKind.FIELD, ctx.span(nameStart, fieldEnd))
                           .content(resolved)
                           .attribute(Attribute.FIELD_NAME, name)
                           .build());
        }
    }

    private static String describeKey(String key) {
        return key.isEmpty() ? " record" : " entry '" + key + "'";
    }

    /**
     * Parse a {@code #}-concatenated value and return the offset after it.
     */
    private int value(int from, int to, StringBuilder out) {
        int pos = Math.min(skipWhitespace(from), to);
        while (pos < to) {
            char c = input.charAt(pos);
            if (c == '{') {
                int close = findCloser(pos, '}');
                int end = close < 0 || close >= to ? to : close;
                out.append(input, pos + 1, end);
                pos = Math.min(to, end + 1);
            } else if (c == '"') {
                int close = closingQuote(pos + 1, to);
                out.append(input, pos + 1, close);
                pos = Math.min(to, close + 1);
            } else if (isNameChar(c)) {
                int start = pos;
                while (pos < to && isNameChar(input.charAt(pos))) {
                    pos++;
                }
                out.append(resolveMacro(input.substring(start, pos)));
            } else {
                return pos;
            }
            pos = Math.min(skipWhitespace(pos), to);
            if (pos < to && input.charAt(pos) == '#') {
                pos = Math.min(skipWhitespace(pos + 1), to);
                continue;
            }
            return pos;
        }
        return pos;
    }

    private String resolveMacro(String token) {
        if (token.chars().allMatch(Character::isDigit)) {
            return token;
        }
        var lower = token.toLowerCase(Locale.ROOT);
        var defined = strings.get(lower);
        if (defined != null) {
            return defined;
        }
        return MONTHS.getOrDefault(lower, token);
    }

    private int closingQuote(int from, int to) {
        int depth = 0;
        for (int at = from; at < to; at++) {
            char c = input.charAt(at);
            if (c == '\\') {
                at++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            } else if (c == '"' && depth <= 0) {
                return at;
            }
        }
        return to;
    }

    // === Scanning helpers ===

    /**
     * Offset of the closer matching the opener at {@code open}, or -1. Braces always nest;
     * in the parenthesized record form quotes hide parentheses at the top level.
     */
    private int findCloser(int open, char closer) {
        int braces = 0;
        int parens = 0;
        boolean quoted = false;
        for (int at = open; at < input.length(); at++) {
            char c = input.charAt(at);
            if (c == '\\') {
                at++;
                continue;
            }
            if (closer == '}') {
                if (c == '{') {
                    braces++;
                } else if (c == '}' && --braces == 0) {
                    return at;
                }
                continue;
            }
            if (c == '"' && braces == 0) {
                quoted = !quoted;
            } else if (c == '{') {
                braces++;
            } else if (c == '}') {
                braces = Math.max(0, braces - 1);
            } else if (!quoted && braces == 0 && c == '(') {
                parens++;
            } else if (!quoted && braces == 0 && c == ')' && --parens == 0) {
                return at;
            }
        }
        return -1;
    }

    /**
     * Where an unterminated record stops: before the next line that starts a record, or at the end.
     */
    private int recoveryPoint(int from) {
        int at = from;
        while (true) {
            int newline = input.indexOf('\n', at);
            if (newline < 0) {
                return input.length();
            }
            int lineStart = newline + 1;
            int first = lineStart;
            while (first < input.length() && (input.charAt(first) == ' ' || input.charAt(first) == '\t')) {
                first++;
            }
            if (first < input.length() && input.charAt(first) == '@') {
                return newline;
            }
            at = lineStart;
        }
    }

    private int skipWhitespace(int from) {
        int at = from;
        while (at < input.length() && Character.isWhitespace(input.charAt(at))) {
            at++;
        }
        return at;
    }

    private int skipSeparators(int from, int to) {
        int at = from;
        while (at < to && (Character.isWhitespace(input.charAt(at)) || input.charAt(at) == ',')) {
            at++;
        }
        return at;
    }

    /**
     * Skip to the next top-level comma so one bad field does not hide the following ones.
     */
    private int nextSeparator(int from, int to) {
        int depth = 0;
        for (int at = from; at < to; at++) {
            char c = input.charAt(at);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            } else if (c == ',' && depth <= 0) {
                return at;
            }
        }
        return to;
    }

    private static String stripDelimiters(String value) {
        if (value.length() >= 2
            && ((value.startsWith("{") && value.endsWith("}")) || (value.startsWith("\"") && value.endsWith("\"")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == ':' || c == '.' || c == '+' || c == '/';
    }
}
