package org.pragmatica.markup.parser.markup;

import org.pragmatica.markup.error.ParseError;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.parser.ParsingContext;
import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.Node;
import org.pragmatica.markup.tree.NodeKind;
import org.pragmatica.markup.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Recursive-descent scanner for one markup parse. Holds the per-call state
 * (cursor and open environments), so a new instance is created for every input.
 */
final class MarkupScanner {
    private static final String END = "\\end{";

    private final ParsingContext ctx;
    private final ParserConfig config;
    private final Deque<String> environments = new ArrayDeque<>();
    private final Deque<SourceSpan> openers = new ArrayDeque<>();

    MarkupScanner(ParsingContext ctx, ParserConfig config) {
        this.ctx = ctx;
        this.config = config;
    }

    /**
     * Where a node sequence ends.
     */
    private enum Scope {
        DOCUMENT,
        GROUP,
        OPTIONAL,
        ENVIRONMENT
    }

    /**
     * Why a node sequence stopped. The terminating token is not consumed.
     */
    private enum Stop {
        END_OF_INPUT,
        CLOSE_BRACE,
        CLOSE_BRACKET,
        END_ENVIRONMENT
    }

    private record Sequence(List<Node> nodes, Stop stop) {}

    List<Node> scanDocument() {
        return sequence(Scope.DOCUMENT).nodes();
    }

    // === Sequences ===

    private Sequence sequence(Scope scope) {
        var nodes = new ArrayList<Node>();

        while (!ctx.isAtEnd()) {
            char c = ctx.peek();
            switch (c) {
                case '\\' -> {
                    if (ctx.startsWith(END) && closesOpenEnvironment()) {
                        return new Sequence(nodes, Stop.END_ENVIRONMENT);
                    }
                    nodes.add(backslash());
                }
                case '%' -> nodes.add(comment());
                case '$' -> nodes.add(dollarMath());
                case '{' -> nodes.add(group());
                case '[' -> {
                    if (scope == Scope.OPTIONAL) {
                        // nested brackets inside an optional argument are kept balanced
                        nodes.add(optionalGroup());
                    } else {
                        nodes.add(text(scope));
                    }
                }
                case '}' -> {
                    if (scope == Scope.GROUP || scope == Scope.OPTIONAL) {
                        return new Sequence(nodes, Stop.CLOSE_BRACE);
                    }
                    nodes.add(strayCloser());
                }
                case ']' -> {
                    if (scope == Scope.OPTIONAL) {
                        return new Sequence(nodes, Stop.CLOSE_BRACKET);
                    }
                    nodes.add(text(scope));
                }
                default -> nodes.add(text(scope));
            }
        }
        return new Sequence(nodes, Stop.END_OF_INPUT);
    }

    private Node text(Scope scope) {
        int start = ctx.pos();
        // the first character is consumed unconditionally so a lone ']' or '[' forms a text run
        ctx.advance();
        while (!ctx.isAtEnd() && !isSpecial(ctx.peek(), scope)) {
            ctx.advance();
        }
        return leaf(NodeKind.TEXT, start, ctx.substring(start, ctx.pos()));
    }

    private static boolean isSpecial(char c, Scope scope) {
        return switch (c) {
            case '\\', '%', '$', '{', '}' -> true;
            case '[', ']' -> scope == Scope.OPTIONAL;
            default -> false;
        };
    }

    private Node comment() {
        int start = ctx.pos();
        ctx.advance();
        while (!ctx.isAtEnd() && ctx.peek() != '\n' && ctx.peek() != '\r') {
            ctx.advance();
        }
        return leaf(NodeKind.COMMENT, start, ctx.substring(start + 1, ctx.pos()));
    }

    private Node strayCloser() {
        int start = ctx.pos();
        ctx.addError(new ParseError.UnexpectedCloser(ctx.location(start), '}'));
        ctx.advance();
        return Node.builder(NodeKind.ERROR, ctx.spanFrom(start))
                   .content("}")
                   .attribute(Attribute.EXPECTED, "opening '{'")
                   .build();
    }

    // === Groups ===

    private Node group() {
        int start = ctx.pos();
        ctx.advance();
        var inner = sequence(Scope.GROUP);
        if (inner.stop() == Stop.CLOSE_BRACE) {
            ctx.advance();
        } else {
            ctx.addError(new ParseError.UnclosedGroup(ctx.location(start), '{'));
        }
        return Node.builder(NodeKind.GROUP, ctx.spanFrom(start))
                   .children(inner.nodes())
                   .build();
    }

    private Node optionalGroup() {
        int start = ctx.pos();
        ctx.advance();
        var inner = sequence(Scope.OPTIONAL);
        if (inner.stop() == Stop.CLOSE_BRACKET) {
            ctx.advance();
        } else {
            ctx.addError(new ParseError.UnclosedGroup(ctx.location(start), '['));
        }
        return Node.builder(NodeKind.GROUP, ctx.spanFrom(start))
                   .attribute(Attribute.OPTIONAL, true)
                   .children(inner.nodes())
                   .build();
    }

    /**
     * Brace group whose content is kept as one raw text child (URLs, verbatim arguments).
     */
    private Node verbatimGroup() {
        int start = ctx.pos();
        ctx.advance();
        int bodyStart = ctx.pos();
        int depth = 0;
        while (!ctx.isAtEnd()) {
            char c = ctx.peek();
            if (c == '\\' && ctx.peek(1) != '\0') {
                ctx.advance(2);
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) {
                    break;
                }
                depth--;
            }
            ctx.advance();
        }
        int bodyEnd = ctx.pos();
        if (ctx.at('}')) {
            ctx.advance();
        } else {
            ctx.addError(new ParseError.UnclosedGroup(ctx.location(start), '{'));
        }
        var builder = Node.builder(NodeKind.GROUP, ctx.spanFrom(start));
        if (bodyEnd > bodyStart) {
            builder.child(Node.builder(NodeKind.TEXT, ctx.span(bodyStart, bodyEnd))
                              .content(ctx.substring(bodyStart, bodyEnd))
                              .build());
        }
        return builder.build();
    }

    // === Math ===

    private Node dollarMath() {
        if (ctx.startsWith("$$")) {
            return math("$$", "$$", true);
        }
        return math("$", "$", false);
    }

    private Node math(String opener, String closer, boolean display) {
        int start = ctx.pos();
        int bodyStart = start + opener.length();
        int close = findUnescaped(closer, bodyStart);

        if (close < 0) {
            ctx.addError(new ParseError.UnterminatedMath(ctx.location(start), opener));
            ctx.setPos(bodyStart);
            return Node.builder(NodeKind.ERROR, ctx.spanFrom(start))
                       .content(opener)
                       .attribute(Attribute.EXPECTED, "closing '" + closer + "'")
                       .build();
        }
        ctx.setPos(close + closer.length());
        return Node.builder(NodeKind.MATH, ctx.spanFrom(start))
                   .content(ctx.substring(bodyStart, close))
                   .attribute(Attribute.DELIMITER, opener)
                   .attribute(Attribute.DISPLAY, display)
                   .build();
    }

    private int findUnescaped(String needle, int from) {
        int at = from;
        var input = ctx.input();
        while (at < input.length()) {
            if (input.charAt(at) == '\\') {
                if (input.startsWith(needle, at)) {
                    return at;
                }
                at += 2;
                continue;
            }
            if (input.startsWith(needle, at)) {
                return at;
            }
            at++;
        }
        return -1;
    }

    // === Macros ===

    private Node backslash() {
        int start = ctx.pos();

        if (ctx.peek(1) == '(') {
            return math("\\(", "\\)", false);
        }
        if (ctx.peek(1) == '[') {
            return math("\\[", "\\]", true);
        }
        if (!isMacroLetter(ctx.peek(1))) {
            return controlSymbol(start);
        }

        ctx.advance();
        while (!ctx.isAtEnd() && isMacroLetter(ctx.peek())) {
            ctx.advance();
        }
        var name = ctx.substring(start + 1, ctx.pos());

        if (name.equals("begin") && ctx.at('{')) {
            return environment(start);
        }
        if (name.equals("end") && ctx.at('{')) {
            return unmatchedEnd(start);
        }
        if (config.verbatimMacros().contains(name)) {
            return verbatimMacro(start, name);
        }
        return macro(start, name);
    }

    private static boolean isMacroLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private Node controlSymbol(int start) {
        ctx.advance();
        if (ctx.isAtEnd()) {
            return leaf(NodeKind.TEXT, start, "\\");
        }
        var symbol = String.valueOf(ctx.advance());
        return leaf(NodeKind.MACRO, start, symbol);
    }

    private Node macro(int start, String name) {
        var signature = config.macroSignatures().signature(name).orElse("");
        var citation = config.citationMacros().contains(name);
        var arguments = new ArrayList<Node>();
        var starred = false;

        for (char slot : signature.toCharArray()) {
            if (slot == 's') {
                if (ctx.at('*')) {
                    ctx.advance();
                    starred = true;
                }
                continue;
            }
            int resume = ctx.pos();
            skipArgumentSpace();
            if (slot == 'o' && ctx.at('[')) {
                arguments.add(optionalGroup());
            } else if (slot == 'm' && ctx.at('{')) {
                arguments.add(group());
            } else if (slot == 'v' && ctx.at('{')) {
                arguments.add(verbatimGroup());
            } else {
                ctx.setPos(resume);
                if (slot != 'o') {
                    break;
                }
            }
        }

        var builder = Node.builder(citation ? NodeKind.CITATION : NodeKind.MACRO, ctx.spanFrom(start))
                          .content(name)
                          .children(arguments);
        if (starred) {
            builder.attribute(Attribute.STARRED, true);
        }
        if (citation) {
            builder.attribute(Attribute.CITATION_KEYS, citationKeys(arguments));
        }
        return builder.build();
    }

    /**
     * Spaces and tabs, and at most one line break, may separate a macro from its argument.
     */
    private void skipArgumentSpace() {
        boolean sawNewline = false;
        while (!ctx.isAtEnd()) {
            char c = ctx.peek();
            if (c == ' ' || c == '\t') {
                ctx.advance();
            } else if (c == '\n' && !sawNewline) {
                sawNewline = true;
                ctx.advance();
            } else if (c == '\r' && ctx.peek(1) == '\n' && !sawNewline) {
                sawNewline = true;
                ctx.advance(2);
            } else {
                return;
            }
        }
    }

    private List<String> citationKeys(List<Node> arguments) {
        for (int i = arguments.size() - 1; i >= 0; i--) {
            var argument = arguments.get(i);
            if (argument.has(Attribute.OPTIONAL)) {
                continue;
            }
            var raw = ctx.substring(argument.start() + 1, Math.max(argument.start() + 1, argument.end() - 1));
            return Arrays.stream(raw.split(","))
                         .map(String::trim)
                         .filter(key -> !key.isEmpty())
                         .toList();
        }
        return List.of();
    }

    private Node verbatimMacro(int start, String name) {
        var starred = false;
        if (ctx.at('*')) {
            ctx.advance();
            starred = true;
        }

        var options = new ArrayList<Node>();
        if (ctx.at('[')) {
            options.add(optionalGroup());
        }

        char delimiter = ctx.isAtEnd() ? '\0' : ctx.peek();
        if (delimiter == '\0' || Character.isWhitespace(delimiter) || Character.isLetter(delimiter)) {
            // not a verbatim form after all
            return macroNode(start, name, starred, options);
        }

        char closer = delimiter == '{' ? '}' : delimiter;
        int bodyStart = ctx.pos() + 1;
        int close = bodyStart;
        while (close < ctx.length() && ctx.input().charAt(close) != closer && ctx.input().charAt(close) != '\n') {
            close++;
        }

        if (close >= ctx.length() || ctx.input().charAt(close) != closer) {
            ctx.addError(new ParseError.UnterminatedVerbatim(ctx.location(start), name, closer));
            ctx.advance();
            return Node.builder(NodeKind.ERROR, ctx.spanFrom(start))
                       .content(ctx.substring(start, ctx.pos()))
                       .attribute(Attribute.EXPECTED, "closing '" + closer + "'")
                       .build();
        }

        ctx.setPos(close + 1);
        var builder = Node.builder(NodeKind.MACRO, ctx.spanFrom(start))
                          .content(name)
                          .attribute(Attribute.VERBATIM, ctx.substring(bodyStart, close))
                          .attribute(Attribute.DELIMITER, String.valueOf(delimiter))
                          .children(options);
        if (starred) {
            builder.attribute(Attribute.STARRED, true);
        }
        return builder.build();
    }

    private Node macroNode(int start, String name, boolean starred, List<Node> children) {
        var builder = Node.builder(NodeKind.MACRO, ctx.spanFrom(start))
                          .content(name)
                          .children(children);
        if (starred) {
            builder.attribute(Attribute.STARRED, true);
        }
        return builder.build();
    }

    // === Environments ===

    private Node environment(int start) {
        int nameEnd = ctx.indexOf("}", ctx.pos());
        if (nameEnd < 0 || ctx.substring(ctx.pos() + 1, nameEnd).indexOf('\n') >= 0) {
            return macro(start, "begin");
        }
        var name = ctx.substring(ctx.pos() + 1, nameEnd).trim();
        ctx.setPos(nameEnd + 1);
        int bodyStart = ctx.pos();

        if (config.verbatimEnvironments().contains(name)) {
            return verbatimEnvironment(start, name, bodyStart);
        }

        environments.push(name);
        openers.push(ctx.span(start, bodyStart));
        var body = sequence(Scope.ENVIRONMENT);
        openers.pop();
        environments.pop();
        int bodyEnd = ctx.pos();

        if (body.stop() == Stop.END_ENVIRONMENT && name.equals(endName())) {
            ctx.setPos(ctx.indexOf("}", ctx.pos()) + 1);
        } else {
            ctx.addError(new ParseError.UnterminatedEnvironment(ctx.location(start), name));
        }
        return environmentNode(start, name, bodyStart, bodyEnd, body.nodes());
    }

    private Node verbatimEnvironment(int start, String name, int bodyStart) {
        var terminator = END + name + "}";
        int bodyEnd = ctx.indexOf(terminator, bodyStart);
        var body = new ArrayList<Node>();

        if (bodyEnd < 0) {
            ctx.addError(new ParseError.UnterminatedEnvironment(ctx.location(start), name));
            bodyEnd = ctx.length();
            ctx.setPos(bodyEnd);
        } else {
            ctx.setPos(bodyEnd + terminator.length());
        }
        if (bodyEnd > bodyStart) {
            body.add(Node.builder(NodeKind.TEXT, ctx.span(bodyStart, bodyEnd))
                         .content(ctx.substring(bodyStart, bodyEnd))
                         .build());
        }
        return environmentNode(start, name, bodyStart, bodyEnd, body);
    }

    private Node environmentNode(int start, String name, int bodyStart, int bodyEnd, List<Node> body) {
        return Node.builder(NodeKind.ENVIRONMENT, ctx.spanFrom(start))
                   .content(name)
                   .attribute(Attribute.ENVIRONMENT_NAME, name)
                   .attribute(Attribute.BODY_SPAN, ctx.span(bodyStart, bodyEnd))
                   .children(body)
                   .build();
    }

    /**
     * Name in the {@code \end{...}} at the cursor, or an empty string when it is malformed.
     */
    private String endName() {
        int nameStart = ctx.pos() + END.length();
        int nameEnd = ctx.indexOf("}", nameStart);
        if (nameEnd < 0) {
            return "";
        }
        var name = ctx.substring(nameStart, nameEnd);
        return name.indexOf('\n') >= 0 ? "" : name.trim();
    }

    private boolean closesOpenEnvironment() {
        var name = endName();
        return !name.isEmpty() && environments.contains(name);
    }

    /**
     * {@code \end{name}} that closes no open environment. The cursor sits after {@code \end}.
     */
    private Node unmatchedEnd(int start) {
        ctx.setPos(start);
        var name = endName();
        int close = ctx.indexOf("}", start + END.length());
        if (name.isEmpty() || close < 0) {
            ctx.setPos(start + "\\end".length());
            return macro(start, "end");
        }
        var expected = environments.isEmpty() ? "" : environments.peek();
        var error = new ParseError.MismatchedEnvironment(ctx.location(start), expected, name);
        if (expected.isEmpty()) {
            ctx.addError(error);
        } else {
            ctx.addError(error, openers.peek(), "'" + expected + "' opened here");
        }
        ctx.setPos(close + 1);
        return Node.builder(NodeKind.ERROR, ctx.spanFrom(start))
                   .content(ctx.substring(start, ctx.pos()))
                   .attribute(Attribute.EXPECTED, expected.isEmpty() ? "no \\end" : "\\end{" + expected + "}")
                   .build();
    }

    private Node leaf(NodeKind kind, int start, String content) {
        return Node.builder(kind, ctx.spanFrom(start))
                   .content(content)
                   .build();
    }
}
