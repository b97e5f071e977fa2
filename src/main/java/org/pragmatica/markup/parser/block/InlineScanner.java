package org.pragmatica.markup.parser.block;

import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.LineIndex;
import org.pragmatica.markup.tree.Node;
import org.pragmatica.markup.tree.NodeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Inline-level scanner for block markup: code spans, emphasis, links, images, autolinks,
 * bracketed citations and inline math. Anything it does not recognize stays text, so
 * inline scanning never fails.
 */
final class InlineScanner {
    private static final Pattern CITATION_KEY = Pattern.compile("(?:^|[\\s;\\[-])@([\\w:.#$%&+?<>~/-]+)");

    private final String input;
    private final LineIndex lineIndex;

    InlineScanner(String input, LineIndex lineIndex) {
        this.input = input;
        this.lineIndex = lineIndex;
    }

    /**
     * Scan {@code [from, to)} into inline nodes.
     */
    List<Node> scan(int from, int to) {
        var nodes = new ArrayList<Node>();
        int textStart = from;
        int pos = from;

        while (pos < to) {
            char c = input.charAt(pos);

            if (c == '\\' && pos + 1 < to) {
                pos += 2;
                continue;
            }

            Node node = switch (c) {
                case '`' -> codeSpan(pos, to);
                case '*', '_' -> emphasis(pos, to);
                case '!' -> pos + 1 < to && input.charAt(pos + 1) == '[' ? image(pos, to) : null;
                case '[' -> bracket(pos, to);
                case '<' -> autolink(pos, to);
                case '$' -> math(pos, to);
                default -> null;
            };

            if (node == null) {
                pos++;
                continue;
            }
            if (pos > textStart) {
                nodes.add(text(textStart, pos));
            }
            nodes.add(node);
            pos = node.end();
            textStart = pos;
        }
        if (to > textStart) {
            nodes.add(text(textStart, to));
        }
        return nodes;
    }

    private Node text(int start, int end) {
        return Node.builder(NodeKind.TEXT, lineIndex.span(start, end))
                   .content(input.substring(start, end))
                   .build();
    }

    // === Code and math ===

    private Node codeSpan(int start, int to) {
        int run = runLength(start, to, '`');
        var fence = "`".repeat(run);
        int search = start + run;
        while (search < to) {
            int close = input.indexOf(fence, search);
            if (close < 0 || close + run > to) {
                return null;
            }
            int closeRun = runLength(close, to, '`');
            if (closeRun == run) {
                return Node.builder(NodeKind.CODE_INLINE, lineIndex.span(start, close + run))
                           .content(input.substring(start + run, close))
                           .attribute(Attribute.DELIMITER, fence)
                           .build();
            }
            search = close + closeRun;
        }
        return null;
    }

    private Node math(int start, int to) {
        int bodyStart = start + 1;
        if (bodyStart >= to || Character.isWhitespace(input.charAt(bodyStart)) || input.charAt(bodyStart) == '$') {
            return null;
        }
        for (int at = bodyStart; at < to; at++) {
            char c = input.charAt(at);
            if (c == '\\') {
                at++;
            } else if (c == '$' && !Character.isWhitespace(input.charAt(at - 1))) {
                return Node.builder(NodeKind.MATH, lineIndex.span(start, at + 1))
                           .content(input.substring(bodyStart, at))
                           .attribute(Attribute.DELIMITER, "$")
                           .attribute(Attribute.DISPLAY, false)
                           .build();
            }
        }
        return null;
    }

    // === Emphasis ===

    private Node emphasis(int start, int to) {
        char marker = input.charAt(start);
        int run = Math.min(runLength(start, to, marker), 2);
        var delimiter = String.valueOf(marker).repeat(run);
        int bodyStart = start + run;

        if (bodyStart >= to || Character.isWhitespace(input.charAt(bodyStart))) {
            return null;
        }
        if (marker == '_' && start > 0 && Character.isLetterOrDigit(input.charAt(start - 1))) {
            return null;
        }

        int close = findCloser(delimiter, bodyStart, to);
        if (close < 0) {
            return run == 2 ? emphasisFallback(start, to, marker) : null;
        }
        var kind = run == 2 ? NodeKind.STRONG : NodeKind.EMPHASIS;
        return Node.builder(kind, lineIndex.span(start, close + run))
                   .content(input.substring(bodyStart, close))
                   .attribute(Attribute.DELIMITER, delimiter)
                   .children(scan(bodyStart, close))
                   .build();
    }

    /**
     * A doubled marker without a doubled closer may still open single emphasis ({@code **a*}).
     */
    private Node emphasisFallback(int start, int to, char marker) {
        int bodyStart = start + 1;
        int close = findCloser(String.valueOf(marker), bodyStart + 1, to);
        if (close < 0) {
            return null;
        }
        return Node.builder(NodeKind.EMPHASIS, lineIndex.span(start, close + 1))
                   .content(input.substring(bodyStart, close))
                   .attribute(Attribute.DELIMITER, String.valueOf(marker))
                   .children(scan(bodyStart, close))
                   .build();
    }

    private int findCloser(String delimiter, int from, int to) {
        char marker = delimiter.charAt(0);
        int at = from;
        while (at < to) {
            char c = input.charAt(at);
            if (c == '\\') {
                at += 2;
                continue;
            }
            if (c == '`') {
                var code = codeSpan(at, to);
                if (code != null) {
                    at = code.end();
                    continue;
                }
            }
            if (c == marker) {
                int run = runLength(at, to, marker);
                boolean precededBySpace = Character.isWhitespace(input.charAt(at - 1));
                if (!precededBySpace && at > from && run >= delimiter.length()) {
                    if (delimiter.length() == 1 && run == 2) {
                        // a strong span nested inside emphasis
                        int inner = findCloser(delimiter + delimiter, at + 2, to);
                        if (inner > 0) {
                            at = inner + 2;
                            continue;
                        }
                    }
                    return at;
                }
                at += run;
                continue;
            }
            at++;
        }
        return -1;
    }

    // === Links, images, citations ===

    private Node bracket(int start, int to) {
        int close = matchingBracket(start, to);
        if (close < 0) {
            return null;
        }
        if (close + 1 < to && input.charAt(close + 1) == '(') {
            return link(start, close, to);
        }
        return citation(start, close);
    }

    private Node link(int start, int close, int to) {
        var target = destination(close + 1, to);
        if (target == null) {
            return null;
        }
        var builder = Node.builder(NodeKind.LINK, lineIndex.span(start, target.end()))
                          .content(input.substring(start + 1, close))
                          .attribute(Attribute.HREF, target.href())
                          .children(scan(start + 1, close));
        if (!target.title().isEmpty()) {
            builder.attribute(Attribute.TITLE, target.title());
        }
        return builder.build();
    }

    private Node image(int start, int to) {
        int close = matchingBracket(start + 1, to);
        if (close < 0 || close + 1 >= to || input.charAt(close + 1) != '(') {
            return null;
        }
        var target = destination(close + 1, to);
        if (target == null) {
            return null;
        }
        var alt = input.substring(start + 2, close);
        var builder = Node.builder(NodeKind.IMAGE, lineIndex.span(start, target.end()))
                          .content(alt)
                          .attribute(Attribute.SRC, target.href())
                          .attribute(Attribute.ALT, alt);
        if (!target.title().isEmpty()) {
            builder.attribute(Attribute.TITLE, target.title());
        }
        return builder.build();
    }

    private Node citation(int start, int close) {
        var inner = input.substring(start + 1, close);
        var matcher = CITATION_KEY.matcher(inner);
        var keys = new ArrayList<String>();
        while (matcher.find()) {
            keys.add(stripTrailingPunctuation(matcher.group(1)));
        }
        if (keys.isEmpty()) {
            return null;
        }
        return Node.builder(NodeKind.CITATION, lineIndex.span(start, close + 1))
                   .content(inner)
                   .attribute(Attribute.CITATION_KEYS, List.copyOf(keys))
                   .build();
    }

    private static String stripTrailingPunctuation(String key) {
        int end = key.length();
        while (end > 0 && ".,:;".indexOf(key.charAt(end - 1)) >= 0) {
            end--;
        }
        return key.substring(0, end);
    }

    private Node autolink(int start, int to) {
        int close = input.indexOf('>', start);
        if (close < 0 || close >= to) {
            return null;
        }
        var url = input.substring(start + 1, close);
        int scheme = url.indexOf("://");
        boolean mail = url.startsWith("mailto:");
        if ((scheme <= 0 && !mail) || url.chars().anyMatch(Character::isWhitespace)) {
            return null;
        }
        return Node.builder(NodeKind.LINK, lineIndex.span(start, close + 1))
                   .content(url)
                   .attribute(Attribute.HREF, url)
                   .build();
    }

    private record Destination(String href, String title, int end) {}

    /**
     * Parse {@code (href "title")} starting at the opening parenthesis.
     */
    private Destination destination(int open, int to) {
        int depth = 0;
        int at = open;
        while (at < to) {
            char c = input.charAt(at);
            if (c == '\\') {
                at += 2;
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    break;
                }
            }
            at++;
        }
        if (at >= to) {
            return null;
        }
        var inside = input.substring(open + 1, at).trim();
        var href = inside;
        var title = "";
        int space = firstWhitespace(inside);
        if (space > 0) {
            var rest = inside.substring(space).trim();
            if (rest.length() >= 2 && (rest.startsWith("\"") || rest.startsWith("'"))
                && rest.charAt(rest.length() - 1) == rest.charAt(0)) {
                href = inside.substring(0, space);
                title = rest.substring(1, rest.length() - 1);
            }
        }
        if (href.startsWith("<") && href.endsWith(">")) {
            href = href.substring(1, href.length() - 1);
        }
        return new Destination(href, title, at + 1);
    }

    private static int firstWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private int matchingBracket(int open, int to) {
        int depth = 0;
        for (int at = open; at < to; at++) {
            char c = input.charAt(at);
            if (c == '\\') {
                at++;
            } else if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth == 0) {
                    return at;
                }
            }
        }
        return -1;
    }

    private int runLength(int start, int to, char c) {
        int end = start;
        while (end < to && input.charAt(end) == c) {
            end++;
        }
        return end - start;
    }
}
