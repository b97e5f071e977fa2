package org.pragmatica.markup.parser.block;

import org.pragmatica.markup.parser.ParsingContext;
import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.LineIndex;
import org.pragmatica.markup.tree.Node;
import org.pragmatica.markup.tree.NodeKind;
import org.pragmatica.markup.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented block scanner. Every block span runs from the start of its first line to the
 * end of its last line, line break excluded; blank lines and line breaks stay between blocks.
 */
final class BlockScanner {
    private static final Pattern ATX_HEADING = Pattern.compile("^ {0,3}(#{1,6})(?:[ \\t]+|$)");
    private static final Pattern CLOSING_HASHES = Pattern.compile("[ \\t]+#+[ \\t]*$");
    private static final Pattern FENCE = Pattern.compile("^ {0,3}(`{3,}|~{3,})(.*)$");
    private static final Pattern THEMATIC_BREAK = Pattern.compile("^ {0,3}([-*_])(?:[ \\t]*\\1){2,}[ \\t]*$");
    private static final Pattern BULLET = Pattern.compile("^( {0,3})([-*+])([ \\t]+|$)");
    private static final Pattern ORDERED = Pattern.compile("^( {0,3})(\\d{1,9})([.)])([ \\t]+|$)");
    private static final Pattern BLOCKQUOTE = Pattern.compile("^ {0,3}> ?");
    private static final Pattern HTML_OPEN = Pattern.compile("^ {0,3}<(?:[A-Za-z][A-Za-z0-9-]*|/[A-Za-z]|!--|!)");
    private static final Pattern TABLE_DELIMITER =
        Pattern.compile("^ {0,3}\\|?[ \\t]*:?-+:?[ \\t]*(?:\\|[ \\t]*:?-+:?[ \\t]*)*\\|?[ \\t]*$");

    private final ParsingContext ctx;
    private final String input;
    private final LineIndex lines;
    private final InlineScanner inline;
    private final int lineCount;

    BlockScanner(ParsingContext ctx) {
        this.ctx = ctx;
        this.input = ctx.input();
        this.lines = ctx.lineIndex();
        this.inline = new InlineScanner(input, lines);
        // a trailing newline does not open another line
        this.lineCount = input.endsWith("\n") ? lines.lineCount() - 1 : lines.lineCount();
    }

    List<Node> scanDocument() {
        var blocks = new ArrayList<Node>();
        int line = 1;
        while (line <= lineCount) {
            if (isBlank(line)) {
                line++;
                continue;
            }
            var block = block(line);
            blocks.add(block.node());
            line = block.nextLine();
        }
        return blocks;
    }

    private record Block(Node node, int nextLine) {}

    private Block block(int line) {
        var text = text(line);

        var fence = FENCE.matcher(text);
        if (fence.matches() && !(fence.group(1).charAt(0) == '`' && fence.group(2).contains("`"))) {
            return fencedCode(line, fence);
        }
        var heading = ATX_HEADING.matcher(text);
        if (heading.find()) {
            return heading(line, heading);
        }
        if (THEMATIC_BREAK.matcher(text).matches()) {
            return new Block(leaf(NodeKind.THEMATIC_BREAK, line, line, text.trim()), line + 1);
        }
        if (text.trim().startsWith("$$")) {
            var math = displayMath(line);
            if (math != null) {
                return math;
            }
        }
        if (HTML_OPEN.matcher(text).find() && !isAutolinkLine(text)) {
            return html(line);
        }
        if (BLOCKQUOTE.matcher(text).find()) {
            return blockquote(line);
        }
        if (BULLET.matcher(text).find() || ORDERED.matcher(text).find()) {
            return list(line);
        }
        if (isIndentedCode(text)) {
            return indentedCode(line);
        }
        if (text.contains("|") && line < lineCount && TABLE_DELIMITER.matcher(text(line + 1)).matches()) {
            return table(line);
        }
        return paragraph(line);
    }

    // === Leaf blocks ===

    private Block heading(int line, Matcher matcher) {
        int level = matcher.group(1).length();
        int contentStart = lines.lineStart(line) + matcher.end();
        int contentEnd = lineContentEnd(line);

        var closing = CLOSING_HASHES.matcher(input.substring(contentStart, contentEnd));
        if (closing.find()) {
            contentEnd = contentStart + closing.start();
        }
        while (contentEnd > contentStart && Character.isWhitespace(input.charAt(contentEnd - 1))) {
            contentEnd--;
        }

        var node = Node.builder(NodeKind.HEADING, lineSpan(line, line))
                       .content(input.substring(contentStart, contentEnd))
                       .attribute(Attribute.LEVEL, level)
                       .children(inline.scan(contentStart, contentEnd))
                       .build();
        return new Block(node, line + 1);
    }

    private Block fencedCode(int line, Matcher opener) {
        var fence = opener.group(1);
        var info = opener.group(2).trim();
        var language = info.isEmpty() ? "" : info.split("\\s+")[0];

        int last = line + 1;
        while (last <= lineCount && !closesFence(text(last), fence)) {
            last++;
        }

        boolean terminated = last <= lineCount;
        int endLine = terminated ? last : lineCount;
        int codeStart = line < lineCount ? lines.lineStart(line + 1) : lineContentEnd(line);
        int codeEnd = Math.max(codeStart, terminated ? lines.lineStart(last) - 1 : lineContentEnd(lineCount));
        if (!terminated) {
            ctx.addWarning("Unterminated code fence '" + fence + "', block runs to end of input",
                           lines.lineStart(line), lineContentEnd(line), "close the block with a " + fence + " line");
        }

        var node = Node.builder(NodeKind.CODE_BLOCK, lineSpan(line, endLine))
                       .content(codeStart < codeEnd ? input.substring(codeStart, codeEnd) : "")
                       .attribute(Attribute.DELIMITER, fence)
                       .attribute(Attribute.LANGUAGE, language)
                       .build();
        return new Block(node, endLine + 1);
    }

    private static boolean closesFence(String text, String fence) {
        var trimmed = text.trim();
        if (trimmed.length() < fence.length() || text.length() - text.stripLeading().length() > 3) {
            return false;
        }
        for (int i = 0; i < trimmed.length(); i++) {
            if (trimmed.charAt(i) != fence.charAt(0)) {
                return false;
            }
        }
        return true;
    }

    private Block indentedCode(int line) {
        int last = line;
        int next = line + 1;
        while (next <= lineCount && (isBlank(next) || isIndentedCode(text(next)))) {
            if (!isBlank(next)) {
                last = next;
            }
            next++;
        }

        var code = new StringBuilder();
        for (int current = line; current <= last; current++) {
            if (current > line) {
                code.append('\n');
            }
            code.append(stripIndent(text(current), 4));
        }
        var node = Node.builder(NodeKind.CODE_BLOCK, lineSpan(line, last))
                       .content(code.toString())
                       .attribute(Attribute.DELIMITER, "")
                       .attribute(Attribute.LANGUAGE, "")
                       .build();
        return new Block(node, last + 1);
    }

    private static boolean isIndentedCode(String text) {
        return (text.startsWith("    ") || text.startsWith("\t")) && !text.isBlank();
    }

    private Block displayMath(int line) {
        int open = lines.lineStart(line) + text(line).indexOf("$$");
        int close = input.indexOf("$$", open + 2);
        if (close < 0) {
            return null;
        }
        int endLine = lines.location(close).line();
        if (!input.substring(close + 2, lineContentEnd(endLine)).isBlank()) {
            return null;
        }
        var node = Node.builder(NodeKind.MATH, lineSpan(line, endLine))
                       .content(input.substring(open + 2, close))
                       .attribute(Attribute.DELIMITER, "$$")
                       .attribute(Attribute.DISPLAY, true)
                       .build();
        return new Block(node, endLine + 1);
    }

    private Block html(int line) {
        int last = line;
        while (last < lineCount && !isBlank(last + 1)) {
            last++;
        }
        var node = leaf(NodeKind.HTML, line, last, input.substring(lines.lineStart(line), lineContentEnd(last)));
        return new Block(node, last + 1);
    }

    private static boolean isAutolinkLine(String text) {
        var trimmed = text.trim();
        return trimmed.startsWith("<http://") || trimmed.startsWith("<https://") || trimmed.startsWith("<mailto:");
    }

    // === Container blocks ===

    private Block blockquote(int line) {
        int last = line;
        while (last < lineCount && BLOCKQUOTE.matcher(text(last + 1)).find()) {
            last++;
        }

        var children = new ArrayList<Node>();
        var content = new StringBuilder();
        for (int current = line; current <= last; current++) {
            var marker = BLOCKQUOTE.matcher(text(current));
            marker.find();
            int from = lines.lineStart(current) + marker.end();
            int to = lineContentEnd(current);
            children.addAll(inline.scan(from, to));
            if (current > line) {
                content.append('\n');
            }
            content.append(input, from, to);
        }

        var node = Node.builder(NodeKind.BLOCKQUOTE, lineSpan(line, last))
                       .content(content.toString())
                       .attribute(Attribute.MARKER, ">")
                       .children(children)
                       .build();
        return new Block(node, last + 1);
    }

    private record ItemMarker(String marker, boolean ordered, int number, char delimiter, int contentOffset) {}

    private ItemMarker itemMarker(String text) {
        var bullet = BULLET.matcher(text);
        if (bullet.find()) {
            return new ItemMarker(bullet.group(2), false, 0, bullet.group(2).charAt(0), bullet.end());
        }
        var ordered = ORDERED.matcher(text);
        if (ordered.find()) {
            return new ItemMarker(ordered.group(2) + ordered.group(3), true,
                                  Integer.parseInt(ordered.group(2)), ordered.group(3).charAt(0), ordered.end());
        }
        return null;
    }

    private Block list(int line) {
        var first = itemMarker(text(line));
        var items = new ArrayList<Node>();
        int current = line;
        int last = line;

        while (current <= lineCount) {
            var marker = itemMarker(text(current));
            if (marker == null || marker.ordered() != first.ordered() || marker.delimiter() != first.delimiter()) {
                break;
            }
            int itemLast = itemEnd(current);
            int contentStart = lines.lineStart(current) + marker.contentOffset();
            int contentEnd = lineContentEnd(itemLast);
            items.add(Node.builder(NodeKind.LIST_ITEM, lineSpan(current, itemLast))
                          .content(contentStart < contentEnd ? input.substring(contentStart, contentEnd) : "")
                          .attribute(Attribute.MARKER, marker.marker())
                          .children(inline.scan(contentStart, Math.max(contentStart, contentEnd)))
                          .build());
            last = itemLast;
            current = itemLast + 1;
            // a single blank line between items keeps the list going
            if (current < lineCount && isBlank(current) && itemMarker(text(current + 1)) != null) {
                current++;
            }
        }

        var builder = Node.builder(NodeKind.LIST, lineSpan(line, last))
                          .content(first.ordered() ? "ordered_list" : "bullet_list")
                          .attribute(Attribute.LIST_ORDERED, first.ordered())
                          .children(items);
        if (first.ordered()) {
            builder.attribute(Attribute.LIST_START, first.number());
        }
        return new Block(builder.build(), last + 1);
    }

    /**
     * Last line of the item starting at {@code line}: continuation lines are indented,
     * or plain text continuing the item paragraph.
     */
    private int itemEnd(int line) {
        int last = line;
        int next = line + 1;
        while (next <= lineCount) {
            if (isBlank(next)) {
                if (next < lineCount && isIndented(text(next + 1))) {
                    next++;
                    continue;
                }
                break;
            }
            var text = text(next);
            if (itemMarker(text) != null && !isIndented(text)) {
                break;
            }
            if (!isIndented(text) && (isBlank(next - 1) || startsBlock(text))) {
                break;
            }
            last = next;
            next++;
        }
        return last;
    }

    private static boolean isIndented(String text) {
        return text.startsWith("  ") || text.startsWith("\t");
    }

    private Block table(int line) {
        var delimiterLine = text(line + 1);
        var alignments = new ArrayList<String>();
        for (var cell : splitRow(delimiterLine)) {
            var alignment = cell.trim();
            boolean left = alignment.startsWith(":");
            boolean right = alignment.endsWith(":");
            alignments.add(left && right ? "center" : right ? "right" : left ? "left" : "");
        }

        var rows = new ArrayList<Node>();
        rows.add(row(line, true));
        int last = line + 1;
        while (last < lineCount && !isBlank(last + 1) && text(last + 1).contains("|")) {
            last++;
            rows.add(row(last, false));
        }

        var node = Node.builder(NodeKind.TABLE, lineSpan(line, last))
                       .content("table")
                       .attribute(Attribute.TABLE_ALIGNMENTS, List.copyOf(alignments))
                       .children(rows)
                       .build();
        return new Block(node, last + 1);
    }

    private Node row(int line, boolean header) {
        int lineStart = lines.lineStart(line);
        int lineEnd = lineContentEnd(line);
        var cells = new ArrayList<Node>();

        int cellStart = lineStart;
        while (cellStart < lineEnd && Character.isWhitespace(input.charAt(cellStart))) {
            cellStart++;
        }
        if (cellStart < lineEnd && input.charAt(cellStart) == '|') {
            cellStart++;
        }
        int at = cellStart;
        while (at <= lineEnd) {
            boolean boundary = at == lineEnd || (input.charAt(at) == '|' && (at == lineStart || input.charAt(at - 1) != '\\'));
            if (boundary) {
                int from = cellStart;
                int to = at;
                while (from < to && Character.isWhitespace(input.charAt(from))) {
                    from++;
                }
                while (to > from && Character.isWhitespace(input.charAt(to - 1))) {
                    to--;
                }
                boolean trailingEmpty = at == lineEnd && from == to;
                if (!trailingEmpty) {
                    cells.add(Node.builder(NodeKind.TABLE_CELL, lines.span(from, to))
                                  .content(input.substring(from, to))
                                  .children(inline.scan(from, to))
                                  .build());
                }
                cellStart = at + 1;
            }
            at++;
        }

        return Node.builder(NodeKind.TABLE_ROW, lineSpan(line, line))
                   .content(text(line).trim())
                   .attribute(Attribute.HEADER, header)
                   .children(cells)
                   .build();
    }

    private static List<String> splitRow(String text) {
        var trimmed = text.trim();
        if (trimmed.startsWith("|")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.endsWith("|")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return List.of(trimmed.split("\\|", -1));
    }

    private Block paragraph(int line) {
        int last = line;
        while (last < lineCount && !isBlank(last + 1) && !startsBlock(text(last + 1))) {
            last++;
        }
        int from = lines.lineStart(line);
        int to = lineContentEnd(last);
        var node = Node.builder(NodeKind.PARAGRAPH, lineSpan(line, last))
                       .content(input.substring(from, to))
                       .children(inline.scan(from, to))
                       .build();
        return new Block(node, last + 1);
    }

    /**
     * Lines that interrupt a running paragraph.
     */
    private boolean startsBlock(String text) {
        return ATX_HEADING.matcher(text).find()
               || FENCE.matcher(text).matches()
               || THEMATIC_BREAK.matcher(text).matches()
               || BLOCKQUOTE.matcher(text).find()
               || (BULLET.matcher(text).find() && !text.trim().equals("-"))
               || ORDERED.matcher(text).find()
               || text.trim().startsWith("$$");
    }

    // === Lines ===

    private String text(int line) {
        return input.substring(lines.lineStart(line), lineContentEnd(line));
    }

    /**
     * End of line content, excluding {@code \r} of a CRLF break.
     */
    private int lineContentEnd(int line) {
        int end = lines.lineEnd(line);
        if (end > lines.lineStart(line) && input.charAt(end - 1) == '\r') {
            end--;
        }
        return end;
    }

    private boolean isBlank(int line) {
        return text(line).isBlank();
    }

    private SourceSpan lineSpan(int firstLine, int lastLine) {
        return lines.span(lines.lineStart(firstLine), lineContentEnd(lastLine));
    }

    private Node leaf(NodeKind kind, int firstLine, int lastLine, String content) {
        return Node.builder(kind, lineSpan(firstLine, lastLine))
                   .content(content)
                   .build();
    }

    private static String stripIndent(String text, int columns) {
        int at = 0;
        int width = 0;
        while (at < text.length() && width < columns) {
            char c = text.charAt(at);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = columns;
            } else {
                break;
            }
            at++;
        }
        return text.substring(at);
    }
}
