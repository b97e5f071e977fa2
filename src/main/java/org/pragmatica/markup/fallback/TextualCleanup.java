package org.pragmatica.markup.fallback;

import org.pragmatica.markup.transform.PassConfig;
import org.pragmatica.markup.transform.pass.HeadingCleanupPass;
import org.pragmatica.markup.transform.pass.LinkToCitationPass;
import org.pragmatica.markup.tree.Dialect;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Pattern-based version of the tree passes for text that could not be parsed.
 *
 * <p>Patterns only match constructs without nested braces, so anything ambiguous is left
 * alone. The result is the input itself when no pattern applies.
 */
public final class TextualCleanup {
    private static final Pattern HEADING_MARKERS = Pattern.compile("^(#+)(\\s*)(.*)$");

    private final PassConfig config;
    private final LinkToCitationPass citations;
    private final Pattern shorthand;
    private final Pattern bracedShorthand;
    private final Pattern nestedEmphasis;
    private final Pattern emptyCaption;
    private final Pattern link;

    public TextualCleanup(PassConfig config) {
        this.config = config;
        this.citations = new LinkToCitationPass(config);

        var wrappers = alternatives(config.shorthandWrappers());
        var shorthands = alternatives(config.verbatimShorthands());
        var emphasis = alternatives(config.emphasisMacros());
        this.shorthand = Pattern.compile("\\\\(?:" + wrappers + ")\\{\\\\(?:" + shorthands + ")\\*?"
                                         + "([^A-Za-z\\s{}\\[*])(.*?)\\1\\}");
        this.bracedShorthand = Pattern.compile("\\\\(?:" + wrappers + ")\\{\\\\(?:" + shorthands + ")\\{([^{}]*)\\}\\}");
        this.nestedEmphasis = Pattern.compile("\\\\(" + emphasis + ")\\{([^{}]*)\\\\(?:" + emphasis + ")\\{([^{}]*)\\}([^{}]*)\\}");
        this.emptyCaption = Pattern.compile("\\\\(" + alternatives(config.captionMacros()) + ")(\\[[^\\]]*\\])?\\{\\s*\\}");
        this.link = Pattern.compile("\\\\(?:" + alternatives(config.linkMacros()) + ")\\{([^{}]+)\\}\\{([^{}]+)\\}");
    }

    /**
     * Cleaned text and the fixes that produced it.
     */
    public record Cleaned(String text, List<String> fixes) {
        public Cleaned {
            fixes = List.copyOf(fixes);
        }
    }

    public Cleaned apply(String text, Dialect dialect) {
        var fixes = new ArrayList<String>();
        var result = text;

        if (dialect == Dialect.MARKUP) {
            result = replace(result, shorthand, match -> "\\" + config.typewriterMacro() + "{" + match.group(2) + "}",
                             "Fixed passthrough command", fixes);
            result = replace(result, bracedShorthand, match -> "\\" + config.typewriterMacro() + "{" + match.group(1) + "}",
                             "Fixed passthrough command", fixes);
            result = replace(result, nestedEmphasis,
                             match -> "\\" + match.group(1) + "{" + match.group(2) + "{" + match.group(3) + "}" + match.group(4) + "}",
                             "Fixed nested emphasis", fixes);
            result = replace(result, emptyCaption,
                             match -> "\\" + match.group(1) + (match.group(2) == null ? "" : match.group(2)) + "{~}",
                             "Removed empty caption", fixes);
            result = promoteLinks(result, fixes);
        } else if (dialect == Dialect.BLOCK_MARKUP) {
            result = cleanHeadings(result, fixes);
        }

        if (config.collapseBlankLines()) {
            var collapsed = collapseBlankLines(result);
            if (!collapsed.equals(result)) {
                fixes.add("Cleaned excessive line breaks");
                result = collapsed;
            }
        }
        return new Cleaned(result, fixes);
    }

    private interface Rewrite {
        String apply(Matcher match);
    }

    private static String replace(String text, Pattern pattern, Rewrite rewrite, String fix, List<String> fixes) {
        var matcher = pattern.matcher(text);
        var out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(rewrite.apply(matcher)));
            fixes.add(fix);
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String promoteLinks(String text, List<String> fixes) {
        var matcher = link.matcher(text);
        var out = new StringBuilder();
        while (matcher.find()) {
            var url = matcher.group(1).trim();
            var anchor = matcher.group(2);
            if (!citations.isAcademic(url) || LinkToCitationPass.year(anchor).isEmpty()) {
                matcher.appendReplacement(out, Matcher.quoteReplacement(matcher.group()));
                continue;
            }
            var key = LinkToCitationPass.citationKey(anchor);
            matcher.appendReplacement(out, Matcher.quoteReplacement("\\" + config.citationMacro() + "{" + key + "}"));
            fixes.add("Converted href to citation: " + key);
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Heading lines lose strong markers and leading section numbers; the spacing after the
     * markers is kept.
     */
    private static String cleanHeadings(String text, List<String> fixes) {
        var lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            var matcher = HEADING_MARKERS.matcher(lines[i]);
            if (!matcher.matches()) {
                continue;
            }
            var content = matcher.group(3).replace("**", "").replace("\\.", ".");
            content = HeadingCleanupPass.stripSectionNumber(content).stripTrailing();
            var cleaned = matcher.group(1) + matcher.group(2) + content;
            if (!cleaned.equals(lines[i])) {
                lines[i] = cleaned;
                fixes.add("Cleaned heading: " + content);
            }
        }
        return String.join("\n", lines);
    }

    /**
     * Keep at most two consecutive blank lines.
     */
    public static String collapseBlankLines(String text) {
        var lines = text.split("\n", -1);
        var kept = new ArrayList<String>(lines.length);
        int blanks = 0;
        for (var line : lines) {
            if (line.isBlank()) {
                blanks++;
                if (blanks <= 2) {
                    kept.add(line);
                }
            } else {
                blanks = 0;
                kept.add(line);
            }
        }
        return String.join("\n", kept);
    }

    private static String alternatives(Collection<String> names) {
        return new TreeSet<>(names).stream()
                                   .map(Pattern::quote)
                                   .collect(Collectors.joining("|"));
    }
}
