package org.pragmatica.markup.transform.pass;

import org.pragmatica.markup.transform.Fix;
import org.pragmatica.markup.transform.NodeWalker;
import org.pragmatica.markup.transform.Pass;
import org.pragmatica.markup.transform.PassConfig;
import org.pragmatica.markup.transform.PassId;
import org.pragmatica.markup.transform.PassResult;
import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.Document;
import org.pragmatica.markup.tree.NodeKind;
import org.pragmatica.markup.tree.Siblings;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Promotes {@code \href{url}{Author 2020}} to {@code \citep{Author2020}} when the URL points at
 * an academic publisher and the anchor text carries a year between 1900 and 2099.
 */
public final class LinkToCitationPass implements Pass {
    private static final String TOKEN_PUNCTUATION = "()[]{},.;:";
    static final String UNKNOWN_KEY = "unknown";

    private final PassConfig config;

    public LinkToCitationPass(PassConfig config) {
        this.config = config;
    }

    @Override
    public PassId id() {
        return PassId.LINK_TO_CITATION;
    }

    @Override
    public PassResult apply(Document document) {
        var fixes = new ArrayList<Fix>();
        NodeWalker.walk(document, (siblings, index) -> promote(siblings, index, fixes));
        return new PassResult(document, fixes);
    }

    private void promote(Siblings siblings, int index, List<Fix> fixes) {
        var node = siblings.get(index);
        if (!Arguments.isMacro(node, config.linkMacros())) {
            return;
        }

        var attached = Arguments.mandatory(node);
        var arguments = attached.isEmpty() ? Arguments.following(siblings, index, 2) : attached;
        if (arguments.size() < 2) {
            return;
        }
        var url = Arguments.plainText(arguments.get(0)).trim();
        var text = Arguments.plainText(arguments.get(1));
        if (!isAcademic(url) || year(text).isEmpty()) {
            return;
        }
        if (attached.isEmpty()) {
            Arguments.absorb(siblings, index, 2);
        }

        var key = citationKey(text);
        var name = node.content();
        node.changeKind(NodeKind.CITATION);
        node.clearAttributes();
        node.put(Attribute.ORIGINAL_CONTENT, name);
        node.put(Attribute.CITATION_KEYS, List.of(key));
        node.setContent(config.citationMacro());
        node.clearChildren();
        fixes.add(new Fix(id(), "Converted href to citation: " + key, node.span()));
    }

    /**
     * True when the URL host is, or lies below, one of the academic domains. Partial names such
     * as {@code pubmed} match any host containing them as whole labels.
     */
    public boolean isAcademic(String url) {
        var host = host(url);
        if (host.isEmpty()) {
            return false;
        }
        var dotted = "." + host + ".";
        return config.academicDomains().stream()
                     .anyMatch(domain -> dotted.contains("." + domain.toLowerCase(Locale.ROOT) + "."));
    }

    private static String host(String url) {
        int scheme = url.indexOf("://");
        int start = scheme < 0 ? 0 : scheme + 3;
        int end = start;
        while (end < url.length() && "/?#:".indexOf(url.charAt(end)) < 0) {
            end++;
        }
        var host = url.substring(start, end).toLowerCase(Locale.ROOT);
        int credentials = host.lastIndexOf('@');
        return credentials < 0 ? host : host.substring(credentials + 1);
    }

    /**
     * Citation key from the first capitalized, lowercase-tailed word and the year,
     * or {@code unknown} when no such word exists.
     */
    public static String citationKey(String text) {
        var year = year(text);
        var author = author(text);
        return author.isPresent() && year.isPresent() ? author.get() + year.get() : UNKNOWN_KEY;
    }

    public static Optional<String> year(String text) {
        for (var word : text.trim().split("\\s+")) {
            var token = strip(word);
            if (token.length() == 4 && token.chars().allMatch(c -> c >= '0' && c <= '9')) {
                int year = Integer.parseInt(token);
                if (year >= 1900 && year <= 2099) {
                    return Optional.of(token);
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<String> author(String text) {
        for (var word : text.trim().split("\\s+")) {
            var token = strip(word);
            if (token.length() > 1 && Character.isUpperCase(token.charAt(0)) && isLowerTail(token.substring(1))) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    /**
     * At least one cased letter and no uppercase letter.
     */
    private static boolean isLowerTail(String tail) {
        boolean cased = false;
        for (int i = 0; i < tail.length(); i++) {
            char c = tail.charAt(i);
            if (Character.isUpperCase(c) || Character.isTitleCase(c)) {
                return false;
            }
            if (Character.isLowerCase(c)) {
                cased = true;
            }
        }
        return cased;
    }

    private static String strip(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && TOKEN_PUNCTUATION.indexOf(word.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && TOKEN_PUNCTUATION.indexOf(word.charAt(end - 1)) >= 0) {
            end--;
        }
        return word.substring(start, end);
    }
}
