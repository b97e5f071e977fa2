package org.pragmatica.markup.transform.pass;

import org.pragmatica.markup.transform.Fix;
import org.pragmatica.markup.transform.NodeWalker;
import org.pragmatica.markup.transform.Pass;
import org.pragmatica.markup.transform.PassId;
import org.pragmatica.markup.transform.PassResult;
import org.pragmatica.markup.tree.Document;
import org.pragmatica.markup.tree.Node;
import org.pragmatica.markup.tree.NodeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans block-markup headings produced by converters: a heading wrapped entirely in strong
 * emphasis is unwrapped, and a leading section number ({@code 1.}, {@code 2.1},
 * {@code 3\.2\.1}) is removed.
 */
public final class HeadingCleanupPass implements Pass {
    private static final Pattern SECTION_NUMBER = Pattern.compile("^(?:[0-9]+(?:\\\\?\\.[0-9]*)*\\s*)+");

    @Override
    public PassId id() {
        return PassId.HEADING_CLEANUP;
    }

    @Override
    public PassResult apply(Document document) {
        var fixes = new ArrayList<Fix>();
        for (var node : document.nodes()) {
            if (node.is(NodeKind.HEADING)) {
                clean(node, fixes);
            }
        }
        return new PassResult(document, fixes);
    }

    /**
     * Text with any leading section number and the whitespace after it removed.
     */
    public static String stripSectionNumber(String text) {
        var number = SECTION_NUMBER.matcher(text);
        return number.find() ? text.substring(number.end()) : text;
    }

    private void clean(Node heading, List<Fix> fixes) {
        boolean changed = false;

        var strong = Arguments.single(heading.children());
        if (strong.isPresent() && strong.get().is(NodeKind.STRONG)) {
            heading.replaceChildren(strong.get().children());
            changed = true;
        }

        if (heading.hasChildren() && heading.children().get(0).is(NodeKind.TEXT)) {
            var first = heading.children().get(0);
            var stripped = stripSectionNumber(first.content());
            if (stripped.length() < first.content().length()) {
                first.setContent(stripped);
                changed = true;
            }
        }

        if (changed) {
            var text = new StringBuilder();
            NodeWalker.preOrder(heading.children(), node -> {
                if (node.is(NodeKind.TEXT)) {
                    text.append(node.content());
                }
            });
            heading.setContent(text.toString().strip());
            fixes.add(new Fix(id(), "Cleaned heading: " + heading.content(), heading.span()));
        }
    }
}
