package org.pragmatica.markup.transform.pass;

import org.pragmatica.markup.transform.Fix;
import org.pragmatica.markup.transform.NodeWalker;
import org.pragmatica.markup.transform.Pass;
import org.pragmatica.markup.transform.PassConfig;
import org.pragmatica.markup.transform.PassId;
import org.pragmatica.markup.transform.PassResult;
import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.Document;
import org.pragmatica.markup.tree.Node;
import org.pragmatica.markup.tree.NodeKind;
import org.pragmatica.markup.tree.Siblings;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Rewrites {@code \passthrough{\lstinline!code!}} to {@code \texttt{code}}.
 *
 * <p>The code is taken from a verbatim shorthand macro inside the argument, or from shorthand
 * text whose backslash was lost ({@code lstinline!code!}). When the wrapper has no attached
 * argument, the group right after it is absorbed, so no orphaned group remains.
 */
public final class ShorthandMacroPass implements Pass {
    private final PassConfig config;

    public ShorthandMacroPass(PassConfig config) {
        this.config = config;
    }

    @Override
    public PassId id() {
        return PassId.SHORTHAND_MACRO;
    }

    @Override
    public PassResult apply(Document document) {
        var fixes = new ArrayList<Fix>();
        NodeWalker.walk(document, (siblings, index) -> rewrite(siblings, index, fixes));
        return new PassResult(document, fixes);
    }

    private void rewrite(Siblings siblings, int index, List<Fix> fixes) {
        var node = siblings.get(index);
        if (!Arguments.isMacro(node, config.shorthandWrappers())) {
            return;
        }

        var attached = Arguments.mandatory(node);
        var argument = attached.isEmpty() ? Arguments.following(siblings, index, 1) : attached;
        if (argument.isEmpty()) {
            return;
        }
        var code = shorthandCode(argument.get(0));
        if (code.isEmpty()) {
            return;
        }
        if (attached.isEmpty()) {
            Arguments.absorb(siblings, index, 1);
        }

        node.put(Attribute.ORIGINAL_CONTENT, node.content());
        node.setContent(config.typewriterMacro());
        node.put(Attribute.ARGUMENTS, List.of(code.get()));
        node.remove(Attribute.STARRED);
        node.clearChildren();
        fixes.add(new Fix(id(), "Fixed passthrough command", node.span()));
    }

    private Optional<String> shorthandCode(Node group) {
        var inner = Arguments.single(group.children());
        if (inner.isEmpty()) {
            return Optional.empty();
        }
        var node = inner.get();
        if (Arguments.isMacro(node, config.verbatimShorthands())) {
            return node.get(Attribute.VERBATIM);
        }
        if (node.is(NodeKind.TEXT)) {
            return shorthandText(node.content());
        }
        return Optional.empty();
    }

    /**
     * Code of a {@code lstinline!code!} run written without its backslash.
     */
    private Optional<String> shorthandText(String text) {
        for (var shorthand : new TreeSet<>(config.verbatimShorthands())) {
            var marker = shorthand + "!";
            int at = text.indexOf(marker);
            if (at < 0) {
                continue;
            }
            int start = at + marker.length();
            int end = text.indexOf('!', start);
            if (end > start) {
                return Optional.of(text.substring(start, end));
            }
        }
        return Optional.empty();
    }
}
