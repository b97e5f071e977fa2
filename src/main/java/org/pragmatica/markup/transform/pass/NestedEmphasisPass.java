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

/**
 * Flattens emphasis nested inside emphasis: {@code \emph{\emph{inner} outer}} becomes
 * {@code \emph{{inner} outer}}. The outermost emphasis stays; every emphasis macro inside its
 * argument is demoted to a plain group holding the same content.
 */
public final class NestedEmphasisPass implements Pass {
    private final PassConfig config;

    public NestedEmphasisPass(PassConfig config) {
        this.config = config;
    }

    @Override
    public PassId id() {
        return PassId.NESTED_EMPHASIS;
    }

    @Override
    public PassResult apply(Document document) {
        var fixes = new ArrayList<Fix>();
        NodeWalker.walk(document, (siblings, index) -> flattenInside(siblings, index, fixes));
        return new PassResult(document, fixes);
    }

    private void flattenInside(Siblings siblings, int index, List<Fix> fixes) {
        var node = siblings.get(index);
        if (!Arguments.isMacro(node, config.emphasisMacros())) {
            return;
        }
        var attached = Arguments.mandatory(node);
        var scope = attached.isEmpty() ? Arguments.following(siblings, index, 1) : attached;

        for (var argument : scope) {
            NodeWalker.walk(argument.siblings(), (inner, at) -> demote(inner, at, fixes));
        }
    }

    private void demote(Siblings siblings, int index, List<Fix> fixes) {
        var inner = siblings.get(index);
        if (!Arguments.isMacro(inner, config.emphasisMacros())) {
            return;
        }
        var arguments = Arguments.mandatory(inner);
        if (arguments.isEmpty()) {
            if (Arguments.following(siblings, index, 1).isEmpty()) {
                return;
            }
            Arguments.absorb(siblings, index, 1);
            arguments = Arguments.mandatory(inner);
        }

        var content = List.copyOf(arguments.get(0).children());
        var name = inner.content();
        inner.changeKind(NodeKind.GROUP);
        inner.clearAttributes();
        inner.put(Attribute.ORIGINAL_CONTENT, name);
        inner.setContent("");
        inner.replaceChildren(content);
        fixes.add(new Fix(id(), "Fixed nested emphasis", inner.span()));
    }
}
