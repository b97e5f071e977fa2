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
 * Replaces a caption whose arguments are all empty or whitespace with the comment
 * {@code % Empty caption removed}. A caption without attached arguments absorbs an
 * empty group right after it.
 */
public final class EmptyCaptionPass implements Pass {
    static final String REMOVED = " Empty caption removed";

    private final PassConfig config;

    public EmptyCaptionPass(PassConfig config) {
        this.config = config;
    }

    @Override
    public PassId id() {
        return PassId.EMPTY_CAPTION;
    }

    @Override
    public PassResult apply(Document document) {
        var fixes = new ArrayList<Fix>();
        NodeWalker.walk(document, (siblings, index) -> elide(siblings, index, fixes));
        return new PassResult(document, fixes);
    }

    private void elide(Siblings siblings, int index, List<Fix> fixes) {
        var node = siblings.get(index);
        if (!Arguments.isMacro(node, config.captionMacros())) {
            return;
        }

        var attached = Arguments.all(node);
        if (!attached.stream().allMatch(Arguments::isBlank)) {
            return;
        }
        if (attached.isEmpty()) {
            var following = Arguments.following(siblings, index, 1);
            if (!following.isEmpty() && !Arguments.isBlank(following.get(0))) {
                return;
            }
            if (!following.isEmpty()) {
                Arguments.absorb(siblings, index, 1);
            }
        }

        var name = node.content();
        node.changeKind(NodeKind.COMMENT);
        node.clearAttributes();
        node.put(Attribute.ORIGINAL_CONTENT, name);
        node.setContent(REMOVED);
        node.clearChildren();
        fixes.add(new Fix(id(), "Removed empty caption", node.span()));
    }
}
