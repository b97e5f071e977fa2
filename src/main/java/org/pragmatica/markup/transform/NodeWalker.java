package org.pragmatica.markup.transform;

import org.pragmatica.markup.tree.Document;
import org.pragmatica.markup.tree.Node;
import org.pragmatica.markup.tree.Siblings;

import java.util.List;
import java.util.function.Consumer;

/**
 * Tree walks used by the passes.
 */
public final class NodeWalker {
    private NodeWalker() {}

    /**
     * Callback for a node addressed by its position among its siblings.
     */
    @FunctionalInterface
    public interface SiblingVisitor {
        void visit(Siblings siblings, int index);
    }

    /**
     * Pre-order walk over every sibling list of the document. The visitor may rewrite the node
     * at {@code index} and absorb following siblings; the walk then descends into whatever
     * children the node has after the visit.
     */
    public static void walk(Document document, SiblingVisitor visitor) {
        walk(document.siblings(), visitor);
    }

    public static void walk(Siblings siblings, SiblingVisitor visitor) {
        for (int index = 0; index < siblings.size(); index++) {
            visitor.visit(siblings, index);
            walk(siblings.get(index).siblings(), visitor);
        }
    }

    /**
     * Read-only pre-order walk.
     */
    public static void preOrder(List<Node> nodes, Consumer<Node> visitor) {
        for (var node : nodes) {
            visitor.accept(node);
            preOrder(node.children(), visitor);
        }
    }
}
