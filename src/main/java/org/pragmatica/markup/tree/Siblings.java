package org.pragmatica.markup.tree;

import java.util.List;
import java.util.Optional;

/**
 * Live, index-addressable view of one sibling list (document top level or a node's children).
 *
 * <p>Passes use it for bounded lookahead over the siblings that follow a node.
 */
public final class Siblings {
    private final List<Node> nodes;

    private Siblings(List<Node> nodes) {
        this.nodes = nodes;
    }

    static Siblings of(List<Node> nodes) {
        return new Siblings(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public Node get(int index) {
        return nodes.get(index);
    }

    /**
     * The sibling {@code distance} positions after {@code index}, if present.
     */
    public Optional<Node> lookahead(int index, int distance) {
        int target = index + distance;
        return target < nodes.size() ? Optional.of(nodes.get(target)) : Optional.empty();
    }

    /**
     * Merge the sibling right after {@code index} into the node at {@code index}: the
     * node's span grows over it and the sibling leaves the list.
     */
    public Node absorbNext(int index) {
        var owner = nodes.get(index);
        var absorbed = nodes.remove(index + 1);
        owner.extendOver(absorbed);
        return absorbed;
    }
}
