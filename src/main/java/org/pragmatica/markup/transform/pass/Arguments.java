package org.pragmatica.markup.transform.pass;

import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.Node;
import org.pragmatica.markup.tree.NodeKind;
import org.pragmatica.markup.tree.Siblings;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Access to macro arguments, whether attached at parse time or left as following siblings.
 */
final class Arguments {
    private Arguments() {}

    /**
     * Mandatory argument groups attached to the macro.
     */
    static List<Node> mandatory(Node macro) {
        return macro.children().stream()
                    .filter(child -> child.is(NodeKind.GROUP) && !child.getOrDefault(Attribute.OPTIONAL, false))
                    .toList();
    }

    static List<Node> all(Node macro) {
        return macro.children().stream()
                    .filter(child -> child.is(NodeKind.GROUP))
                    .toList();
    }

    /**
     * Mandatory argument groups following the macro at {@code index}, at most {@code count}.
     * Only immediately adjacent groups count.
     */
    static List<Node> following(Siblings siblings, int index, int count) {
        var groups = new ArrayList<Node>();
        for (int distance = 1; distance <= count; distance++) {
            var next = siblings.lookahead(index, distance);
            if (next.isEmpty() || !isMandatoryGroup(next.get())) {
                break;
            }
            groups.add(next.get());
        }
        return groups;
    }

    /**
     * Merge {@code count} following sibling groups into the macro at {@code index} and attach them
     * as its arguments.
     */
    static void absorb(Siblings siblings, int index, int count) {
        var macro = siblings.get(index);
        var absorbed = new ArrayList<Node>(macro.children());
        for (int i = 0; i < count; i++) {
            absorbed.add(siblings.absorbNext(index));
        }
        macro.replaceChildren(absorbed);
    }

    static boolean isMandatoryGroup(Node node) {
        return node.is(NodeKind.GROUP) && !node.getOrDefault(Attribute.OPTIONAL, false);
    }

    /**
     * Text content of all text runs below the node, in order.
     */
    static String plainText(Node node) {
        var text = new StringBuilder();
        appendText(node, text);
        return text.toString();
    }

    private static void appendText(Node node, StringBuilder text) {
        if (node.is(NodeKind.TEXT)) {
            text.append(node.content());
            return;
        }
        for (var child : node.children()) {
            appendText(child, text);
        }
    }

    /**
     * True when the group holds nothing but whitespace text.
     */
    static boolean isBlank(Node group) {
        return group.children().stream()
                    .allMatch(child -> child.is(NodeKind.TEXT) && child.content().isBlank());
    }

    static boolean isMacro(Node node, Set<String> names) {
        return node.is(NodeKind.MACRO) && names.contains(node.content());
    }

    static Optional<Node> single(List<Node> nodes) {
        var meaningful = nodes.stream()
                              .filter(node -> !(node.is(NodeKind.TEXT) && node.content().isBlank()))
                              .toList();
        return meaningful.size() == 1 ? Optional.of(meaningful.get(0)) : Optional.empty();
    }
}
