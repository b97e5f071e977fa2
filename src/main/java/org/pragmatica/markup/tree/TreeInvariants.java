package org.pragmatica.markup.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks the structural invariants every document must satisfy before and after each pass:
 * spans inside the buffer, sorted non-overlapping siblings, children inside their parent,
 * kinds and attributes valid for the dialect.
 */
public final class TreeInvariants {
    private TreeInvariants() {}

    /**
     * @return violation messages, empty when the document is consistent
     */
    public static List<String> check(Document document) {
        var violations = new ArrayList<String>();
        int length = document.rawText().length();
        checkSiblings(document, document.nodes(), 0, length, length, violations);
        return violations;
    }

    public static boolean holds(Document document) {
        return check(document).isEmpty();
    }

    private static void checkSiblings(Document document,
                                      List<Node> siblings,
                                      int parentStart,
                                      int parentEnd,
                                      int length,
                                      List<String> violations) {
        int previousEnd = parentStart;
        for (var node : siblings) {
            if (node.start() < 0 || node.start() > node.end() || node.end() > length) {
                violations.add("span out of bounds: " + describe(node));
            }
            if (node.start() < parentStart || node.end() > parentEnd) {
                violations.add("child outside parent span [" + parentStart + "," + parentEnd + "): " + describe(node));
            }
            if (node.start() < previousEnd) {
                violations.add("sibling overlaps or is out of order at " + previousEnd + ": " + describe(node));
            }
            if (!document.dialect().permits(node.kind())) {
                violations.add("kind " + node.kind() + " not permitted in " + document.dialect() + ": " + describe(node));
            }
            for (Map.Entry<Attribute<?>, Object> entry : node.attributes().entrySet()) {
                if (!entry.getKey().validFor(node.kind())) {
                    violations.add("attribute '" + entry.getKey().name() + "' leaked into " + describe(node));
                }
            }
            previousEnd = Math.max(previousEnd, node.end());
            checkSiblings(document, node.children(), node.start(), node.end(), length, violations);
        }
    }

    private static String describe(Node node) {
        return node.kind().display() + "[" + node.start() + "," + node.end() + ") at " + node.span().start();
    }
}
