package org.pragmatica.markup.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TreeInvariantsTest {

    private static final String RAW = "abcdefghij";
    private static final LineIndex LINES = LineIndex.of(RAW);

    @Test
    void orderedDisjointNodes_hold() {
        var document = document(Dialect.MARKUP, text(0, 3), text(3, 10));

        assertTrue(TreeInvariants.holds(document));
    }

    @Test
    void overlappingSiblings_areReported() {
        var document = document(Dialect.MARKUP, text(0, 5), text(4, 10));

        var violations = TreeInvariants.check(document);
        assertEquals(1, violations.size());
        assertThat(violations.get(0)).startsWith("sibling overlaps or is out of order");
    }

    @Test
    void childOutsideParent_isReported() {
        var group = Node.builder(NodeKind.GROUP, LINES.span(0, 4)).child(text(2, 6)).build();

        assertThat(TreeInvariants.check(document(Dialect.MARKUP, group))).anyMatch(v -> v.startsWith("child outside parent"));
    }

    @Test
    void kindFromAnotherDialect_isReported() {
        var heading = Node.builder(NodeKind.HEADING, LINES.span(0, 3)).attribute(Attribute.LEVEL, 1).build();

        assertThat(TreeInvariants.check(document(Dialect.MARKUP, heading))).anyMatch(v -> v.startsWith("kind HEADING not permitted"));
    }

    private static Document document(Dialect dialect, Node... nodes) {
        return Document.create(dialect, RAW, LINES, List.of(nodes), new Metadata());
    }

    private static Node text(int start, int end) {
        return Node.builder(NodeKind.TEXT, LINES.span(start, end)).content(RAW.substring(start, end)).build();
    }
}
