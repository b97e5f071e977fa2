package org.pragmatica.markup.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw input plus its parsed node tree and document-level metadata.
 *
 * <p>The raw buffer is never modified; nodes only reference it by range.
 */
public final class Document {
    private final Dialect dialect;
    private final String rawText;
    private final LineIndex lineIndex;
    private final List<Node> nodes;
    private final Metadata metadata;

    private Document(Dialect dialect, String rawText, LineIndex lineIndex, List<Node> nodes, Metadata metadata) {
        this.dialect = dialect;
        this.rawText = rawText;
        this.lineIndex = lineIndex;
        this.nodes = nodes;
        this.metadata = metadata;
    }

    public static Document create(Dialect dialect, String rawText, LineIndex lineIndex, List<Node> nodes, Metadata metadata) {
        return new Document(dialect, rawText, lineIndex, new ArrayList<>(nodes), metadata);
    }

    public Dialect dialect() {
        return dialect;
    }

    public String rawText() {
        return rawText;
    }

    public LineIndex lineIndex() {
        return lineIndex;
    }

    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Mutable view of the top-level nodes.
     */
    public Siblings siblings() {
        return Siblings.of(nodes);
    }

    public Metadata metadata() {
        return metadata;
    }

    public String textOf(Node node) {
        return node.span().extract(rawText);
    }

    public boolean isTouched() {
        for (var node : nodes) {
            if (node.isTouched()) {
                return true;
            }
        }
        return false;
    }
}
