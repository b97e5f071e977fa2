package org.pragmatica.markup.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One element of a parsed document.
 *
 * <p>Nodes are created by parsers through {@link #builder(NodeKind, SourceSpan)} and then
 * mutated in place by transformation passes. Every mutator marks the node as modified,
 * which tells the reconstructor to synthesize its text instead of copying the original span.
 */
public final class Node {
    private NodeKind kind;
    private String content;
    private SourceSpan span;
    private final Map<Attribute<?>, Object> attributes;
    private final List<Node> children;
    private boolean modified;

    private Node(NodeKind kind, String content, SourceSpan span, Map<Attribute<?>, Object> attributes, List<Node> children) {
        this.kind = kind;
        this.content = content;
        this.span = span;
        this.attributes = attributes;
        this.children = children;
        this.modified = false;
    }

    public static Builder builder(NodeKind kind, SourceSpan span) {
        return new Builder(kind, span);
    }

    // === Accessors ===

    public NodeKind kind() {
        return kind;
    }

    public String content() {
        return content;
    }

    public SourceSpan span() {
        return span;
    }

    public int start() {
        return span.startOffset();
    }

    public int end() {
        return span.endOffset();
    }

    public int line() {
        return span.start().line();
    }

    public int column() {
        return span.start().column();
    }

    public boolean is(NodeKind expected) {
        return kind == expected;
    }

    public <T> Optional<T> get(Attribute<T> key) {
        return Optional.ofNullable(attributes.get(key)).map(key::read);
    }

    public <T> T getOrDefault(Attribute<T> key, T defaultValue) {
        return get(key).orElse(defaultValue);
    }

    public boolean has(Attribute<?> key) {
        return attributes.containsKey(key);
    }

    public Map<Attribute<?>, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Mutable view of the children for passes that need sibling lookahead.
     */
    public Siblings siblings() {
        return Siblings.of(children);
    }

    // === Mutation state ===

    /**
     * True when this node itself was rewritten by a pass.
     */
    public boolean isModified() {
        return modified;
    }

    /**
     * True when this node or any node below it was rewritten.
     */
    public boolean isTouched() {
        if (modified) {
            return true;
        }
        for (var child : children) {
            if (child.isTouched()) {
                return true;
            }
        }
        return false;
    }

    // === Mutators ===

    public void setContent(String newContent) {
        this.content = newContent;
        this.modified = true;
    }

    /**
     * Switch the discriminant. Attributes that are not valid for the new kind are dropped.
     */
    public void changeKind(NodeKind newKind) {
        this.kind = newKind;
        attributes.keySet().removeIf(key -> !key.validFor(newKind));
        this.modified = true;
    }

    public <T> void put(Attribute<T> key, T value) {
        requireValid(kind, key, value);
        attributes.put(key, value);
        this.modified = true;
    }

    public void remove(Attribute<?> key) {
        if (attributes.remove(key) != null) {
            this.modified = true;
        }
    }

    public void clearAttributes() {
        if (!attributes.isEmpty()) {
            attributes.clear();
            this.modified = true;
        }
    }

    public void replaceChildren(List<Node> newChildren) {
        children.clear();
        children.addAll(newChildren);
        this.modified = true;
    }

    public void clearChildren() {
        replaceChildren(List.of());
    }

    /**
     * Extend this node over a following sibling that a pass merged into it.
     * The caller removes the sibling from its list.
     */
    void extendOver(Node sibling) {
        if (sibling.end() > span.endOffset()) {
            this.span = SourceSpan.of(span.start(), sibling.span.end());
        }
        this.modified = true;
    }

    private static void requireValid(NodeKind kind, Attribute<?> key, Object value) {
        if (!key.validFor(kind)) {
            throw new IllegalArgumentException("Attribute '" + key.name() + "' is not valid for " + kind.display() + " nodes");
        }
        if (value != null) {
            key.read(value);
        }
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        sb.append(kind.display()).append('[').append(span.startOffset()).append(',').append(span.endOffset()).append(')');
        if (!content.isEmpty()) {
            sb.append(" '").append(content).append('\'');
        }
        if (!children.isEmpty()) {
            sb.append(' ').append(children);
        }
        return sb.toString();
    }

    /**
     * Assembles a node during parsing. Building does not count as a modification.
     */
    public static final class Builder {
        private final NodeKind kind;
        private final SourceSpan span;
        private final Map<Attribute<?>, Object> attributes = new LinkedHashMap<>();
        private final List<Node> children = new ArrayList<>();
        private String content = "";

        private Builder(NodeKind kind, SourceSpan span) {
            this.kind = kind;
            this.span = span;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public <T> Builder attribute(Attribute<T> key, T value) {
            requireValid(kind, key, value);
            attributes.put(key, value);
            return this;
        }

        public Builder child(Node child) {
            children.add(child);
            return this;
        }

        public Builder children(List<Node> nodes) {
            children.addAll(nodes);
            return this;
        }

        public Node build() {
            return new Node(kind, content, span, attributes, children);
        }
    }
}
