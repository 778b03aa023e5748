package io.github.tsast.ast;

import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Untyped syntax tree node: a {@link NodeType} tag, the exact source text, the source range, ordered children and a
 * back-reference to the parent.
 *
 * <p>Trees are assembled bottom-up: a node adopts its children when it is constructed, which is the only time a
 * child's parent is ever assigned. A node therefore belongs to at most one parent and never changes afterwards.
 */
public final class GenericNode {
    private final NodeType type;
    private final String text;
    private final Range range;
    private final List<GenericNode> children;
    private @Nullable GenericNode parent;

    public GenericNode(NodeType type, String text, Range range, List<GenericNode> children) {
        this.type = type;
        this.text = text;
        this.range = range;
        this.children = List.copyOf(children);
        for (var child : this.children) {
            if (child.parent != null) {
                throw new IllegalArgumentException("Node " + child + " already belongs to " + child.parent);
            }
            child.parent = this;
        }
    }

    public GenericNode(NodeType type, String text, Range range) {
        this(type, text, range, List.of());
    }

    public NodeType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public Range getRange() {
        return range;
    }

    /** Children in source order. The list is unmodifiable. */
    public List<GenericNode> getChildren() {
        return children;
    }

    public int getChildCount() {
        return children.size();
    }

    public GenericNode getChild(int index) {
        return children.get(index);
    }

    /** The enclosing node, or null for a root. */
    public @Nullable GenericNode getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /** First direct child tagged {@code childType}. */
    public Optional<GenericNode> findFirstChild(NodeType childType) {
        for (var child : children) {
            if (child.type == childType) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        var preview = text.length() > 40 ? text.substring(0, 40) + "..." : text;
        return "%s[%d..%d] '%s'"
                .formatted(type, range.startOffset(), range.endOffset(), preview.replace("\n", "\\n"));
    }
}
