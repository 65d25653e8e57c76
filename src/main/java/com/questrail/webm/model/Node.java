package com.questrail.webm.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Node
 * -----------------------------------------------------------------------------
 * Immutable generic tree node: one {@link Element} and, for containers, its
 * children in document order.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Only container elements have children.</li>
 *   <li>For a container, the children's {@link Element#encodedLength()}
 *       values sum to exactly the container's declared size.</li>
 * </ul>
 *
 * <p>Nodes are created once by the tree decoder and never change, so a tree
 * may be shared between threads without locking.</p>
 */
public final class Node
{
    private final Element element;
    private final List<Node> children;
    private final int subtreeSize;

    public Node(Element element, List<Node> children)
    {
        this.element = Objects.requireNonNull(element, "element");
        this.children = List.copyOf(children);

        if (!element.kind().isContainer() && !this.children.isEmpty()) {
            throw new IllegalArgumentException("only container elements may have children");
        }

        long span = 0;
        int size = 1;
        for (Node child : this.children) {
            span += child.element.encodedLength();
            size += child.subtreeSize;
        }
        if (element.kind().isContainer() && span != element.declaredSize()) {
            throw new IllegalArgumentException(
                    "children span " + span + " bytes but container declares " + element.declaredSize());
        }
        this.subtreeSize = size;
    }

    public static Node leaf(Element element)
    {
        return new Node(element, List.of());
    }

    public Element element()
    {
        return element;
    }

    public long id()
    {
        return element.id();
    }

    public List<Node> children()
    {
        return children;
    }

    /**
     * Number of nodes in this subtree, this node included.
     */
    public int subtreeSize()
    {
        return subtreeSize;
    }

    /**
     * First direct child with identifier {@code id}, in document order.
     */
    public Optional<Node> firstChild(long id)
    {
        for (Node child : children) {
            if (child.id() == id) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * All direct children with identifier {@code id}, in document order.
     * Grandchildren are never searched.
     */
    public List<Node> childrenWithId(long id)
    {
        List<Node> matches = new ArrayList<>();
        for (Node child : children) {
            if (child.id() == id) {
                matches.add(child);
            }
        }
        return matches;
    }

    /**
     * Multi-line diagnostic rendering of this subtree.
     *
     * @see NodeFormatter
     */
    @Override
    public String toString()
    {
        return NodeFormatter.format(this);
    }
}
