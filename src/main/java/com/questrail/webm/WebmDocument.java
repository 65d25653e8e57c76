package com.questrail.webm;

import com.questrail.webm.model.Node;
import com.questrail.webm.view.EbmlHeader;
import com.questrail.webm.view.Segment;

import java.util.Objects;

/**
 * WebmDocument
 * -----------------------------------------------------------------------------
 * Result of a successful parse: the EBML header tree followed by the root
 * (Segment) tree.
 *
 * <p>The document is immutable and may be shared freely between threads.
 * Generic nodes are available for diagnostics; typed access goes through
 * {@link #header()} and {@link #root()}.</p>
 */
public final class WebmDocument
{
    private final Node headerNode;
    private final Node rootNode;

    public WebmDocument(Node headerNode, Node rootNode)
    {
        this.headerNode = Objects.requireNonNull(headerNode, "headerNode");
        this.rootNode = Objects.requireNonNull(rootNode, "rootNode");
    }

    public Node headerNode()
    {
        return headerNode;
    }

    public Node rootNode()
    {
        return rootNode;
    }

    /**
     * @throws IllegalArgumentException if the first element is not an EBML header
     */
    public EbmlHeader header()
    {
        return EbmlHeader.of(headerNode);
    }

    /**
     * The root element viewed as a Segment. Its identifier is not checked.
     */
    public Segment root()
    {
        return Segment.wrap(rootNode);
    }

    /**
     * Total number of nodes in both trees.
     */
    public int nodeCount()
    {
        return headerNode.subtreeSize() + rootNode.subtreeSize();
    }

    @Override
    public String toString()
    {
        return headerNode + System.lineSeparator() + rootNode;
    }
}
