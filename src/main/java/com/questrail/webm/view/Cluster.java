package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;
import java.util.OptionalLong;

/**
 * A run of blocks sharing a base timestamp.
 *
 * <p>Block payloads are returned as opaque bytes; lacing and frame
 * extraction are left to the caller.</p>
 */
public final class Cluster extends ElementView
{
    Cluster(Node node)
    {
        super(node);
    }

    public static Cluster of(Node node)
    {
        return narrow(node, ElementIds.CLUSTER, Cluster::new);
    }

    public long timestamp()
    {
        return mandatoryUnsigned(ElementIds.TIMESTAMP);
    }

    public OptionalLong position()
    {
        return optionalUnsigned(ElementIds.POSITION);
    }

    public OptionalLong prevSize()
    {
        return optionalUnsigned(ElementIds.PREV_SIZE);
    }

    public List<byte[]> simpleBlocks()
    {
        return repeatedBinary(ElementIds.SIMPLE_BLOCK);
    }

    public List<BlockGroup> blockGroups()
    {
        return repeatedViews(ElementIds.BLOCK_GROUP, BlockGroup::new);
    }
}
