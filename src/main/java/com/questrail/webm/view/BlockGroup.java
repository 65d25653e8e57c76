package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

public final class BlockGroup extends ElementView
{
    BlockGroup(Node node)
    {
        super(node);
    }

    public static BlockGroup of(Node node)
    {
        return narrow(node, ElementIds.BLOCK_GROUP, BlockGroup::new);
    }

    public byte[] block()
    {
        return mandatoryBinary(ElementIds.BLOCK);
    }

    public OptionalLong blockDuration()
    {
        return optionalUnsigned(ElementIds.BLOCK_DURATION);
    }

    /**
     * Relative timestamps of referenced blocks. Signed.
     */
    public List<Long> referenceBlocks()
    {
        return repeatedSigned(ElementIds.REFERENCE_BLOCK);
    }

    public OptionalLong discardPadding()
    {
        return optionalSigned(ElementIds.DISCARD_PADDING);
    }

    public Optional<Slices> slices()
    {
        return optionalView(ElementIds.SLICES, Slices::new);
    }
}
