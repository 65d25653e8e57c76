package com.questrail.webm.view;

import com.questrail.webm.codec.EbmlPrimitives;
import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

/**
 * One SeekHead entry pointing at a top-level element.
 */
public final class Seek extends ElementView
{
    Seek(Node node)
    {
        super(node);
    }

    public static Seek of(Node node)
    {
        return narrow(node, ElementIds.SEEK, Seek::new);
    }

    /**
     * Raw identifier bytes of the target element, marker bits included.
     */
    public byte[] seekId()
    {
        return mandatoryBinary(ElementIds.SEEK_ID);
    }

    /**
     * The target identifier as a number comparable with {@link ElementIds}.
     */
    public long seekIdValue()
    {
        return EbmlPrimitives.bytesToUnsignedInt(seekId());
    }

    /**
     * Target position relative to the start of the Segment data.
     */
    public long seekPosition()
    {
        return mandatoryUnsigned(ElementIds.SEEK_POSITION);
    }
}
