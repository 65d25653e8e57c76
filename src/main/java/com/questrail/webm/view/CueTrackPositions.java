package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.OptionalLong;

public final class CueTrackPositions extends ElementView
{
    CueTrackPositions(Node node)
    {
        super(node);
    }

    public static CueTrackPositions of(Node node)
    {
        return narrow(node, ElementIds.CUE_TRACK_POSITIONS, CueTrackPositions::new);
    }

    public long track()
    {
        return mandatoryUnsigned(ElementIds.CUE_TRACK);
    }

    /**
     * Cluster position relative to the start of the Segment data.
     */
    public long clusterPosition()
    {
        return mandatoryUnsigned(ElementIds.CUE_CLUSTER_POSITION);
    }

    public OptionalLong blockNumber()
    {
        return optionalUnsigned(ElementIds.CUE_BLOCK_NUMBER);
    }

    public OptionalLong relativePosition()
    {
        return optionalUnsigned(ElementIds.CUE_RELATIVE_POSITION);
    }

    public OptionalLong duration()
    {
        return optionalUnsigned(ElementIds.CUE_DURATION);
    }
}
