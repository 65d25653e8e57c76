package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;

public final class CuePoint extends ElementView
{
    CuePoint(Node node)
    {
        super(node);
    }

    public static CuePoint of(Node node)
    {
        return narrow(node, ElementIds.CUE_POINT, CuePoint::new);
    }

    /**
     * Absolute timestamp in Segment ticks.
     */
    public long time()
    {
        return mandatoryUnsigned(ElementIds.CUE_TIME);
    }

    public List<CueTrackPositions> trackPositions()
    {
        return repeatedViews(ElementIds.CUE_TRACK_POSITIONS, CueTrackPositions::new);
    }
}
