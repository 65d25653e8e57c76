package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;

/**
 * Seek index of the Segment.
 */
public final class Cues extends ElementView
{
    Cues(Node node)
    {
        super(node);
    }

    public static Cues of(Node node)
    {
        return narrow(node, ElementIds.CUES, Cues::new);
    }

    public List<CuePoint> cuePoints()
    {
        return repeatedViews(ElementIds.CUE_POINT, CuePoint::new);
    }
}
