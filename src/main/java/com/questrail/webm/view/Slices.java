package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;

public final class Slices extends ElementView
{
    Slices(Node node)
    {
        super(node);
    }

    public static Slices of(Node node)
    {
        return narrow(node, ElementIds.SLICES, Slices::new);
    }

    public List<TimeSlice> timeSlices()
    {
        return repeatedViews(ElementIds.TIME_SLICE, TimeSlice::new);
    }
}
