package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.OptionalLong;

public final class TimeSlice extends ElementView
{
    TimeSlice(Node node)
    {
        super(node);
    }

    public static TimeSlice of(Node node)
    {
        return narrow(node, ElementIds.TIME_SLICE, TimeSlice::new);
    }

    public OptionalLong laceNumber()
    {
        return optionalUnsigned(ElementIds.LACE_NUMBER);
    }
}
