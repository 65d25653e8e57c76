package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;

public final class SeekHead extends ElementView
{
    SeekHead(Node node)
    {
        super(node);
    }

    public static SeekHead of(Node node)
    {
        return narrow(node, ElementIds.SEEK_HEAD, SeekHead::new);
    }

    public List<Seek> seeks()
    {
        return repeatedViews(ElementIds.SEEK, Seek::new);
    }
}
