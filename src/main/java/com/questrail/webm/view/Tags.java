package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;

public final class Tags extends ElementView
{
    Tags(Node node)
    {
        super(node);
    }

    public static Tags of(Node node)
    {
        return narrow(node, ElementIds.TAGS, Tags::new);
    }

    public List<Tag> tags()
    {
        return repeatedViews(ElementIds.TAG, Tag::new);
    }
}
