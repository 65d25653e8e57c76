package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;

/**
 * Metadata attached to the targets named by {@link #targets()}.
 */
public final class Tag extends ElementView
{
    Tag(Node node)
    {
        super(node);
    }

    public static Tag of(Node node)
    {
        return narrow(node, ElementIds.TAG, Tag::new);
    }

    public Targets targets()
    {
        return mandatoryView(ElementIds.TARGETS, Targets::new);
    }

    public List<SimpleTag> simpleTags()
    {
        return repeatedViews(ElementIds.SIMPLE_TAG, SimpleTag::new);
    }
}
