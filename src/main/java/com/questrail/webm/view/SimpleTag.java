package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;
import java.util.Optional;

/**
 * A name/value pair. The value is either {@link #string()} or
 * {@link #binary()}; nested tags refine the parent.
 */
public final class SimpleTag extends ElementView
{
    SimpleTag(Node node)
    {
        super(node);
    }

    public static SimpleTag of(Node node)
    {
        return narrow(node, ElementIds.SIMPLE_TAG, SimpleTag::new);
    }

    public String name()
    {
        return mandatoryString(ElementIds.TAG_NAME);
    }

    public String language()
    {
        return mandatoryString(ElementIds.TAG_LANGUAGE);
    }

    public boolean isDefault()
    {
        return mandatoryFlag(ElementIds.TAG_DEFAULT);
    }

    public Optional<String> string()
    {
        return optionalString(ElementIds.TAG_STRING);
    }

    public Optional<byte[]> binary()
    {
        return optionalBinary(ElementIds.TAG_BINARY);
    }

    public List<SimpleTag> simpleTags()
    {
        return repeatedViews(ElementIds.SIMPLE_TAG, SimpleTag::new);
    }
}
