package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;

public final class ContentEncodings extends ElementView
{
    ContentEncodings(Node node)
    {
        super(node);
    }

    public static ContentEncodings of(Node node)
    {
        return narrow(node, ElementIds.CONTENT_ENCODINGS, ContentEncodings::new);
    }

    public List<ContentEncoding> encodings()
    {
        return repeatedViews(ElementIds.CONTENT_ENCODING, ContentEncoding::new);
    }
}
