package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

/**
 * One encoding step applied to a track's data. WebM only defines
 * encryption, so {@link #encryption()} is mandatory.
 */
public final class ContentEncoding extends ElementView
{
    ContentEncoding(Node node)
    {
        super(node);
    }

    public static ContentEncoding of(Node node)
    {
        return narrow(node, ElementIds.CONTENT_ENCODING, ContentEncoding::new);
    }

    public long order()
    {
        return mandatoryUnsigned(ElementIds.CONTENT_ENCODING_ORDER);
    }

    public long scope()
    {
        return mandatoryUnsigned(ElementIds.CONTENT_ENCODING_SCOPE);
    }

    public long type()
    {
        return mandatoryUnsigned(ElementIds.CONTENT_ENCODING_TYPE);
    }

    public ContentEncryption encryption()
    {
        return mandatoryView(ElementIds.CONTENT_ENCRYPTION, ContentEncryption::new);
    }
}
