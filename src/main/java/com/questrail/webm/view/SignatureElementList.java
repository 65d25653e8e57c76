package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;

public final class SignatureElementList extends ElementView
{
    SignatureElementList(Node node)
    {
        super(node);
    }

    public static SignatureElementList of(Node node)
    {
        return narrow(node, ElementIds.SIGNATURE_ELEMENT_LIST, SignatureElementList::new);
    }

    /**
     * Identifiers of the signed elements, as raw bytes.
     */
    public List<byte[]> signedElements()
    {
        return repeatedBinary(ElementIds.SIGNED_ELEMENT);
    }
}
