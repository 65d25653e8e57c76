package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;

public final class SignatureElements extends ElementView
{
    SignatureElements(Node node)
    {
        super(node);
    }

    public static SignatureElements of(Node node)
    {
        return narrow(node, ElementIds.SIGNATURE_ELEMENTS, SignatureElements::new);
    }

    public List<SignatureElementList> elementLists()
    {
        return repeatedViews(ElementIds.SIGNATURE_ELEMENT_LIST, SignatureElementList::new);
    }
}
