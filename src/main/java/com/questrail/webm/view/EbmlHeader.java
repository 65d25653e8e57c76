package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

/**
 * The EBML header that opens every document.
 *
 * <p>All seven fields are mandatory. A header that omits any of them is
 * rejected on first access.</p>
 */
public final class EbmlHeader extends ElementView
{
    EbmlHeader(Node node)
    {
        super(node);
    }

    public static EbmlHeader of(Node node)
    {
        return narrow(node, ElementIds.EBML_HEADER, EbmlHeader::new);
    }

    public long version()
    {
        return mandatoryUnsigned(ElementIds.EBML_VERSION);
    }

    public long readVersion()
    {
        return mandatoryUnsigned(ElementIds.EBML_READ_VERSION);
    }

    public long maxIdLength()
    {
        return mandatoryUnsigned(ElementIds.EBML_MAX_ID_LENGTH);
    }

    public long maxSizeLength()
    {
        return mandatoryUnsigned(ElementIds.EBML_MAX_SIZE_LENGTH);
    }

    /**
     * Document type, {@code "webm"} or {@code "matroska"} in practice.
     */
    public String docType()
    {
        return mandatoryString(ElementIds.DOC_TYPE);
    }

    public long docTypeVersion()
    {
        return mandatoryUnsigned(ElementIds.DOC_TYPE_VERSION);
    }

    public long docTypeReadVersion()
    {
        return mandatoryUnsigned(ElementIds.DOC_TYPE_READ_VERSION);
    }
}
