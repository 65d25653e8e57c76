package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.Optional;

public final class ContentEncryption extends ElementView
{
    ContentEncryption(Node node)
    {
        super(node);
    }

    public static ContentEncryption of(Node node)
    {
        return narrow(node, ElementIds.CONTENT_ENCRYPTION, ContentEncryption::new);
    }

    /**
     * 5 means AES.
     */
    public long algorithmType()
    {
        return mandatoryUnsigned(ElementIds.CONTENT_ENC_ALGO);
    }

    public Optional<byte[]> keyId()
    {
        return optionalBinary(ElementIds.CONTENT_ENC_KEY_ID);
    }

    public Optional<ContentEncAesSettings> aesSettings()
    {
        return optionalView(ElementIds.CONTENT_ENC_AES_SETTINGS, ContentEncAesSettings::new);
    }
}
