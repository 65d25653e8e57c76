package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

public final class ContentEncAesSettings extends ElementView
{
    ContentEncAesSettings(Node node)
    {
        super(node);
    }

    public static ContentEncAesSettings of(Node node)
    {
        return narrow(node, ElementIds.CONTENT_ENC_AES_SETTINGS, ContentEncAesSettings::new);
    }

    public long cipherMode()
    {
        return mandatoryUnsigned(ElementIds.AES_SETTINGS_CIPHER_MODE);
    }
}
