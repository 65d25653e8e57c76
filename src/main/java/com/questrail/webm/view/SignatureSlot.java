package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Digital signature over parts of the Segment. Signatures are exposed,
 * never verified.
 */
public final class SignatureSlot extends ElementView
{
    SignatureSlot(Node node)
    {
        super(node);
    }

    public static SignatureSlot of(Node node)
    {
        return narrow(node, ElementIds.SIGNATURE_SLOT, SignatureSlot::new);
    }

    public OptionalLong algorithm()
    {
        return optionalUnsigned(ElementIds.SIGNATURE_ALGO);
    }

    public OptionalLong hash()
    {
        return optionalUnsigned(ElementIds.SIGNATURE_HASH);
    }

    public Optional<byte[]> publicKey()
    {
        return optionalBinary(ElementIds.SIGNATURE_PUBLIC_KEY);
    }

    public Optional<byte[]> signature()
    {
        return optionalBinary(ElementIds.SIGNATURE);
    }

    public Optional<SignatureElements> signatureElements()
    {
        return optionalView(ElementIds.SIGNATURE_ELEMENTS, SignatureElements::new);
    }
}
