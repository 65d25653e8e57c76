package com.questrail.webm.decode;

/**
 * The stage of decoding at which an {@link EbmlDecodeException} was raised.
 */
public enum DecodeStage
{
    SIGNATURE_CHECK,
    VINT_READ,
    ELEMENT_READ,
    UTF8_DECODE,
    FIELD_LOOKUP
}
