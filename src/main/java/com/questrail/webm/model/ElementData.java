package com.questrail.webm.model;

import com.questrail.webm.codec.EbmlPrimitives;
import io.netty.buffer.ByteBufUtil;

import java.time.Instant;
import java.util.Arrays;

/**
 * ElementData
 * -----------------------------------------------------------------------------
 * Immutable payload of a non-container element.
 *
 * <p>Every conversion is repeatable and non-destructive: the same bytes may be
 * read as an unsigned integer, a string, or raw bytes any number of times.
 * Which conversion is <em>meaningful</em> is decided by the element's
 * registry kind, not by this class.</p>
 *
 * <p>Immutability is enforced via defensive copying.</p>
 */
public final class ElementData
{
    public static final ElementData EMPTY = new ElementData(new byte[0]);

    private final byte[] bytes;

    private ElementData(byte[] bytes)
    {
        this.bytes = bytes;
    }

    public static ElementData of(byte[] bytes)
    {
        return bytes.length == 0 ? EMPTY : new ElementData(bytes.clone());
    }

    /**
     * Takes ownership of {@code bytes} without copying. The caller must not
     * modify the array afterwards.
     */
    static ElementData adopt(byte[] bytes)
    {
        return bytes.length == 0 ? EMPTY : new ElementData(bytes);
    }

    public int length()
    {
        return bytes.length;
    }

    public boolean isEmpty()
    {
        return bytes.length == 0;
    }

    public long asUnsigned()
    {
        return EbmlPrimitives.bytesToUnsignedInt(bytes);
    }

    public long asSigned()
    {
        return EbmlPrimitives.bytesToSignedInt(bytes);
    }

    public double asFloat()
    {
        return EbmlPrimitives.bytesToFloat(bytes);
    }

    /**
     * @throws com.questrail.webm.decode.EbmlDecodeException if the payload is
     *         not valid UTF-8
     */
    public String asUtf8()
    {
        return EbmlPrimitives.bytesToUtf8String(bytes);
    }

    public Instant asDate()
    {
        return EbmlPrimitives.bytesToDate(bytes);
    }

    /**
     * True only if the payload decodes to exactly 1.
     */
    public boolean asBoolean()
    {
        return EbmlPrimitives.bytesToBoolean(bytes);
    }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] asBytes()
    {
        return bytes.clone();
    }

    public String hexDump()
    {
        return ByteBufUtil.hexDump(bytes);
    }

    @Override
    public boolean equals(Object o)
    {
        return this == o || (o instanceof ElementData other && Arrays.equals(bytes, other.bytes));
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString()
    {
        return "ElementData[length=" + bytes.length + ']';
    }
}
