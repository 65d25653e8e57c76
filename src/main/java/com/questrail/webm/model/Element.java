package com.questrail.webm.model;

import com.questrail.webm.decode.EbmlDecodeException;
import com.questrail.webm.registry.ElementKind;
import com.questrail.webm.registry.ElementRegistry;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One decoded element header plus its payload.
 *
 * <p>{@code data} is empty for containers, whose content lives in the
 * children of the enclosing {@link Node}. For every other kind it holds
 * exactly {@code declaredSize} bytes.</p>
 *
 * @param id           identifier as read from the wire, marker bits included
 * @param declaredSize payload size from the element header
 * @param kind         registry kind of {@code id}
 * @param data         payload bytes, empty for containers
 * @param offset       absolute stream offset of the first identifier byte
 * @param headerLength identifier octets plus size octets
 */
public record Element(long id,
                      long declaredSize,
                      ElementKind kind,
                      ElementData data,
                      long offset,
                      int headerLength)
{
    public Element {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(data, "data");
        if (declaredSize < 0) {
            throw new IllegalArgumentException("declaredSize must be >= 0");
        }
        if (kind.isContainer() && !data.isEmpty()) {
            throw new IllegalArgumentException("container elements carry no payload");
        }
        if (!kind.isContainer() && data.length() != declaredSize) {
            throw new IllegalArgumentException(
                    "payload length " + data.length() + " does not match declared size " + declaredSize);
        }
    }

    /**
     * Builds a leaf element that takes ownership of {@code payload}.
     */
    public static Element leaf(long id, ElementKind kind, byte[] payload, long offset, int headerLength)
    {
        return new Element(id, payload.length, kind, ElementData.adopt(payload), offset, headerLength);
    }

    public static Element container(long id, long declaredSize, long offset, int headerLength)
    {
        return new Element(id, declaredSize, ElementKind.CONTAINER, ElementData.EMPTY, offset, headerLength);
    }

    /**
     * Header plus payload length: the number of bytes this element occupies
     * in its parent.
     */
    public long encodedLength()
    {
        return headerLength + declaredSize;
    }

    /**
     * Offset of the first payload byte.
     */
    public long dataOffset()
    {
        return offset + headerLength;
    }

    public Optional<String> name()
    {
        return ElementRegistry.nameOf(id);
    }

    // ------------------------------------------------------------------------
    // Located conversions: failures carry this element's offset and id.
    // ------------------------------------------------------------------------

    public long unsignedValue()
    {
        return data.asUnsigned();
    }

    public long signedValue()
    {
        return data.asSigned();
    }

    public double floatValue()
    {
        return data.asFloat();
    }

    public boolean booleanValue()
    {
        return data.asBoolean();
    }

    public Instant dateValue()
    {
        return data.asDate();
    }

    public byte[] binaryValue()
    {
        return data.asBytes();
    }

    public String stringValue()
    {
        try {
            return data.asUtf8();
        }
        catch (EbmlDecodeException e) {
            throw e.at(offset, id);
        }
    }
}
