package com.questrail.webm.test;

import com.questrail.webm.codec.impl.DefaultEbmlTreeDecoder;
import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;
import com.questrail.webm.source.netty.NettyByteSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Builders for EBML byte streams used across the test suite.
 *
 * <p>Sizes are written with the shortest vint that does not collide with the
 * reserved unknown-size pattern.</p>
 */
public final class EbmlFixtures
{
    private EbmlFixtures() {}

    // ------------------------------------------------------------------------
    // Raw encodings
    // ------------------------------------------------------------------------

    /** Identifier bytes, marker included, as stored in the id constant. */
    public static byte[] id(long id)
    {
        int length = 1;
        while (length < 8 && (id >>> (8 * length)) != 0) {
            length++;
        }
        return bigEndian(id, length);
    }

    public static byte[] size(long size)
    {
        for (int length = 1; length <= 8; length++) {
            if (size < (1L << (7 * length)) - 1) {
                return sizeOfLength(size, length);
            }
        }
        throw new IllegalArgumentException("size does not fit a vint: " + size);
    }

    public static byte[] sizeOfLength(long size, int length)
    {
        return bigEndian(size | (1L << (7 * length)), length);
    }

    public static byte[] concat(byte[]... parts)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] p : parts) {
            out.writeBytes(p);
        }
        return out.toByteArray();
    }

    public static byte[] bytes(int... values)
    {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }

    // ------------------------------------------------------------------------
    // Elements
    // ------------------------------------------------------------------------

    public static byte[] element(long id, byte[] payload)
    {
        return concat(id(id), size(payload.length), payload);
    }

    public static byte[] master(long id, byte[]... children)
    {
        return element(id, concat(children));
    }

    public static byte[] uint(long id, long value)
    {
        int length = 1;
        while (length < 8 && (value >>> (8 * length)) != 0) {
            length++;
        }
        return element(id, bigEndian(value, length));
    }

    public static byte[] sint(long id, long value)
    {
        int length = 1;
        while (length < 8) {
            long shift = 64 - 8L * length;
            if (((value << shift) >> shift) == value) {
                break;
            }
            length++;
        }
        return element(id, bigEndian(value, length));
    }

    public static byte[] string(long id, String value)
    {
        return element(id, value.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] float64(long id, double value)
    {
        return element(id, ByteBuffer.allocate(8).putDouble(value).array());
    }

    public static byte[] float32(long id, float value)
    {
        return element(id, ByteBuffer.allocate(4).putFloat(value).array());
    }

    public static byte[] binary(long id, int... payload)
    {
        return element(id, bytes(payload));
    }

    // ------------------------------------------------------------------------
    // Documents
    // ------------------------------------------------------------------------

    public static byte[] minimalHeader()
    {
        return master(ElementIds.EBML_HEADER,
                uint(ElementIds.EBML_VERSION, 1),
                uint(ElementIds.EBML_READ_VERSION, 1),
                uint(ElementIds.EBML_MAX_ID_LENGTH, 4),
                uint(ElementIds.EBML_MAX_SIZE_LENGTH, 8),
                string(ElementIds.DOC_TYPE, "webm"),
                uint(ElementIds.DOC_TYPE_VERSION, 4),
                uint(ElementIds.DOC_TYPE_READ_VERSION, 2));
    }

    /**
     * Header plus a Segment holding one Info and one empty Tracks.
     */
    public static byte[] minimalDocument()
    {
        return concat(minimalHeader(),
                master(ElementIds.SEGMENT,
                        master(ElementIds.INFO,
                                uint(ElementIds.TIMESTAMP_SCALE, 1_000_000),
                                string(ElementIds.MUXING_APP, "test"),
                                string(ElementIds.WRITING_APP, "test")),
                        master(ElementIds.TRACKS)));
    }

    /** Decodes a single element tree from the start of {@code bytes}. */
    public static Node tree(byte[] bytes)
    {
        try {
            return new DefaultEbmlTreeDecoder().decode(NettyByteSource.wrap(bytes));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static byte[] bigEndian(long value, int length)
    {
        byte[] out = new byte[length];
        for (int i = length - 1; i >= 0; i--) {
            out[i] = (byte) value;
            value >>>= 8;
        }
        return out;
    }
}
