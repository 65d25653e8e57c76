package com.questrail.webm.codec;

import com.questrail.webm.decode.DecodeStage;
import com.questrail.webm.decode.EbmlDecodeException;
import com.questrail.webm.source.EbmlByteSource;

import java.io.IOException;

/**
 * EbmlVarInts
 * -----------------------------------------------------------------------------
 * Length-prefixed integer reading for EBML element headers.
 *
 * <p>An EBML variable-length integer ("vint") signals its own octet count by
 * the position of the first set bit in its first byte:</p>
 * <pre>
 *   1xxx xxxx                      1 octet,  7 value bits
 *   01xx xxxx xxxx xxxx            2 octets, 14 value bits
 *   ...
 *   0000 0001 xxxx ... xxxx        8 octets, 56 value bits
 * </pre>
 *
 * <p>Element sizes are vints with the marker bit masked off. Element
 * identifiers use the same length rule but keep the marker bit, so the
 * identifier {@code 0x1A45DFA3} is read as those four bytes verbatim.</p>
 */
public final class EbmlVarInts
{
    /** Largest octet count a vint may occupy. */
    public static final int MAX_LENGTH = 8;

    private EbmlVarInts() {}

    /**
     * Counts the zero bits before the first set bit of {@code b}.
     *
     * @return {@code 0..7}, or {@code 8} when {@code b == 0x00}
     */
    public static int leadingZeroRunLength(int b)
    {
        int v = b & 0xFF;
        if (v == 0) {
            return 8;
        }
        return Integer.numberOfLeadingZeros(v) - 24;
    }

    /**
     * Returns the octet count announced by the first byte of a vint.
     *
     * <p>A first byte of {@code 0x00} has no marker bit. It is treated as an
     * 8-octet vint whose first byte contributes no value bits.</p>
     *
     * @return {@code 1..8}
     */
    public static int vintLength(int firstByte)
    {
        return Math.min(leadingZeroRunLength(firstByte) + 1, MAX_LENGTH);
    }

    /**
     * Reads one vint with its length marker masked off.
     */
    public static long readVint(EbmlByteSource source) throws IOException
    {
        byte[] raw = readLengthPrefixed(source);
        int length = raw.length;
        int mask = (1 << (8 - length)) - 1;
        long value = raw[0] & mask;
        for (int i = 1; i < length; i++) {
            value = (value << 8) | (raw[i] & 0xFF);
        }
        return value;
    }

    /**
     * Reads one element identifier, marker bit included.
     */
    public static long readId(EbmlByteSource source) throws IOException
    {
        return EbmlPrimitives.bytesToUnsignedInt(readLengthPrefixed(source));
    }

    /**
     * Returns true if {@code value}, read as a vint of {@code length} octets,
     * has every value bit set. EBML reserves that pattern for "unknown size".
     */
    public static boolean isUnknownSize(long value, int length)
    {
        if (length < 1 || length > MAX_LENGTH) {
            throw new IllegalArgumentException("vint length must be 1-8: " + length);
        }
        return value == (1L << (7 * length)) - 1;
    }

    /**
     * Reads exactly {@code length} bytes.
     *
     * @throws EbmlDecodeException with kind {@code TRUNCATED_INPUT} if the
     *         source ends first
     */
    public static byte[] readExactly(EbmlByteSource source, int length, DecodeStage stage) throws IOException
    {
        final long start = source.position();
        final byte[] out = new byte[length];
        int filled = 0;
        while (filled < length) {
            int n = source.read(out, filled, length - filled);
            if (n < 0) {
                throw EbmlDecodeException.truncated(stage, start, length, filled);
            }
            filled += n;
        }
        return out;
    }

    private static byte[] readLengthPrefixed(EbmlByteSource source) throws IOException
    {
        final byte[] first = readExactly(source, 1, DecodeStage.VINT_READ);
        final int length = vintLength(first[0]);
        if (length == 1) {
            return first;
        }

        final byte[] rest = readExactly(source, length - 1, DecodeStage.VINT_READ);
        final byte[] raw = new byte[length];
        raw[0] = first[0];
        System.arraycopy(rest, 0, raw, 1, rest.length);
        return raw;
    }
}
