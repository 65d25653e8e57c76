package com.questrail.webm.codec;

import com.questrail.webm.decode.EbmlDecodeException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * EbmlPrimitives
 * -----------------------------------------------------------------------------
 * Conversions from an element's exact payload bytes to scalar values.
 *
 * <p>All conversions are big-endian and operate on a complete payload whose
 * length is already known. A zero-length payload decodes to the EBML default
 * for its type: {@code 0}, {@code 0.0} or the empty string.</p>
 */
public final class EbmlPrimitives
{
    /** Origin of EBML dates: 2001-01-01T00:00:00 UTC. */
    public static final Instant EBML_EPOCH = Instant.parse("2001-01-01T00:00:00Z");

    private EbmlPrimitives() {}

    /**
     * Big-endian accumulate. Payloads longer than eight bytes keep only the
     * low-order 64 bits; the result is the unsigned bit pattern in a
     * {@code long}.
     */
    public static long bytesToUnsignedInt(byte[] bytes)
    {
        long result = 0;
        for (byte b : bytes) {
            result = (result << 8) | (b & 0xFF);
        }
        return result;
    }

    /**
     * Two's-complement decode, sign-extended from the payload's own width.
     * The sign is the top bit of the first byte.
     */
    public static long bytesToSignedInt(byte[] bytes)
    {
        if (bytes.length == 0) {
            return 0L;
        }
        long result = (bytes[0] & 0x80) != 0 ? -1L : 0L;
        for (byte b : bytes) {
            result = (result << 8) | (b & 0xFF);
        }
        return result;
    }

    /**
     * IEEE 754 big-endian: 64-bit if the payload is longer than four bytes,
     * otherwise 32-bit widened to {@code double}.
     */
    public static double bytesToFloat(byte[] bytes)
    {
        long bits = bytesToUnsignedInt(bytes);
        if (bytes.length > 4) {
            return Double.longBitsToDouble(bits);
        }
        return Float.intBitsToFloat((int) bits);
    }

    /**
     * Strict UTF-8 decode. Malformed or unmappable input is rejected rather
     * than replaced.
     *
     * @throws EbmlDecodeException with kind {@code INVALID_ENCODING}
     */
    public static String bytesToUtf8String(byte[] bytes)
    {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        }
        catch (CharacterCodingException e) {
            throw EbmlDecodeException.invalidEncoding(e);
        }
    }

    /**
     * Decodes an EBML date: signed nanoseconds relative to {@link #EBML_EPOCH}.
     */
    public static Instant bytesToDate(byte[] bytes)
    {
        return EBML_EPOCH.plusNanos(bytesToSignedInt(bytes));
    }

    /**
     * Interprets an unsigned integer as a flag. Only the exact value 1 is
     * true; other nonzero values are false.
     */
    public static boolean bytesToBoolean(byte[] bytes)
    {
        return bytesToUnsignedInt(bytes) == 1L;
    }
}
