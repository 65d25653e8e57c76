package com.questrail.webm.codec;

import com.questrail.webm.decode.DecodeStage;
import com.questrail.webm.decode.EbmlDecodeException;
import com.questrail.webm.decode.EbmlErrorKind;
import com.questrail.webm.source.netty.NettyByteSource;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static com.questrail.webm.test.EbmlFixtures.bytes;
import static com.questrail.webm.test.EbmlFixtures.size;
import static org.junit.jupiter.api.Assertions.*;

final class EbmlVarIntsTest
{
    @Test
    void lengthPrefixFollowsLeadingZeroCount()
    {
        assertEquals(1, EbmlVarInts.vintLength(0x81));
        assertEquals(5, EbmlVarInts.vintLength(0x0E));
        assertEquals(8, EbmlVarInts.vintLength(0x01));
    }

    @Test
    void zeroFirstByteIsTreatedAsEightOctets()
    {
        assertEquals(8, EbmlVarInts.leadingZeroRunLength(0x00));
        assertEquals(8, EbmlVarInts.vintLength(0x00));
    }

    @Test
    void leadingZeroRunLengthCountsBitsBeforeFirstOne()
    {
        assertEquals(0, EbmlVarInts.leadingZeroRunLength(0xFF));
        assertEquals(1, EbmlVarInts.leadingZeroRunLength(0x40));
        assertEquals(7, EbmlVarInts.leadingZeroRunLength(0x01));
    }

    @Test
    void decodesBoundaryValuesFromRawBytes() throws IOException
    {
        assertEquals(0, read(bytes(0x80)));
        assertEquals(127, read(bytes(0xFF)));
        assertEquals(128, read(bytes(0x40, 0x80)));
        assertEquals(16383, read(bytes(0x7F, 0xFF)));
        assertEquals(16384, read(bytes(0x20, 0x40, 0x00)));
    }

    @Test
    void boundaryValuesLandInExpectedOctetClass() throws IOException
    {
        // 127 is the all-ones pattern of a one-octet vint, so it needs two.
        assertEquals(1, size(0).length);
        assertEquals(2, size(127).length);
        assertEquals(2, size(128).length);
        assertEquals(3, size(16383).length);
        assertEquals(3, size(16384).length);

        for (long v : new long[] {0, 127, 128, 16383, 16384, 1L << 40, (1L << 56) - 2}) {
            assertEquals(v, read(size(v)), "value " + v);
        }
    }

    @Test
    void consumesExactlyTheAnnouncedOctets() throws IOException
    {
        NettyByteSource source = NettyByteSource.wrap(bytes(0x40, 0x80, 0xAA));
        assertEquals(128, EbmlVarInts.readVint(source));
        assertEquals(2, source.position());
    }

    @Test
    void idKeepsMarkerBits() throws IOException
    {
        NettyByteSource source = NettyByteSource.wrap(bytes(0x1A, 0x45, 0xDF, 0xA3, 0xEC));
        assertEquals(0x1A45DFA3L, EbmlVarInts.readId(source));
        assertEquals(0xECL, EbmlVarInts.readId(source));
    }

    @Test
    void unknownSizePatternIsAllValueBitsSet()
    {
        assertTrue(EbmlVarInts.isUnknownSize(0x7F, 1));
        assertTrue(EbmlVarInts.isUnknownSize((1L << 56) - 1, 8));
        assertFalse(EbmlVarInts.isUnknownSize(0x7E, 1));
        assertFalse(EbmlVarInts.isUnknownSize(0x7F, 2));
        assertThrows(IllegalArgumentException.class, () -> EbmlVarInts.isUnknownSize(0, 9));
    }

    @Test
    void truncatedVintIsReported()
    {
        NettyByteSource source = NettyByteSource.wrap(bytes(0x20, 0x40));

        EbmlDecodeException e = assertThrows(EbmlDecodeException.class, () -> EbmlVarInts.readVint(source));
        assertEquals(EbmlErrorKind.TRUNCATED_INPUT, e.kind());
        assertEquals(DecodeStage.VINT_READ, e.stage());
    }

    @Test
    void readExactlyRejectsShortSource()
    {
        NettyByteSource source = NettyByteSource.wrap(bytes(1, 2, 3));

        EbmlDecodeException e = assertThrows(EbmlDecodeException.class,
                () -> EbmlVarInts.readExactly(source, 4, DecodeStage.ELEMENT_READ));
        assertEquals(EbmlErrorKind.TRUNCATED_INPUT, e.kind());
        assertEquals(DecodeStage.ELEMENT_READ, e.stage());
        assertEquals(0L, e.offset().orElseThrow());
    }

    private static long read(byte[] encoded) throws IOException
    {
        return EbmlVarInts.readVint(NettyByteSource.wrap(encoded));
    }
}
