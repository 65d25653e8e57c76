package com.questrail.webm.model;

import com.questrail.webm.registry.ElementIds;
import com.questrail.webm.registry.ElementKind;
import org.junit.jupiter.api.Test;

import static com.questrail.webm.test.EbmlFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

final class NodeFormatterTest
{
    @Test
    void rendersOneIndentedLinePerNode()
    {
        Node info = tree(master(ElementIds.INFO,
                uint(ElementIds.TIMESTAMP_SCALE, 1_000_000),
                string(ElementIds.MUXING_APP, "mux")));

        String expected = String.join("\n",
                "Info [0x1549A966] size=13",
                "  TimestampScale [0x2AD7B1] size=3 value=1000000",
                "  MuxingApp [0x4D80] size=3 value=\"mux\"");

        assertEquals(expected, NodeFormatter.format(info));
        assertEquals(expected, info.toString());
    }

    @Test
    void unsignedValuesRenderAsUnsigned()
    {
        Element e = Element.leaf(ElementIds.TRACK_UID, ElementKind.UNSIGNED_INT,
                bytes(0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF), 0, 3);

        assertTrue(NodeFormatter.formatElement(e).endsWith("value=18446744073709551615"));
    }

    @Test
    void unknownElementsRenderAsHex()
    {
        Element e = Element.leaf(0x4321L, ElementKind.UNKNOWN, bytes(0xCA, 0xFE), 0, 3);

        assertEquals("Unknown [0x4321] size=2 value=0xcafe", NodeFormatter.formatElement(e));
    }

    @Test
    void invalidUtf8DoesNotFailTheRender()
    {
        Element e = Element.leaf(ElementIds.TITLE, ElementKind.UTF8_STRING, bytes(0xC3, 0x28), 0, 3);

        assertEquals("Title [0x7BA9] size=2 value=<invalid utf-8> 0xc328", NodeFormatter.formatElement(e));
    }

    @Test
    void datesRenderAsIsoInstant()
    {
        Element e = Element.leaf(ElementIds.DATE_UTC, ElementKind.DATE, bytes(0), 0, 3);

        assertEquals("DateUTC [0x4461] size=1 value=2001-01-01T00:00:00Z", NodeFormatter.formatElement(e));
    }
}
