package com.questrail.webm.registry;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class ElementRegistryTest
{
    private static final long[] VIEW_CONTAINERS = {
            ElementIds.EBML_HEADER, ElementIds.SEGMENT, ElementIds.SEEK_HEAD, ElementIds.SEEK,
            ElementIds.INFO, ElementIds.CLUSTER, ElementIds.BLOCK_GROUP, ElementIds.SLICES,
            ElementIds.TIME_SLICE, ElementIds.TRACKS, ElementIds.TRACK_ENTRY, ElementIds.VIDEO,
            ElementIds.PROJECTION, ElementIds.AUDIO, ElementIds.CONTENT_ENCODINGS,
            ElementIds.CONTENT_ENCODING, ElementIds.CONTENT_ENCRYPTION, ElementIds.CONTENT_ENC_AES_SETTINGS,
            ElementIds.CUES, ElementIds.CUE_POINT, ElementIds.CUE_TRACK_POSITIONS, ElementIds.CHAPTERS,
            ElementIds.EDITION_ENTRY, ElementIds.CHAPTER_ATOM, ElementIds.CHAPTER_DISPLAY, ElementIds.TAGS,
            ElementIds.TAG, ElementIds.TARGETS, ElementIds.SIMPLE_TAG, ElementIds.SIGNATURE_SLOT,
            ElementIds.SIGNATURE_ELEMENTS, ElementIds.SIGNATURE_ELEMENT_LIST,
    };

    @Test
    void everyViewedElementIsAContainer()
    {
        for (long id : VIEW_CONTAINERS) {
            assertEquals(ElementKind.CONTAINER, ElementRegistry.kindOf(id), Long.toHexString(id));
        }
    }

    @Test
    void scalarKindsMatchTheSchema()
    {
        assertEquals(ElementKind.UNSIGNED_INT, ElementRegistry.kindOf(ElementIds.TIMESTAMP_SCALE));
        assertEquals(ElementKind.SIGNED_INT, ElementRegistry.kindOf(ElementIds.REFERENCE_BLOCK));
        assertEquals(ElementKind.FLOAT, ElementRegistry.kindOf(ElementIds.DURATION));
        assertEquals(ElementKind.RESTRICTED_STRING, ElementRegistry.kindOf(ElementIds.DOC_TYPE));
        assertEquals(ElementKind.UTF8_STRING, ElementRegistry.kindOf(ElementIds.TITLE));
        assertEquals(ElementKind.DATE, ElementRegistry.kindOf(ElementIds.DATE_UTC));
        assertEquals(ElementKind.BINARY, ElementRegistry.kindOf(ElementIds.SIMPLE_BLOCK));
        assertEquals(ElementKind.UNSIGNED_INT, ElementRegistry.kindOf(ElementIds.BLOCK_DURATION));
    }

    @Test
    void unregisteredIdentifiersAreUnknownNotErrors()
    {
        assertEquals(ElementKind.UNKNOWN, ElementRegistry.kindOf(0x4321L));
        assertTrue(ElementRegistry.nameOf(0x4321L).isEmpty());
        assertFalse(ElementRegistry.isRegistered(0x4321L));
    }

    @Test
    void namesAreAvailableForRegisteredIdentifiers()
    {
        assertEquals("EBML", ElementRegistry.nameOf(ElementIds.EBML_HEADER).orElseThrow());
        assertEquals("Segment", ElementRegistry.nameOf(ElementIds.SEGMENT).orElseThrow());
        assertEquals("TrackEntry", ElementRegistry.nameOf(ElementIds.TRACK_ENTRY).orElseThrow());
    }

    @Test
    void entriesAreUniqueAndImmutable()
    {
        Set<Long> seen = new HashSet<>();
        for (ElementInfo info : ElementRegistry.entries()) {
            assertTrue(seen.add(info.id()), "duplicate " + info.name());
            assertEquals(info, ElementRegistry.lookup(info.id()).orElseThrow());
        }
        assertTrue(seen.size() > 120);

        assertThrows(UnsupportedOperationException.class,
                () -> ElementRegistry.entries().add(new ElementInfo(1, ElementKind.BINARY, "x")));
    }

    @Test
    void elementInfoRejectsUnknownKind()
    {
        assertThrows(IllegalArgumentException.class, () -> new ElementInfo(1, ElementKind.UNKNOWN, "x"));
    }
}
