package com.questrail.webm.view;

import com.questrail.webm.registry.ElementIds;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.questrail.webm.test.EbmlFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

final class SegmentTest
{
    @Test
    void exposesEverySectionInDocumentOrder()
    {
        Segment segment = Segment.of(tree(master(ElementIds.SEGMENT,
                master(ElementIds.SEEK_HEAD,
                        master(ElementIds.SEEK,
                                binary(ElementIds.SEEK_ID, 0x15, 0x49, 0xA9, 0x66),
                                uint(ElementIds.SEEK_POSITION, 4096))),
                master(ElementIds.INFO, uint(ElementIds.TIMESTAMP_SCALE, 1_000_000)),
                master(ElementIds.TRACKS),
                master(ElementIds.CLUSTER, uint(ElementIds.TIMESTAMP, 0)),
                master(ElementIds.CLUSTER, uint(ElementIds.TIMESTAMP, 5000)),
                master(ElementIds.CUES),
                master(ElementIds.CHAPTERS),
                master(ElementIds.TAGS),
                master(ElementIds.SIGNATURE_SLOT))));

        assertEquals(1, segment.seekHeads().size());
        assertEquals(1, segment.infos().size());
        assertEquals(1, segment.tracks().size());
        assertEquals(List.of(0L, 5000L), List.of(
                segment.clusters().get(0).timestamp(),
                segment.clusters().get(1).timestamp()));
        assertEquals(1, segment.cues().size());
        assertEquals(1, segment.chapters().size());
        assertEquals(1, segment.tags().size());
        assertEquals(1, segment.signatureSlots().size());

        Seek seek = segment.seekHeads().get(0).seeks().get(0);
        assertArrayEquals(bytes(0x15, 0x49, 0xA9, 0x66), seek.seekId());
        assertEquals(ElementIds.INFO, seek.seekIdValue());
        assertEquals(4096, seek.seekPosition());
    }

    @Test
    void infoDecodesDatesAndFloats()
    {
        Info info = Info.of(tree(master(ElementIds.INFO,
                uint(ElementIds.TIMESTAMP_SCALE, 1_000_000),
                float64(ElementIds.DURATION, 12.5),
                sint(ElementIds.DATE_UTC, -1_000_000_000L),
                string(ElementIds.TITLE, "clip"),
                string(ElementIds.MUXING_APP, "libwebm"),
                string(ElementIds.WRITING_APP, "encoder"),
                binary(ElementIds.SEGMENT_UID, 1, 2, 3, 4))));

        assertEquals(12.5, info.duration().orElseThrow());
        assertEquals(-1_000_000_000L, info.dateCreated().orElseThrow());
        assertEquals(Instant.parse("2000-12-31T23:59:59Z"), info.dateCreatedInstant().orElseThrow());
        assertEquals("clip", info.title().orElseThrow());
        assertEquals("libwebm", info.muxingApp());
        assertEquals("encoder", info.writingApp());
        assertArrayEquals(bytes(1, 2, 3, 4), info.segmentUid().orElseThrow());
    }

    @Test
    void clusterExposesBlocks()
    {
        Cluster cluster = Cluster.of(tree(master(ElementIds.CLUSTER,
                uint(ElementIds.TIMESTAMP, 100),
                uint(ElementIds.PREV_SIZE, 512),
                binary(ElementIds.SIMPLE_BLOCK, 0x81, 0, 0, 0x80, 0xAA),
                binary(ElementIds.SIMPLE_BLOCK, 0x81, 0, 1, 0x00, 0xBB),
                master(ElementIds.BLOCK_GROUP,
                        binary(ElementIds.BLOCK, 0x81, 0, 2, 0x00),
                        uint(ElementIds.BLOCK_DURATION, 40),
                        sint(ElementIds.REFERENCE_BLOCK, -40),
                        sint(ElementIds.REFERENCE_BLOCK, 20),
                        sint(ElementIds.DISCARD_PADDING, -3),
                        master(ElementIds.SLICES,
                                master(ElementIds.TIME_SLICE, uint(ElementIds.LACE_NUMBER, 2)))))));

        assertEquals(100, cluster.timestamp());
        assertEquals(512, cluster.prevSize().orElseThrow());
        assertTrue(cluster.position().isEmpty());
        assertEquals(2, cluster.simpleBlocks().size());
        assertArrayEquals(bytes(0x81, 0, 1, 0x00, 0xBB), cluster.simpleBlocks().get(1));

        BlockGroup group = cluster.blockGroups().get(0);
        assertArrayEquals(bytes(0x81, 0, 2, 0x00), group.block());
        assertEquals(40, group.blockDuration().orElseThrow());
        assertEquals(List.of(-40L, 20L), group.referenceBlocks());
        assertEquals(-3, group.discardPadding().orElseThrow());
        assertEquals(2, group.slices().orElseThrow().timeSlices().get(0).laceNumber().orElseThrow());
    }

    @Test
    void cuesMapTimesToPositions()
    {
        Cues cues = Cues.of(tree(master(ElementIds.CUES,
                master(ElementIds.CUE_POINT,
                        uint(ElementIds.CUE_TIME, 0),
                        master(ElementIds.CUE_TRACK_POSITIONS,
                                uint(ElementIds.CUE_TRACK, 1),
                                uint(ElementIds.CUE_CLUSTER_POSITION, 300),
                                uint(ElementIds.CUE_RELATIVE_POSITION, 12))),
                master(ElementIds.CUE_POINT,
                        uint(ElementIds.CUE_TIME, 5000),
                        master(ElementIds.CUE_TRACK_POSITIONS,
                                uint(ElementIds.CUE_TRACK, 1),
                                uint(ElementIds.CUE_CLUSTER_POSITION, 90_000),
                                uint(ElementIds.CUE_BLOCK_NUMBER, 3),
                                uint(ElementIds.CUE_DURATION, 40))))));

        List<CuePoint> points = cues.cuePoints();
        assertEquals(2, points.size());

        CueTrackPositions first = points.get(0).trackPositions().get(0);
        assertEquals(1, first.track());
        assertEquals(300, first.clusterPosition());
        assertEquals(12, first.relativePosition().orElseThrow());
        assertTrue(first.blockNumber().isEmpty());

        CuePoint second = points.get(1);
        assertEquals(5000, second.time());
        assertEquals(3, second.trackPositions().get(0).blockNumber().orElseThrow());
        assertEquals(40, second.trackPositions().get(0).duration().orElseThrow());
    }

    @Test
    void chaptersNest()
    {
        Chapters chapters = Chapters.of(tree(master(ElementIds.CHAPTERS,
                master(ElementIds.EDITION_ENTRY,
                        uint(ElementIds.EDITION_UID, 7),
                        master(ElementIds.CHAPTER_ATOM,
                                uint(ElementIds.CHAPTER_UID, 1),
                                uint(ElementIds.CHAPTER_TIME_START, 0),
                                uint(ElementIds.CHAPTER_TIME_END, 1_000_000_000),
                                uint(ElementIds.CHAPTER_FLAG_HIDDEN, 0),
                                master(ElementIds.CHAPTER_DISPLAY,
                                        string(ElementIds.CHAP_STRING, "Intro"),
                                        string(ElementIds.CHAP_LANGUAGE, "eng"),
                                        string(ElementIds.CHAP_LANGUAGE, "fre")),
                                master(ElementIds.CHAPTER_ATOM,
                                        uint(ElementIds.CHAPTER_UID, 2),
                                        string(ElementIds.CHAPTER_STRING_UID, "sub"),
                                        uint(ElementIds.CHAPTER_TIME_START, 500)))))));

        EditionEntry edition = chapters.editionEntries().get(0);
        assertEquals(7, edition.editionUid().orElseThrow());
        assertEquals(1, edition.chapterAtoms().size());

        ChapterAtom intro = edition.chapterAtoms().get(0);
        assertEquals(1, intro.uid());
        assertEquals(0, intro.timeStart());
        assertEquals(1_000_000_000, intro.timeEnd().orElseThrow());
        assertFalse(intro.hidden().orElseThrow());
        assertTrue(intro.enabled().isEmpty());
        assertEquals("Intro", intro.displays().get(0).string());
        assertEquals(List.of("eng", "fre"), intro.displays().get(0).languages());

        ChapterAtom sub = intro.chapterAtoms().get(0);
        assertEquals(2, sub.uid());
        assertEquals("sub", sub.stringUid().orElseThrow());
        assertTrue(sub.chapterAtoms().isEmpty());
    }

    @Test
    void tagsCarryTargetsAndNestedSimpleTags()
    {
        Tags tags = Tags.of(tree(master(ElementIds.TAGS,
                master(ElementIds.TAG,
                        master(ElementIds.TARGETS,
                                uint(ElementIds.TARGET_TYPE_VALUE, 50),
                                string(ElementIds.TARGET_TYPE, "MOVIE"),
                                uint(ElementIds.TAG_TRACK_UID, 11),
                                uint(ElementIds.TAG_TRACK_UID, 12),
                                uint(ElementIds.TAG_CHAPTER_UID, 3)),
                        master(ElementIds.SIMPLE_TAG,
                                string(ElementIds.TAG_NAME, "ARTIST"),
                                string(ElementIds.TAG_LANGUAGE, "und"),
                                uint(ElementIds.TAG_DEFAULT, 1),
                                string(ElementIds.TAG_STRING, "Someone"),
                                master(ElementIds.SIMPLE_TAG,
                                        string(ElementIds.TAG_NAME, "SORT_WITH"),
                                        string(ElementIds.TAG_LANGUAGE, "und"),
                                        uint(ElementIds.TAG_DEFAULT, 0),
                                        binary(ElementIds.TAG_BINARY, 0xAB)))))));

        Tag tag = tags.tags().get(0);
        Targets targets = tag.targets();
        assertEquals(50, targets.typeValue().orElseThrow());
        assertEquals("MOVIE", targets.type().orElseThrow());
        assertEquals(List.of(11L, 12L), targets.trackUids());
        assertEquals(List.of(3L), targets.chapterUids());

        SimpleTag artist = tag.simpleTags().get(0);
        assertEquals("ARTIST", artist.name());
        assertEquals("und", artist.language());
        assertTrue(artist.isDefault());
        assertEquals("Someone", artist.string().orElseThrow());
        assertTrue(artist.binary().isEmpty());

        SimpleTag nested = artist.simpleTags().get(0);
        assertEquals("SORT_WITH", nested.name());
        assertFalse(nested.isDefault());
        assertArrayEquals(bytes(0xAB), nested.binary().orElseThrow());
    }

    @Test
    void signatureSlotIsExposedUnverified()
    {
        SignatureSlot slot = SignatureSlot.of(tree(master(ElementIds.SIGNATURE_SLOT,
                uint(ElementIds.SIGNATURE_ALGO, 1),
                uint(ElementIds.SIGNATURE_HASH, 2),
                binary(ElementIds.SIGNATURE, 0x01, 0x02),
                master(ElementIds.SIGNATURE_ELEMENTS,
                        master(ElementIds.SIGNATURE_ELEMENT_LIST,
                                binary(ElementIds.SIGNED_ELEMENT, 0x16, 0x54, 0xAE, 0x6B))))));

        assertEquals(1, slot.algorithm().orElseThrow());
        assertEquals(2, slot.hash().orElseThrow());
        assertTrue(slot.publicKey().isEmpty());
        assertArrayEquals(bytes(1, 2), slot.signature().orElseThrow());

        List<byte[]> signed = slot.signatureElements().orElseThrow()
                .elementLists().get(0).signedElements();
        assertArrayEquals(bytes(0x16, 0x54, 0xAE, 0x6B), signed.get(0));
    }
}
