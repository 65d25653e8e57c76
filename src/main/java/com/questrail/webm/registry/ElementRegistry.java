package com.questrail.webm.registry;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.questrail.webm.registry.ElementIds.*;
import static com.questrail.webm.registry.ElementKind.*;

/**
 * ElementRegistry
 * -----------------------------------------------------------------------------
 * Static, immutable mapping from element identifier to {@link ElementKind} and
 * diagnostic name.
 *
 * <p>The kind drives how the tree decoder treats an element: containers are
 * descended into, everything else is captured as payload bytes. Identifiers
 * absent from this table are {@link ElementKind#UNKNOWN} and kept as opaque
 * binary; that alone is never a decode failure.</p>
 *
 * <p>The tables are built once at class initialisation and never modified,
 * so lookups are safe from any thread.</p>
 */
public final class ElementRegistry
{
    private static final List<ElementInfo> ENTRIES = List.of(
            // EBML header
            entry(EBML_HEADER, CONTAINER, "EBML"),
            entry(EBML_VERSION, UNSIGNED_INT, "EBMLVersion"),
            entry(EBML_READ_VERSION, UNSIGNED_INT, "EBMLReadVersion"),
            entry(EBML_MAX_ID_LENGTH, UNSIGNED_INT, "EBMLMaxIDLength"),
            entry(EBML_MAX_SIZE_LENGTH, UNSIGNED_INT, "EBMLMaxSizeLength"),
            entry(DOC_TYPE, RESTRICTED_STRING, "DocType"),
            entry(DOC_TYPE_VERSION, UNSIGNED_INT, "DocTypeVersion"),
            entry(DOC_TYPE_READ_VERSION, UNSIGNED_INT, "DocTypeReadVersion"),

            // Global elements
            entry(CRC32, BINARY, "CRC-32"),
            entry(VOID, BINARY, "Void"),
            entry(SIGNATURE_SLOT, CONTAINER, "SignatureSlot"),
            entry(SIGNATURE_ALGO, UNSIGNED_INT, "SignatureAlgo"),
            entry(SIGNATURE_HASH, UNSIGNED_INT, "SignatureHash"),
            entry(SIGNATURE_PUBLIC_KEY, BINARY, "SignaturePublicKey"),
            entry(SIGNATURE, BINARY, "Signature"),
            entry(SIGNATURE_ELEMENTS, CONTAINER, "SignatureElements"),
            entry(SIGNATURE_ELEMENT_LIST, CONTAINER, "SignatureElementList"),
            entry(SIGNED_ELEMENT, BINARY, "SignedElement"),

            entry(SEGMENT, CONTAINER, "Segment"),

            // Seek index
            entry(SEEK_HEAD, CONTAINER, "SeekHead"),
            entry(SEEK, CONTAINER, "Seek"),
            entry(SEEK_ID, BINARY, "SeekID"),
            entry(SEEK_POSITION, UNSIGNED_INT, "SeekPosition"),

            // Segment information
            entry(INFO, CONTAINER, "Info"),
            entry(SEGMENT_UID, BINARY, "SegmentUID"),
            entry(TIMESTAMP_SCALE, UNSIGNED_INT, "TimestampScale"),
            entry(DURATION, FLOAT, "Duration"),
            entry(DATE_UTC, DATE, "DateUTC"),
            entry(TITLE, UTF8_STRING, "Title"),
            entry(MUXING_APP, UTF8_STRING, "MuxingApp"),
            entry(WRITING_APP, UTF8_STRING, "WritingApp"),

            // Clusters
            entry(CLUSTER, CONTAINER, "Cluster"),
            entry(TIMESTAMP, UNSIGNED_INT, "Timestamp"),
            entry(POSITION, UNSIGNED_INT, "Position"),
            entry(PREV_SIZE, UNSIGNED_INT, "PrevSize"),
            entry(SIMPLE_BLOCK, BINARY, "SimpleBlock"),
            entry(BLOCK_GROUP, CONTAINER, "BlockGroup"),
            entry(BLOCK, BINARY, "Block"),
            entry(BLOCK_DURATION, UNSIGNED_INT, "BlockDuration"),
            entry(REFERENCE_BLOCK, SIGNED_INT, "ReferenceBlock"),
            entry(DISCARD_PADDING, SIGNED_INT, "DiscardPadding"),
            entry(SLICES, CONTAINER, "Slices"),
            entry(TIME_SLICE, CONTAINER, "TimeSlice"),
            entry(LACE_NUMBER, UNSIGNED_INT, "LaceNumber"),

            // Tracks
            entry(TRACKS, CONTAINER, "Tracks"),
            entry(TRACK_ENTRY, CONTAINER, "TrackEntry"),
            entry(TRACK_NUMBER, UNSIGNED_INT, "TrackNumber"),
            entry(TRACK_UID, UNSIGNED_INT, "TrackUID"),
            entry(TRACK_TYPE, UNSIGNED_INT, "TrackType"),
            entry(FLAG_ENABLED, UNSIGNED_INT, "FlagEnabled"),
            entry(FLAG_DEFAULT, UNSIGNED_INT, "FlagDefault"),
            entry(FLAG_FORCED, UNSIGNED_INT, "FlagForced"),
            entry(FLAG_LACING, UNSIGNED_INT, "FlagLacing"),
            entry(DEFAULT_DURATION, UNSIGNED_INT, "DefaultDuration"),
            entry(TRACK_TIMESTAMP_SCALE, FLOAT, "TrackTimestampScale"),
            entry(NAME, UTF8_STRING, "Name"),
            entry(LANGUAGE, RESTRICTED_STRING, "Language"),
            entry(CODEC_ID, RESTRICTED_STRING, "CodecID"),
            entry(CODEC_PRIVATE, BINARY, "CodecPrivate"),
            entry(CODEC_NAME, UTF8_STRING, "CodecName"),
            entry(CODEC_DELAY, UNSIGNED_INT, "CodecDelay"),
            entry(SEEK_PRE_ROLL, UNSIGNED_INT, "SeekPreRoll"),

            // Video
            entry(VIDEO, CONTAINER, "Video"),
            entry(FLAG_INTERLACED, UNSIGNED_INT, "FlagInterlaced"),
            entry(STEREO_MODE, UNSIGNED_INT, "StereoMode"),
            entry(ALPHA_MODE, UNSIGNED_INT, "AlphaMode"),
            entry(PIXEL_WIDTH, UNSIGNED_INT, "PixelWidth"),
            entry(PIXEL_HEIGHT, UNSIGNED_INT, "PixelHeight"),
            entry(PIXEL_CROP_BOTTOM, UNSIGNED_INT, "PixelCropBottom"),
            entry(PIXEL_CROP_TOP, UNSIGNED_INT, "PixelCropTop"),
            entry(PIXEL_CROP_LEFT, UNSIGNED_INT, "PixelCropLeft"),
            entry(PIXEL_CROP_RIGHT, UNSIGNED_INT, "PixelCropRight"),
            entry(DISPLAY_WIDTH, UNSIGNED_INT, "DisplayWidth"),
            entry(DISPLAY_HEIGHT, UNSIGNED_INT, "DisplayHeight"),
            entry(DISPLAY_UNIT, UNSIGNED_INT, "DisplayUnit"),
            entry(ASPECT_RATIO_TYPE, UNSIGNED_INT, "AspectRatioType"),
            entry(PROJECTION, CONTAINER, "Projection"),
            entry(PROJECTION_TYPE, UNSIGNED_INT, "ProjectionType"),
            entry(PROJECTION_PRIVATE, BINARY, "ProjectionPrivate"),
            entry(PROJECTION_POSE_YAW, FLOAT, "ProjectionPoseYaw"),
            entry(PROJECTION_POSE_PITCH, FLOAT, "ProjectionPosePitch"),
            entry(PROJECTION_POSE_ROLL, FLOAT, "ProjectionPoseRoll"),

            // Audio
            entry(AUDIO, CONTAINER, "Audio"),
            entry(SAMPLING_FREQUENCY, FLOAT, "SamplingFrequency"),
            entry(OUTPUT_SAMPLING_FREQUENCY, FLOAT, "OutputSamplingFrequency"),
            entry(CHANNELS, UNSIGNED_INT, "Channels"),
            entry(BIT_DEPTH, UNSIGNED_INT, "BitDepth"),

            // Content encoding
            entry(CONTENT_ENCODINGS, CONTAINER, "ContentEncodings"),
            entry(CONTENT_ENCODING, CONTAINER, "ContentEncoding"),
            entry(CONTENT_ENCODING_ORDER, UNSIGNED_INT, "ContentEncodingOrder"),
            entry(CONTENT_ENCODING_SCOPE, UNSIGNED_INT, "ContentEncodingScope"),
            entry(CONTENT_ENCODING_TYPE, UNSIGNED_INT, "ContentEncodingType"),
            entry(CONTENT_ENCRYPTION, CONTAINER, "ContentEncryption"),
            entry(CONTENT_ENC_ALGO, UNSIGNED_INT, "ContentEncAlgo"),
            entry(CONTENT_ENC_KEY_ID, BINARY, "ContentEncKeyID"),
            entry(CONTENT_ENC_AES_SETTINGS, CONTAINER, "ContentEncAESSettings"),
            entry(AES_SETTINGS_CIPHER_MODE, UNSIGNED_INT, "AESSettingsCipherMode"),

            // Cues
            entry(CUES, CONTAINER, "Cues"),
            entry(CUE_POINT, CONTAINER, "CuePoint"),
            entry(CUE_TIME, UNSIGNED_INT, "CueTime"),
            entry(CUE_TRACK_POSITIONS, CONTAINER, "CueTrackPositions"),
            entry(CUE_TRACK, UNSIGNED_INT, "CueTrack"),
            entry(CUE_CLUSTER_POSITION, UNSIGNED_INT, "CueClusterPosition"),
            entry(CUE_RELATIVE_POSITION, UNSIGNED_INT, "CueRelativePosition"),
            entry(CUE_DURATION, UNSIGNED_INT, "CueDuration"),
            entry(CUE_BLOCK_NUMBER, UNSIGNED_INT, "CueBlockNumber"),

            // Chapters
            entry(CHAPTERS, CONTAINER, "Chapters"),
            entry(EDITION_ENTRY, CONTAINER, "EditionEntry"),
            entry(EDITION_UID, UNSIGNED_INT, "EditionUID"),
            entry(CHAPTER_ATOM, CONTAINER, "ChapterAtom"),
            entry(CHAPTER_UID, UNSIGNED_INT, "ChapterUID"),
            entry(CHAPTER_STRING_UID, UTF8_STRING, "ChapterStringUID"),
            entry(CHAPTER_TIME_START, UNSIGNED_INT, "ChapterTimeStart"),
            entry(CHAPTER_TIME_END, UNSIGNED_INT, "ChapterTimeEnd"),
            entry(CHAPTER_FLAG_HIDDEN, UNSIGNED_INT, "ChapterFlagHidden"),
            entry(CHAPTER_FLAG_ENABLED, UNSIGNED_INT, "ChapterFlagEnabled"),
            entry(CHAPTER_DISPLAY, CONTAINER, "ChapterDisplay"),
            entry(CHAP_STRING, UTF8_STRING, "ChapString"),
            entry(CHAP_LANGUAGE, RESTRICTED_STRING, "ChapLanguage"),

            // Tags
            entry(TAGS, CONTAINER, "Tags"),
            entry(TAG, CONTAINER, "Tag"),
            entry(TARGETS, CONTAINER, "Targets"),
            entry(TARGET_TYPE_VALUE, UNSIGNED_INT, "TargetTypeValue"),
            entry(TARGET_TYPE, RESTRICTED_STRING, "TargetType"),
            entry(TAG_TRACK_UID, UNSIGNED_INT, "TagTrackUID"),
            entry(TAG_CHAPTER_UID, UNSIGNED_INT, "TagChapterUID"),
            entry(SIMPLE_TAG, CONTAINER, "SimpleTag"),
            entry(TAG_NAME, UTF8_STRING, "TagName"),
            entry(TAG_LANGUAGE, RESTRICTED_STRING, "TagLanguage"),
            entry(TAG_DEFAULT, UNSIGNED_INT, "TagDefault"),
            entry(TAG_STRING, UTF8_STRING, "TagString"),
            entry(TAG_BINARY, BINARY, "TagBinary")
    );

    private static final Map<Long, ElementInfo> BY_ID = index(ENTRIES);

    private ElementRegistry() {}

    /**
     * Returns the schema kind of {@code id}, or {@link ElementKind#UNKNOWN}
     * if the identifier is not registered.
     */
    public static ElementKind kindOf(long id)
    {
        ElementInfo info = BY_ID.get(id);
        return info == null ? UNKNOWN : info.kind();
    }

    /**
     * Returns the diagnostic name of {@code id}, if registered.
     */
    public static Optional<String> nameOf(long id)
    {
        return lookup(id).map(ElementInfo::name);
    }

    public static Optional<ElementInfo> lookup(long id)
    {
        return Optional.ofNullable(BY_ID.get(id));
    }

    public static boolean isRegistered(long id)
    {
        return BY_ID.containsKey(id);
    }

    /**
     * Returns every registered entry, in schema order.
     */
    public static List<ElementInfo> entries()
    {
        return ENTRIES;
    }

    private static ElementInfo entry(long id, ElementKind kind, String name)
    {
        return new ElementInfo(id, kind, name);
    }

    private static Map<Long, ElementInfo> index(List<ElementInfo> entries)
    {
        Map<Long, ElementInfo> byId = new HashMap<>();
        for (ElementInfo info : entries) {
            if (byId.put(info.id(), info) != null) {
                throw new IllegalStateException("duplicate element id 0x" + Long.toHexString(info.id()));
            }
        }
        return Map.copyOf(byId);
    }
}
