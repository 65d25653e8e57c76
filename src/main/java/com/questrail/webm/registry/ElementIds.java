package com.questrail.webm.registry;

/**
 * Element identifiers of the WebM / Matroska schema, as read from the wire
 * (length marker bits included).
 */
public final class ElementIds
{
    private ElementIds() {}

    // EBML header
    public static final long EBML_HEADER = 0x1A45DFA3L;
    public static final long EBML_VERSION = 0x4286L;
    public static final long EBML_READ_VERSION = 0x42F7L;
    public static final long EBML_MAX_ID_LENGTH = 0x42F2L;
    public static final long EBML_MAX_SIZE_LENGTH = 0x42F3L;
    public static final long DOC_TYPE = 0x4282L;
    public static final long DOC_TYPE_VERSION = 0x4287L;
    public static final long DOC_TYPE_READ_VERSION = 0x4285L;

    // Global elements
    public static final long CRC32 = 0xBFL;
    public static final long VOID = 0xECL;
    public static final long SIGNATURE_SLOT = 0x1B538667L;
    public static final long SIGNATURE_ALGO = 0x7E8AL;
    public static final long SIGNATURE_HASH = 0x7E9AL;
    public static final long SIGNATURE_PUBLIC_KEY = 0x7EA5L;
    public static final long SIGNATURE = 0x7EB5L;
    public static final long SIGNATURE_ELEMENTS = 0x7E5BL;
    public static final long SIGNATURE_ELEMENT_LIST = 0x7E7BL;
    public static final long SIGNED_ELEMENT = 0x6532L;

    // Segment
    public static final long SEGMENT = 0x18538067L;

    // Seek index
    public static final long SEEK_HEAD = 0x114D9B74L;
    public static final long SEEK = 0x4DBBL;
    public static final long SEEK_ID = 0x53ABL;
    public static final long SEEK_POSITION = 0x53ACL;

    // Segment information
    public static final long INFO = 0x1549A966L;
    public static final long SEGMENT_UID = 0x73A4L;
    public static final long TIMESTAMP_SCALE = 0x2AD7B1L;
    public static final long DURATION = 0x4489L;
    public static final long DATE_UTC = 0x4461L;
    public static final long TITLE = 0x7BA9L;
    public static final long MUXING_APP = 0x4D80L;
    public static final long WRITING_APP = 0x5741L;

    // Clusters
    public static final long CLUSTER = 0x1F43B675L;
    public static final long TIMESTAMP = 0xE7L;
    public static final long POSITION = 0xA7L;
    public static final long PREV_SIZE = 0xABL;
    public static final long SIMPLE_BLOCK = 0xA3L;
    public static final long BLOCK_GROUP = 0xA0L;
    public static final long BLOCK = 0xA1L;
    public static final long BLOCK_DURATION = 0x9BL;
    public static final long REFERENCE_BLOCK = 0xFBL;
    public static final long DISCARD_PADDING = 0x75A2L;
    public static final long SLICES = 0x8EL;
    public static final long TIME_SLICE = 0xE8L;
    public static final long LACE_NUMBER = 0xCCL;

    // Tracks
    public static final long TRACKS = 0x1654AE6BL;
    public static final long TRACK_ENTRY = 0xAEL;
    public static final long TRACK_NUMBER = 0xD7L;
    public static final long TRACK_UID = 0x73C5L;
    public static final long TRACK_TYPE = 0x83L;
    public static final long FLAG_ENABLED = 0xB9L;
    public static final long FLAG_DEFAULT = 0x88L;
    public static final long FLAG_FORCED = 0x55AAL;
    public static final long FLAG_LACING = 0x9CL;
    public static final long DEFAULT_DURATION = 0x23E383L;
    public static final long TRACK_TIMESTAMP_SCALE = 0x23314FL;
    public static final long NAME = 0x536EL;
    public static final long LANGUAGE = 0x22B59CL;
    public static final long CODEC_ID = 0x86L;
    public static final long CODEC_PRIVATE = 0x63A2L;
    public static final long CODEC_NAME = 0x258688L;
    public static final long CODEC_DELAY = 0x56AAL;
    public static final long SEEK_PRE_ROLL = 0x56BBL;

    // Video
    public static final long VIDEO = 0xE0L;
    public static final long FLAG_INTERLACED = 0x9AL;
    public static final long STEREO_MODE = 0x53B8L;
    public static final long ALPHA_MODE = 0x53C0L;
    public static final long PIXEL_WIDTH = 0xB0L;
    public static final long PIXEL_HEIGHT = 0xBAL;
    public static final long PIXEL_CROP_BOTTOM = 0x54AAL;
    public static final long PIXEL_CROP_TOP = 0x54BBL;
    public static final long PIXEL_CROP_LEFT = 0x54CCL;
    public static final long PIXEL_CROP_RIGHT = 0x54DDL;
    public static final long DISPLAY_WIDTH = 0x54B0L;
    public static final long DISPLAY_HEIGHT = 0x54BAL;
    public static final long DISPLAY_UNIT = 0x54B2L;
    public static final long ASPECT_RATIO_TYPE = 0x54B3L;
    public static final long PROJECTION = 0x7670L;
    public static final long PROJECTION_TYPE = 0x7671L;
    public static final long PROJECTION_PRIVATE = 0x7672L;
    public static final long PROJECTION_POSE_YAW = 0x7673L;
    public static final long PROJECTION_POSE_PITCH = 0x7674L;
    public static final long PROJECTION_POSE_ROLL = 0x7675L;

    // Audio
    public static final long AUDIO = 0xE1L;
    public static final long SAMPLING_FREQUENCY = 0xB5L;
    public static final long OUTPUT_SAMPLING_FREQUENCY = 0x78B5L;
    public static final long CHANNELS = 0x9FL;
    public static final long BIT_DEPTH = 0x6264L;

    // Content encoding
    public static final long CONTENT_ENCODINGS = 0x6D80L;
    public static final long CONTENT_ENCODING = 0x6240L;
    public static final long CONTENT_ENCODING_ORDER = 0x5031L;
    public static final long CONTENT_ENCODING_SCOPE = 0x5032L;
    public static final long CONTENT_ENCODING_TYPE = 0x5033L;
    public static final long CONTENT_ENCRYPTION = 0x5035L;
    public static final long CONTENT_ENC_ALGO = 0x47E1L;
    public static final long CONTENT_ENC_KEY_ID = 0x47E2L;
    public static final long CONTENT_ENC_AES_SETTINGS = 0x47E7L;
    public static final long AES_SETTINGS_CIPHER_MODE = 0x47E8L;

    // Cues
    public static final long CUES = 0x1C53BB6BL;
    public static final long CUE_POINT = 0xBBL;
    public static final long CUE_TIME = 0xB3L;
    public static final long CUE_TRACK_POSITIONS = 0xB7L;
    public static final long CUE_TRACK = 0xF7L;
    public static final long CUE_CLUSTER_POSITION = 0xF1L;
    public static final long CUE_RELATIVE_POSITION = 0xF0L;
    public static final long CUE_DURATION = 0xB2L;
    public static final long CUE_BLOCK_NUMBER = 0x5378L;

    // Chapters
    public static final long CHAPTERS = 0x1043A770L;
    public static final long EDITION_ENTRY = 0x45B9L;
    public static final long EDITION_UID = 0x45BCL;
    public static final long CHAPTER_ATOM = 0xB6L;
    public static final long CHAPTER_UID = 0x73C4L;
    public static final long CHAPTER_STRING_UID = 0x5654L;
    public static final long CHAPTER_TIME_START = 0x91L;
    public static final long CHAPTER_TIME_END = 0x92L;
    public static final long CHAPTER_FLAG_HIDDEN = 0x98L;
    public static final long CHAPTER_FLAG_ENABLED = 0x4598L;
    public static final long CHAPTER_DISPLAY = 0x80L;
    public static final long CHAP_STRING = 0x85L;
    public static final long CHAP_LANGUAGE = 0x437CL;

    // Tags
    public static final long TAGS = 0x1254C367L;
    public static final long TAG = 0x7373L;
    public static final long TARGETS = 0x63C0L;
    public static final long TARGET_TYPE_VALUE = 0x68CAL;
    public static final long TARGET_TYPE = 0x63CAL;
    public static final long TAG_TRACK_UID = 0x63C5L;
    public static final long TAG_CHAPTER_UID = 0x63C4L;
    public static final long SIMPLE_TAG = 0x67C8L;
    public static final long TAG_NAME = 0x45A3L;
    public static final long TAG_LANGUAGE = 0x447AL;
    public static final long TAG_DEFAULT = 0x4484L;
    public static final long TAG_STRING = 0x4487L;
    public static final long TAG_BINARY = 0x4485L;
}
