package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * TrackEntry
 * ============================================================================
 * Describes one track: its number, type, codec and per-type settings.
 *
 * <h2>Flags</h2>
 * {@link #enabled()}, {@link #isDefault()}, {@link #forced()} and
 * {@link #laced()} are mandatory here. Files that rely on the format's
 * default values and omit them are rejected with
 * {@code MISSING_MANDATORY_FIELD}.
 *
 * <h2>Sub-views</h2>
 * A video track normally carries {@link Video}, an audio track {@link Audio}.
 * Neither is enforced against {@link #trackType()}.
 */
public final class TrackEntry extends ElementView
{
    /** TrackType value for video tracks. */
    public static final long TYPE_VIDEO = 1;

    /** TrackType value for audio tracks. */
    public static final long TYPE_AUDIO = 2;

    TrackEntry(Node node)
    {
        super(node);
    }

    public static TrackEntry of(Node node)
    {
        return narrow(node, ElementIds.TRACK_ENTRY, TrackEntry::new);
    }

    public long trackNumber()
    {
        return mandatoryUnsigned(ElementIds.TRACK_NUMBER);
    }

    public long trackUid()
    {
        return mandatoryUnsigned(ElementIds.TRACK_UID);
    }

    public long trackType()
    {
        return mandatoryUnsigned(ElementIds.TRACK_TYPE);
    }

    public boolean enabled()
    {
        return mandatoryFlag(ElementIds.FLAG_ENABLED);
    }

    public boolean isDefault()
    {
        return mandatoryFlag(ElementIds.FLAG_DEFAULT);
    }

    public boolean forced()
    {
        return mandatoryFlag(ElementIds.FLAG_FORCED);
    }

    public boolean laced()
    {
        return mandatoryFlag(ElementIds.FLAG_LACING);
    }

    /**
     * Nanoseconds per frame.
     */
    public OptionalLong defaultDuration()
    {
        return optionalUnsigned(ElementIds.DEFAULT_DURATION);
    }

    public Optional<String> name()
    {
        return optionalString(ElementIds.NAME);
    }

    public Optional<String> language()
    {
        return optionalString(ElementIds.LANGUAGE);
    }

    /**
     * Codec identifier such as {@code V_VP9} or {@code A_OPUS}.
     */
    public String codecId()
    {
        return mandatoryString(ElementIds.CODEC_ID);
    }

    public Optional<byte[]> codecPrivate()
    {
        return optionalBinary(ElementIds.CODEC_PRIVATE);
    }

    public Optional<String> codecName()
    {
        return optionalString(ElementIds.CODEC_NAME);
    }

    public OptionalLong codecDelay()
    {
        return optionalUnsigned(ElementIds.CODEC_DELAY);
    }

    public long seekPreRoll()
    {
        return mandatoryUnsigned(ElementIds.SEEK_PRE_ROLL);
    }

    public OptionalDouble trackTimestampScale()
    {
        return optionalFloat(ElementIds.TRACK_TIMESTAMP_SCALE);
    }

    public Optional<Video> video()
    {
        return optionalView(ElementIds.VIDEO, Video::new);
    }

    public Optional<Audio> audio()
    {
        return optionalView(ElementIds.AUDIO, Audio::new);
    }

    public Optional<ContentEncodings> contentEncodings()
    {
        return optionalView(ElementIds.CONTENT_ENCODINGS, ContentEncodings::new);
    }
}
