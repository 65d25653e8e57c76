package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Segment information: timing scale, duration and muxer identification.
 */
public final class Info extends ElementView
{
    Info(Node node)
    {
        super(node);
    }

    public static Info of(Node node)
    {
        return narrow(node, ElementIds.INFO, Info::new);
    }

    /**
     * Nanoseconds per timestamp tick, 1000000 in virtually every file.
     */
    public long timestampScale()
    {
        return mandatoryUnsigned(ElementIds.TIMESTAMP_SCALE);
    }

    /**
     * Duration in timestamp ticks.
     */
    public OptionalDouble duration()
    {
        return optionalFloat(ElementIds.DURATION);
    }

    /**
     * Creation date as the raw signed nanosecond count since 2001-01-01.
     */
    public OptionalLong dateCreated()
    {
        return optionalSigned(ElementIds.DATE_UTC);
    }

    public Optional<Instant> dateCreatedInstant()
    {
        return optionalDate(ElementIds.DATE_UTC);
    }

    public String muxingApp()
    {
        return mandatoryString(ElementIds.MUXING_APP);
    }

    public String writingApp()
    {
        return mandatoryString(ElementIds.WRITING_APP);
    }

    public Optional<byte[]> segmentUid()
    {
        return optionalBinary(ElementIds.SEGMENT_UID);
    }

    public Optional<String> title()
    {
        return optionalString(ElementIds.TITLE);
    }
}
