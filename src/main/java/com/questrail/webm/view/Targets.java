package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Scope of a Tag. Empty uid lists mean the tag applies to the whole
 * Segment.
 */
public final class Targets extends ElementView
{
    Targets(Node node)
    {
        super(node);
    }

    public static Targets of(Node node)
    {
        return narrow(node, ElementIds.TARGETS, Targets::new);
    }

    public OptionalLong typeValue()
    {
        return optionalUnsigned(ElementIds.TARGET_TYPE_VALUE);
    }

    public Optional<String> type()
    {
        return optionalString(ElementIds.TARGET_TYPE);
    }

    public List<Long> trackUids()
    {
        return repeatedUnsigned(ElementIds.TAG_TRACK_UID);
    }

    public List<Long> chapterUids()
    {
        return repeatedUnsigned(ElementIds.TAG_CHAPTER_UID);
    }
}
