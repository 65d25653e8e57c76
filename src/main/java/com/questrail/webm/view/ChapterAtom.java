package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A single chapter. Chapters nest; {@link #chapterAtoms()} returns only the
 * immediate sub-chapters.
 *
 * <p>Times are in nanoseconds, unscaled.</p>
 */
public final class ChapterAtom extends ElementView
{
    ChapterAtom(Node node)
    {
        super(node);
    }

    public static ChapterAtom of(Node node)
    {
        return narrow(node, ElementIds.CHAPTER_ATOM, ChapterAtom::new);
    }

    public long uid()
    {
        return mandatoryUnsigned(ElementIds.CHAPTER_UID);
    }

    public Optional<String> stringUid()
    {
        return optionalString(ElementIds.CHAPTER_STRING_UID);
    }

    public long timeStart()
    {
        return mandatoryUnsigned(ElementIds.CHAPTER_TIME_START);
    }

    public OptionalLong timeEnd()
    {
        return optionalUnsigned(ElementIds.CHAPTER_TIME_END);
    }

    public Optional<Boolean> hidden()
    {
        return optionalFlag(ElementIds.CHAPTER_FLAG_HIDDEN);
    }

    public Optional<Boolean> enabled()
    {
        return optionalFlag(ElementIds.CHAPTER_FLAG_ENABLED);
    }

    public List<ChapterDisplay> displays()
    {
        return repeatedViews(ElementIds.CHAPTER_DISPLAY, ChapterDisplay::new);
    }

    public List<ChapterAtom> chapterAtoms()
    {
        return repeatedViews(ElementIds.CHAPTER_ATOM, ChapterAtom::new);
    }
}
