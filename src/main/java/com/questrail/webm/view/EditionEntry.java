package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;
import java.util.OptionalLong;

public final class EditionEntry extends ElementView
{
    EditionEntry(Node node)
    {
        super(node);
    }

    public static EditionEntry of(Node node)
    {
        return narrow(node, ElementIds.EDITION_ENTRY, EditionEntry::new);
    }

    public OptionalLong editionUid()
    {
        return optionalUnsigned(ElementIds.EDITION_UID);
    }

    public List<ChapterAtom> chapterAtoms()
    {
        return repeatedViews(ElementIds.CHAPTER_ATOM, ChapterAtom::new);
    }
}
