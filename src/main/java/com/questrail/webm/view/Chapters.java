package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;

public final class Chapters extends ElementView
{
    Chapters(Node node)
    {
        super(node);
    }

    public static Chapters of(Node node)
    {
        return narrow(node, ElementIds.CHAPTERS, Chapters::new);
    }

    public List<EditionEntry> editionEntries()
    {
        return repeatedViews(ElementIds.EDITION_ENTRY, EditionEntry::new);
    }
}
