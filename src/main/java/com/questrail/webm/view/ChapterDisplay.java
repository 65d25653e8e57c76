package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;

public final class ChapterDisplay extends ElementView
{
    ChapterDisplay(Node node)
    {
        super(node);
    }

    public static ChapterDisplay of(Node node)
    {
        return narrow(node, ElementIds.CHAPTER_DISPLAY, ChapterDisplay::new);
    }

    public String string()
    {
        return mandatoryString(ElementIds.CHAP_STRING);
    }

    public List<String> languages()
    {
        return repeatedString(ElementIds.CHAP_LANGUAGE);
    }
}
