package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;

public final class Tracks extends ElementView
{
    Tracks(Node node)
    {
        super(node);
    }

    public static Tracks of(Node node)
    {
        return narrow(node, ElementIds.TRACKS, Tracks::new);
    }

    public List<TrackEntry> trackEntries()
    {
        return repeatedViews(ElementIds.TRACK_ENTRY, TrackEntry::new);
    }
}
