package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.List;
import java.util.Objects;

/**
 * Segment
 * ============================================================================
 * Top-level container holding all media data and metadata of a document.
 *
 * <p>Every section is exposed as a list because the format allows each of
 * them to appear more than once (a second SeekHead, multiple Tags elements).
 * Sections are listed in document order.</p>
 *
 * <p>The document root is always wrapped as a Segment through
 * {@link #wrap(Node)}, even when its identifier differs. {@link #of(Node)}
 * is the checked variant for arbitrary nodes.</p>
 */
public final class Segment extends ElementView
{
    Segment(Node node)
    {
        super(node);
    }

    public static Segment of(Node node)
    {
        return narrow(node, ElementIds.SEGMENT, Segment::new);
    }

    /**
     * Wraps a node as a Segment without checking its identifier.
     */
    public static Segment wrap(Node node)
    {
        return new Segment(Objects.requireNonNull(node, "node"));
    }

    public List<SeekHead> seekHeads()
    {
        return repeatedViews(ElementIds.SEEK_HEAD, SeekHead::new);
    }

    public List<Info> infos()
    {
        return repeatedViews(ElementIds.INFO, Info::new);
    }

    public List<Cluster> clusters()
    {
        return repeatedViews(ElementIds.CLUSTER, Cluster::new);
    }

    public List<Tracks> tracks()
    {
        return repeatedViews(ElementIds.TRACKS, Tracks::new);
    }

    public List<Cues> cues()
    {
        return repeatedViews(ElementIds.CUES, Cues::new);
    }

    public List<Chapters> chapters()
    {
        return repeatedViews(ElementIds.CHAPTERS, Chapters::new);
    }

    public List<Tags> tags()
    {
        return repeatedViews(ElementIds.TAGS, Tags::new);
    }

    public List<SignatureSlot> signatureSlots()
    {
        return repeatedViews(ElementIds.SIGNATURE_SLOT, SignatureSlot::new);
    }
}
