package com.questrail.webm.view;

import com.questrail.webm.decode.EbmlDecodeException;
import com.questrail.webm.model.Element;
import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementRegistry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.function.Function;

/**
 * ElementView
 * ============================================================================
 * Restricted, read-only facade over a generic {@link Node}.
 *
 * <h2>Architectural Role</h2>
 * A view exposes only the fields the schema defines for one container
 * element. Consumers navigate the document through views and never need to
 * reason about identifiers, payload bytes or element kinds.
 *
 * <h2>Lookup rules</h2>
 * Every getter inspects the node's <strong>direct children only</strong>.
 * Grandchildren are reached through sub-views. Four access patterns exist:
 *
 * <ul>
 *   <li><b>Mandatory</b>: the first matching child is decoded; absence throws
 *       {@link EbmlDecodeException} with kind
 *       {@code MISSING_MANDATORY_FIELD}</li>
 *   <li><b>Optional</b>: absence yields an empty {@code Optional*}</li>
 *   <li><b>Repeated</b>: all matching children in document order, possibly
 *       none</li>
 *   <li><b>Sub-view</b>: any of the above, wrapping the child node in its own
 *       view instead of decoding bytes</li>
 * </ul>
 *
 * <h2>Flags</h2>
 * Boolean fields are true only when the stored integer is exactly {@code 1}.
 * Other nonzero values read as false.
 *
 * <p>Views hold no state beyond their node and may be shared between
 * threads.</p>
 */
public abstract sealed class ElementView
        permits EbmlHeader, Segment, SeekHead, Seek, Info,
                Cluster, BlockGroup, Slices, TimeSlice,
                Tracks, TrackEntry, Video, Projection, Audio,
                ContentEncodings, ContentEncoding, ContentEncryption, ContentEncAesSettings,
                Cues, CuePoint, CueTrackPositions,
                Chapters, EditionEntry, ChapterAtom, ChapterDisplay,
                Tags, Tag, Targets, SimpleTag,
                SignatureSlot, SignatureElements, SignatureElementList
{
    private final Node node;

    ElementView(Node node)
    {
        this.node = Objects.requireNonNull(node, "node");
    }

    /**
     * Narrows a generic node to a view after checking its identifier.
     *
     * @throws IllegalArgumentException if the node has a different identifier
     */
    static <V extends ElementView> V narrow(Node node, long expectedId, Function<Node, V> wrap)
    {
        Objects.requireNonNull(node, "node");
        if (node.id() != expectedId) {
            throw new IllegalArgumentException("expected " + describe(expectedId)
                    + " but node is " + describe(node.id()));
        }
        return wrap.apply(node);
    }

    /**
     * The underlying generic node.
     */
    public final Node node()
    {
        return node;
    }

    public final Element element()
    {
        return node.element();
    }

    // ========================================================================
    // Child lookup
    // ========================================================================

    protected final Element requireChild(long id)
    {
        return node.firstChild(id)
                .map(Node::element)
                .orElseThrow(() -> EbmlDecodeException.missingField(node.id(), element().offset(), id));
    }

    protected final Optional<Element> optionalChild(long id)
    {
        return node.firstChild(id).map(Node::element);
    }

    protected final List<Element> repeatedChildren(long id)
    {
        List<Element> out = new ArrayList<>();
        for (Node child : node.childrenWithId(id)) {
            out.add(child.element());
        }
        return out;
    }

    // ========================================================================
    // Scalars
    // ========================================================================

    protected final long mandatoryUnsigned(long id)
    {
        return requireChild(id).unsignedValue();
    }

    protected final OptionalLong optionalUnsigned(long id)
    {
        Optional<Element> e = optionalChild(id);
        return e.isPresent() ? OptionalLong.of(e.get().unsignedValue()) : OptionalLong.empty();
    }

    protected final List<Long> repeatedUnsigned(long id)
    {
        List<Long> out = new ArrayList<>();
        for (Element e : repeatedChildren(id)) {
            out.add(e.unsignedValue());
        }
        return out;
    }

    protected final OptionalLong optionalSigned(long id)
    {
        Optional<Element> e = optionalChild(id);
        return e.isPresent() ? OptionalLong.of(e.get().signedValue()) : OptionalLong.empty();
    }

    protected final List<Long> repeatedSigned(long id)
    {
        List<Long> out = new ArrayList<>();
        for (Element e : repeatedChildren(id)) {
            out.add(e.signedValue());
        }
        return out;
    }

    protected final double mandatoryFloat(long id)
    {
        return requireChild(id).floatValue();
    }

    protected final OptionalDouble optionalFloat(long id)
    {
        Optional<Element> e = optionalChild(id);
        return e.isPresent() ? OptionalDouble.of(e.get().floatValue()) : OptionalDouble.empty();
    }

    protected final boolean mandatoryFlag(long id)
    {
        return requireChild(id).booleanValue();
    }

    protected final Optional<Boolean> optionalFlag(long id)
    {
        return optionalChild(id).map(Element::booleanValue);
    }

    protected final String mandatoryString(long id)
    {
        return requireChild(id).stringValue();
    }

    protected final Optional<String> optionalString(long id)
    {
        return optionalChild(id).map(Element::stringValue);
    }

    protected final List<String> repeatedString(long id)
    {
        List<String> out = new ArrayList<>();
        for (Element e : repeatedChildren(id)) {
            out.add(e.stringValue());
        }
        return out;
    }

    protected final byte[] mandatoryBinary(long id)
    {
        return requireChild(id).binaryValue();
    }

    protected final Optional<byte[]> optionalBinary(long id)
    {
        return optionalChild(id).map(Element::binaryValue);
    }

    protected final List<byte[]> repeatedBinary(long id)
    {
        List<byte[]> out = new ArrayList<>();
        for (Element e : repeatedChildren(id)) {
            out.add(e.binaryValue());
        }
        return out;
    }

    protected final Optional<Instant> optionalDate(long id)
    {
        return optionalChild(id).map(Element::dateValue);
    }

    // ========================================================================
    // Sub-views
    // ========================================================================

    protected final <V> V mandatoryView(long id, Function<Node, V> wrap)
    {
        Node child = node.firstChild(id)
                .orElseThrow(() -> EbmlDecodeException.missingField(node.id(), element().offset(), id));
        return wrap.apply(child);
    }

    protected final <V> Optional<V> optionalView(long id, Function<Node, V> wrap)
    {
        return node.firstChild(id).map(wrap);
    }

    protected final <V> List<V> repeatedViews(long id, Function<Node, V> wrap)
    {
        List<V> out = new ArrayList<>();
        for (Node child : node.childrenWithId(id)) {
            out.add(wrap.apply(child));
        }
        return out;
    }

    @Override
    public String toString()
    {
        return getClass().getSimpleName() + "[offset=" + element().offset()
                + ", size=" + element().declaredSize()
                + ", children=" + node.children().size() + ']';
    }

    private static String describe(long id)
    {
        return ElementRegistry.nameOf(id).orElse("element") + " (0x" + Long.toHexString(id).toUpperCase() + ")";
    }
}
