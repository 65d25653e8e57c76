package com.questrail.webm.codec.impl;

import com.questrail.webm.codec.EbmlTreeDecoder;
import com.questrail.webm.codec.EbmlVarInts;
import com.questrail.webm.config.WebmParserConfig;
import com.questrail.webm.decode.DecodeStage;
import com.questrail.webm.decode.EbmlDecodeException;
import com.questrail.webm.model.Element;
import com.questrail.webm.model.Node;
import com.questrail.webm.observability.UnknownElementEvent;
import com.questrail.webm.observability.WebmObservabilitySink;
import com.questrail.webm.internal.time.WallClock;
import com.questrail.webm.registry.ElementKind;
import com.questrail.webm.registry.ElementRegistry;
import com.questrail.webm.source.EbmlByteSource;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * DefaultEbmlTreeDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EbmlTreeDecoder}.
 *
 * <p>For each element the decoder performs, in order:</p>
 * <ol>
 *   <li>Read the identifier (length-prefixed, marker kept)</li>
 *   <li>Read the declared size (vint, marker masked)</li>
 *   <li>Reject the reserved unknown-size value</li>
 *   <li>Check the element ends within its parent</li>
 *   <li>Look up the kind; capture payload bytes unless it is a container</li>
 * </ol>
 *
 * <p>Containers are descended with an explicit work stack rather than
 * recursion, so hostile nesting is bounded by {@code maxDepth} and never by
 * the thread's stack size.</p>
 */
public final class DefaultEbmlTreeDecoder implements EbmlTreeDecoder
{
    private final int maxDepth;
    private final WebmObservabilitySink sink;
    private final WallClock clock;

    public DefaultEbmlTreeDecoder()
    {
        this(WebmParserConfig.defaults());
    }

    public DefaultEbmlTreeDecoder(WebmParserConfig config)
    {
        Objects.requireNonNull(config, "config");
        this.maxDepth = config.maxDepth();
        this.sink = config.observabilitySink();
        this.clock = config.wallClock();
    }

    @Override
    public Node decode(EbmlByteSource source) throws IOException
    {
        Objects.requireNonNull(source, "source");

        final Element first = readElement(source, null);
        if (!first.kind().isContainer()) {
            return Node.leaf(first);
        }

        final Deque<OpenContainer> open = new ArrayDeque<>();
        open.push(new OpenContainer(first));

        while (true) {
            final OpenContainer top = open.peek();

            if (source.position() == top.end) {
                open.pop();
                final Node closed = top.close();
                if (open.isEmpty()) {
                    return closed;
                }
                open.peek().children.add(closed);
                continue;
            }

            final Element child = readElement(source, top);
            if (child.kind().isContainer()) {
                if (open.size() >= maxDepth) {
                    throw EbmlDecodeException.nestingTooDeep(child.offset(), child.id(), maxDepth);
                }
                open.push(new OpenContainer(child));
            }
            else {
                top.children.add(Node.leaf(child));
            }
        }
    }

    /**
     * Reads one element header and, for non-containers, its payload.
     *
     * @param parent enclosing container, or {@code null} at top level
     */
    private Element readElement(EbmlByteSource source, OpenContainer parent) throws IOException
    {
        final long offset = source.position();
        final long id = EbmlVarInts.readId(source);

        final long sizeStart = source.position();
        final long size = EbmlVarInts.readVint(source);
        final long dataStart = source.position();
        final int sizeLength = (int) (dataStart - sizeStart);
        final int headerLength = (int) (dataStart - offset);

        if (EbmlVarInts.isUnknownSize(size, sizeLength)) {
            throw EbmlDecodeException.unsupportedSize(offset, id, "unknown-size elements are not supported");
        }

        final long end = dataStart + size;
        if (parent != null && end > parent.end) {
            throw EbmlDecodeException.spanMismatch(offset, id, end, parent.end);
        }

        final ElementKind kind = ElementRegistry.kindOf(id);
        if (kind.isContainer()) {
            return Element.container(id, size, offset, headerLength);
        }

        if (kind == ElementKind.UNKNOWN) {
            sink.onUnknownElement(new UnknownElementEvent(clock.now(), id, offset, size));
        }

        final long available = Math.max(0L, source.size() - dataStart);
        if (size > available) {
            throw EbmlDecodeException.truncatedPayload(offset, id, size, available);
        }
        if (size > Integer.MAX_VALUE - 8) {
            throw EbmlDecodeException.unsupportedSize(offset, id, "payload of " + size + " bytes is too large");
        }

        final byte[] payload = EbmlVarInts.readExactly(source, (int) size, DecodeStage.ELEMENT_READ);
        return Element.leaf(id, kind, payload, offset, headerLength);
    }

    /**
     * A container whose children are still being read.
     */
    private static final class OpenContainer
    {
        final Element element;
        final long end;
        final List<Node> children = new ArrayList<>();

        OpenContainer(Element element)
        {
            this.element = element;
            this.end = element.dataOffset() + element.declaredSize();
        }

        Node close()
        {
            return new Node(element, children);
        }
    }
}
