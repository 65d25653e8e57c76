package com.questrail.webm;

import com.questrail.webm.codec.EbmlTreeDecoder;
import com.questrail.webm.codec.impl.DefaultEbmlTreeDecoder;
import com.questrail.webm.config.WebmParserConfig;
import com.questrail.webm.decode.EbmlDecodeException;
import com.questrail.webm.internal.time.WallClock;
import com.questrail.webm.model.Node;
import com.questrail.webm.observability.ParseCompletedEvent;
import com.questrail.webm.observability.TrailingDataEvent;
import com.questrail.webm.observability.WebmErrorEvent;
import com.questrail.webm.observability.WebmObservabilitySink;
import com.questrail.webm.registry.ElementIds;
import com.questrail.webm.source.ChannelByteSource;
import com.questrail.webm.source.EbmlByteSource;
import com.questrail.webm.source.netty.NettyByteSource;
import com.questrail.webm.view.EbmlHeader;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.util.Arrays;
import java.util.Objects;

/**
 * WebmParser
 * -----------------------------------------------------------------------------
 * Entry point for reading a WebM / Matroska document.
 *
 * <h2>Procedure</h2>
 * <ol>
 *   <li>Verify the first four bytes are the EBML magic {@code 1A 45 DF A3}</li>
 *   <li>Rewind and decode the EBML header element tree</li>
 *   <li>Decode the next element tree as the Segment root</li>
 *   <li>Report any bytes left after the root as trailing data</li>
 * </ol>
 *
 * <p>The parser is stateless between calls and may be reused, including from
 * several threads at once with distinct sources. It never closes the source.
 * Decode failures are reported to the configured observability sink and then
 * rethrown; I/O failures of the source propagate unchanged.</p>
 */
public final class WebmParser
{
    private static final byte[] EBML_MAGIC = {0x1A, 0x45, (byte) 0xDF, (byte) 0xA3};

    private final EbmlTreeDecoder decoder;
    private final WebmObservabilitySink sink;
    private final WallClock clock;

    public WebmParser()
    {
        this(WebmParserConfig.defaults());
    }

    public WebmParser(WebmParserConfig config)
    {
        Objects.requireNonNull(config, "config");
        this.decoder = new DefaultEbmlTreeDecoder(config);
        this.sink = config.observabilitySink();
        this.clock = config.wallClock();
    }

    /**
     * Parses a document from the current contents of {@code source}, starting
     * at absolute offset 0.
     *
     * @throws EbmlDecodeException if the bytes are not a well-formed document
     * @throws IOException         if the source fails
     */
    public WebmDocument parse(EbmlByteSource source) throws IOException
    {
        Objects.requireNonNull(source, "source");
        try {
            return parseChecked(source);
        } catch (EbmlDecodeException e) {
            sink.onError(new WebmErrorEvent(clock.now(), e.getMessage(), e));
            throw e;
        }
    }

    /**
     * Parses an in-memory document.
     */
    public WebmDocument parse(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        return parseInMemory(NettyByteSource.wrap(bytes));
    }

    /**
     * Parses the readable bytes of {@code buffer}. The buffer's indices are
     * left untouched.
     */
    public WebmDocument parse(ByteBuf buffer)
    {
        Objects.requireNonNull(buffer, "buffer");
        return parseInMemory(new NettyByteSource(buffer));
    }

    public WebmDocument parse(SeekableByteChannel channel) throws IOException
    {
        return parse(new ChannelByteSource(channel));
    }

    /**
     * Like {@link #parse(EbmlByteSource)} but returns decode failures as a
     * {@link ParseOutcome.Rejected} value.
     *
     * @throws IOException if the source fails
     */
    public ParseOutcome tryParse(EbmlByteSource source) throws IOException
    {
        try {
            return new ParseOutcome.Parsed(parse(source));
        } catch (EbmlDecodeException e) {
            return new ParseOutcome.Rejected(e);
        }
    }

    public ParseOutcome tryParse(byte[] bytes)
    {
        try {
            return new ParseOutcome.Parsed(parse(bytes));
        } catch (EbmlDecodeException e) {
            return new ParseOutcome.Rejected(e);
        }
    }

    private WebmDocument parseInMemory(NettyByteSource source)
    {
        try {
            return parse(source);
        } catch (IOException e) {
            // NettyByteSource performs no I/O.
            throw new IllegalStateException("in-memory source failed", e);
        }
    }

    private WebmDocument parseChecked(EbmlByteSource source) throws IOException
    {
        checkSignature(source);
        source.seek(0);

        final Node header = decoder.decode(source);
        final Node root = decoder.decode(source);

        final long consumed = source.position();
        final long size = source.size();
        if (consumed < size) {
            sink.onTrailingData(new TrailingDataEvent(clock.now(), consumed, size - consumed));
        }

        final WebmDocument document = new WebmDocument(header, root);
        sink.onParseCompleted(new ParseCompletedEvent(
                clock.now(), docTypeOf(header), document.nodeCount(), consumed));
        return document;
    }

    private static void checkSignature(EbmlByteSource source) throws IOException
    {
        source.seek(0);
        final byte[] found = new byte[EBML_MAGIC.length];
        int filled = 0;
        while (filled < found.length) {
            final int n = source.read(found, filled, found.length - filled);
            if (n < 0) {
                break;
            }
            filled += n;
        }

        if (filled < found.length || !Arrays.equals(found, EBML_MAGIC)) {
            throw EbmlDecodeException.badSignature(ByteBufUtil.hexDump(found, 0, filled));
        }
    }

    // Summary only: a header without DocType is still a parsed document.
    private static String docTypeOf(Node header)
    {
        if (header.id() != ElementIds.EBML_HEADER) {
            return "unknown";
        }
        if (header.firstChild(ElementIds.DOC_TYPE).isEmpty()) {
            return "unknown";
        }
        try {
            return EbmlHeader.of(header).docType();
        } catch (EbmlDecodeException e) {
            return "invalid";
        }
    }
}
