package com.questrail.webm.source.netty;

import com.questrail.webm.source.EbmlByteSource;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.Objects;

/**
 * NettyByteSource
 * =============================================================================
 * {@link EbmlByteSource} over a Netty {@link ByteBuf}.
 *
 * <h2>Index handling</h2>
 * The adapter reads from a {@link ByteBuf#duplicate() duplicate} of the
 * caller's buffer, so the caller's reader and writer indexes are left
 * untouched. Position {@code 0} corresponds to the buffer's reader index at
 * construction time; the readable region at that moment is the whole source.
 *
 * <h2>Ownership</h2>
 * Reference counting stays with the caller. This adapter never retains or
 * releases the buffer, so the buffer must outlive the parse call.
 */
public final class NettyByteSource implements EbmlByteSource
{
    private final ByteBuf buffer;
    private final int base;
    private final int limit;

    public NettyByteSource(ByteBuf buffer)
    {
        ByteBuf source = Objects.requireNonNull(buffer, "buffer");
        this.buffer = source.duplicate();
        this.base = source.readerIndex();
        this.limit = source.writerIndex();
    }

    /**
     * Wraps a byte array without copying it.
     */
    public static NettyByteSource wrap(byte[] bytes)
    {
        return new NettyByteSource(Unpooled.wrappedBuffer(Objects.requireNonNull(bytes, "bytes")));
    }

    @Override
    public long position()
    {
        return buffer.readerIndex() - base;
    }

    @Override
    public void seek(long position)
    {
        if (position < 0 || position > size()) {
            throw new IllegalArgumentException("position out of range: " + position);
        }
        buffer.readerIndex(base + (int) position);
    }

    @Override
    public long size()
    {
        return limit - base;
    }

    @Override
    public int read(byte[] dst, int offset, int length)
    {
        if (length == 0) {
            return 0;
        }
        int available = limit - buffer.readerIndex();
        if (available <= 0) {
            return -1;
        }
        int n = Math.min(length, available);
        buffer.readBytes(dst, offset, n);
        return n;
    }
}
