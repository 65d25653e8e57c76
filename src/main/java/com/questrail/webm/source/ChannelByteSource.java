package com.questrail.webm.source;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.util.Objects;

/**
 * {@link EbmlByteSource} backed by a {@link SeekableByteChannel}, typically a
 * {@code FileChannel} opened by the caller.
 *
 * <p>The channel's own position is used as the cursor. The channel is not
 * closed by this adapter.</p>
 */
public final class ChannelByteSource implements EbmlByteSource
{
    private final SeekableByteChannel channel;

    public ChannelByteSource(SeekableByteChannel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public long position() throws IOException
    {
        return channel.position();
    }

    @Override
    public void seek(long position) throws IOException
    {
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0: " + position);
        }
        channel.position(position);
    }

    @Override
    public long size() throws IOException
    {
        return channel.size();
    }

    @Override
    public int read(byte[] dst, int offset, int length) throws IOException
    {
        if (length == 0) {
            return 0;
        }
        return channel.read(ByteBuffer.wrap(dst, offset, length));
    }
}
