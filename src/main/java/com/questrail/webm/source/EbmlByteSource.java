package com.questrail.webm.source;

import java.io.IOException;

/**
 * EbmlByteSource
 * -----------------------------------------------------------------------------
 * Minimal port for a seekable, readable byte source.
 *
 * <p>The reader needs nothing more than exact reads and absolute seeks on a
 * single cursor. Opening files or sockets is the embedding application's
 * concern; implementations only adapt an already opened resource.</p>
 *
 * <p>Implementations may be backed by a {@code SeekableByteChannel}, a Netty
 * {@code ByteBuf}, or a test fixture.</p>
 *
 * <p>Sources are not thread-safe. A source is owned by one parse call for the
 * duration of that call and is never closed by the reader.</p>
 */
public interface EbmlByteSource
{
    /**
     * Returns the current absolute read position.
     */
    long position() throws IOException;

    /**
     * Moves the read position to an absolute offset.
     *
     * @param position offset from the start of the source, {@code 0..size()}
     */
    void seek(long position) throws IOException;

    /**
     * Returns the total number of bytes in the source.
     */
    long size() throws IOException;

    /**
     * Reads up to {@code length} bytes into {@code dst}.
     *
     * <p>Like {@link java.io.InputStream#read(byte[], int, int)}, this may
     * return fewer bytes than requested. Callers that need an exact count
     * loop until satisfied.</p>
     *
     * @return the number of bytes read, or {@code -1} at end of source
     */
    int read(byte[] dst, int offset, int length) throws IOException;
}
