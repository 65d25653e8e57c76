package com.questrail.webm.codec;

import com.questrail.webm.model.Node;
import com.questrail.webm.source.EbmlByteSource;

import java.io.IOException;

/**
 * EbmlTreeDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder from an EBML stream to a generic {@link Node} tree.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Reading element headers (identifier and declared size)</li>
 *   <li>Descending into container elements</li>
 *   <li>Capturing the payload bytes of every other element</li>
 *   <li>Detecting truncation and children that overrun their parent</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Checking the stream signature</li>
 *   <li>Interpreting schema semantics (mandatory fields, value meaning)</li>
 *   <li>Opening or closing the source</li>
 * </ul>
 */
public interface EbmlTreeDecoder
{
    /**
     * Decodes one element, with its whole subtree, starting at the source's
     * current position. On return the source is positioned just past the
     * element.
     *
     * @param source byte source positioned at an element header
     * @return the decoded subtree
     * @throws com.questrail.webm.decode.EbmlDecodeException if the element
     *         is malformed or truncated
     * @throws IOException if the source itself fails
     */
    Node decode(EbmlByteSource source) throws IOException;
}
