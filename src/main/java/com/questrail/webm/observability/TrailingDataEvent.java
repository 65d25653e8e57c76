package com.questrail.webm.observability;

import java.time.Instant;

/**
 * Bytes found after the Segment element. Only one Segment is decoded per
 * stream; anything after it is left unparsed.
 */
public record TrailingDataEvent(
    Instant timestamp,
    long offset,
    long length
) {
}
