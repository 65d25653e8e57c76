package com.questrail.webm.observability;

import java.time.Instant;

/**
 * Summary of a successful parse.
 */
public record ParseCompletedEvent(
    Instant timestamp,
    String docType,
    int nodeCount,
    long bytesConsumed
) {
}
