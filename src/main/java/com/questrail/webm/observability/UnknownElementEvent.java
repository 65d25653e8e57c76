package com.questrail.webm.observability;

import java.time.Instant;

/**
 * An element whose identifier is not in the registry.
 */
public record UnknownElementEvent(
    Instant timestamp,
    long elementId,
    long offset,
    long declaredSize
) {
}
