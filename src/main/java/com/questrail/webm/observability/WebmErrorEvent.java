package com.questrail.webm.observability;

import java.time.Instant;

/**
 * Record representing a rejected parse.
 */
public record WebmErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
