package com.questrail.webm.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of WebmObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jWebmObservabilitySink implements WebmObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jWebmObservabilitySink.class);

    @Override
    public void onUnknownElement(UnknownElementEvent event) {
        log.debug("Unregistered element 0x{} at offset {} ({} bytes) kept as binary",
            Long.toHexString(event.elementId()).toUpperCase(),
            event.offset(),
            event.declaredSize());
    }

    @Override
    public void onTrailingData(TrailingDataEvent event) {
        log.warn("{} byte(s) after the Segment at offset {} were not parsed",
            event.length(),
            event.offset());
    }

    @Override
    public void onParseCompleted(ParseCompletedEvent event) {
        log.info("Parsed {} document: {} nodes, {} bytes",
            event.docType(),
            event.nodeCount(),
            event.bytesConsumed());
    }

    @Override
    public void onError(WebmErrorEvent event) {
        log.error("WebM parse rejected: {}", event.message(), event.cause());
    }
}
