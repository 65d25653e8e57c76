package com.questrail.webm.observability;

/**
 * Receives observability events from the WebM reader.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run synchronously on the parsing thread and must not throw.</p>
 */
public interface WebmObservabilitySink {
    /**
     * Called when an element with an unregistered identifier is kept as opaque binary.
     * @param event the element details
     */
    void onUnknownElement(UnknownElementEvent event);

    /**
     * Called when bytes remain in the source after the Segment element.
     * @param event the trailing region
     */
    void onTrailingData(TrailingDataEvent event);

    /**
     * Called once a document has been fully decoded.
     * @param event summary of the parse
     */
    void onParseCompleted(ParseCompletedEvent event);

    /**
     * Called when a parse is rejected.
     * @param event the error event
     */
    void onError(WebmErrorEvent event);
}
