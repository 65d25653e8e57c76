package com.questrail.webm.observability;

/**
 * No-op implementation of WebmObservabilitySink.
 */
public final class NullObservabilitySink implements WebmObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onUnknownElement(UnknownElementEvent event) {}

    @Override
    public void onTrailingData(TrailingDataEvent event) {}

    @Override
    public void onParseCompleted(ParseCompletedEvent event) {}

    @Override
    public void onError(WebmErrorEvent event) {}
}
