package com.questrail.flightdeck.observability;

/**
 * No-op implementation of ProgressSink.
 */
public final class NullProgressSink implements ProgressSink {
    public static final NullProgressSink INSTANCE = new NullProgressSink();

    private NullProgressSink() {}

    @Override
    public void onTransition(NodeTransition event) {}

    @Override
    public void onRunCompleted(RunCompleted event) {}

    @Override
    public void onError(RunErrorEvent event) {}
}
