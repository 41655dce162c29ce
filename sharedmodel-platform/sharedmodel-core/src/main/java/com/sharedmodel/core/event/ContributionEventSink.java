package com.sharedmodel.core.event;

/**
 * Receives committed contribution events.
 */
@FunctionalInterface
public interface ContributionEventSink<S> {

    void publish(ContributionEvent<S> event);
}
