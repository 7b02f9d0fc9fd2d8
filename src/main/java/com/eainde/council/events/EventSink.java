package com.eainde.council.events;

/**
 * Receives the events of one run, in order. Implementations must not throw back into the pipeline.
 */
@FunctionalInterface
public interface EventSink {

    void emit(CouncilEvent event);

    /** A sink for callers that do not follow progress. */
    static EventSink discarding() {
        return event -> { };
    }
}
