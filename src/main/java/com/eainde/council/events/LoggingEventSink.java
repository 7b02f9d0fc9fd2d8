package com.eainde.council.events;

import lombok.extern.slf4j.Slf4j;

/** Writes progress to the log, optionally forwarding to another sink. */
@Slf4j
public class LoggingEventSink implements EventSink {

    private final EventSink delegate;

    public LoggingEventSink() {
        this(EventSink.discarding());
    }

    public LoggingEventSink(EventSink delegate) {
        this.delegate = delegate;
    }

    @Override
    public void emit(CouncilEvent event) {
        switch (event.type()) {
            case STAGE -> log.info("[{}] {}", event.stage(), event.status().value());
            case COMPLETE -> log.info("Run complete: {}", event.payload());
            case ERROR -> log.warn("Run failed: {}", event.payload().get("message"));
        }
        delegate.emit(event);
    }
}
