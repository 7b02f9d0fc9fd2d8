package com.eainde.council.events;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Buffers events for a consumer reading on another thread. Once the consumer {@link #close() disconnects},
 * further events are dropped while the run itself carries on.
 */
@Slf4j
public class QueueEventSink implements EventSink {

    private final BlockingQueue<CouncilEvent> queue = new LinkedBlockingQueue<>();
    private volatile boolean closed;

    @Override
    public void emit(CouncilEvent event) {
        if (closed) {
            log.debug("Consumer disconnected; dropping {} event", event.stage() != null ? event.stage() : event.type().value());
            return;
        }
        queue.offer(event);
    }

    /**
     * @return the next event, or empty when none arrived within {@code timeout}
     */
    public Optional<CouncilEvent> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public List<CouncilEvent> drain() {
        List<CouncilEvent> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }

    public void close() {
        closed = true;
        queue.clear();
    }

    public boolean isClosed() {
        return closed;
    }
}
