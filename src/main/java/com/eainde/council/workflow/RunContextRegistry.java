package com.eainde.council.workflow;

import com.eainde.council.events.CouncilEvent;
import com.eainde.council.events.EventSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event sinks of the runs in flight, keyed by run id. Sinks are not serializable, so graph state carries
 * only the run id and nodes look the sink up here.
 */
@Slf4j
@Component
public class RunContextRegistry {

    private final Map<String, EventSink> sinks = new ConcurrentHashMap<>();

    public void open(String runId, EventSink sink) {
        sinks.put(runId, sink);
    }

    public void close(String runId) {
        sinks.remove(runId);
    }

    /** Emits to the run's sink. A sink that throws is logged and otherwise ignored. */
    public void emit(String runId, CouncilEvent event) {
        EventSink sink = sinks.get(runId);
        if (sink == null) {
            return;
        }
        try {
            sink.emit(event);
        } catch (RuntimeException e) {
            log.warn("Event sink for run {} rejected {} event", runId, event.type().value(), e);
        }
    }
}
