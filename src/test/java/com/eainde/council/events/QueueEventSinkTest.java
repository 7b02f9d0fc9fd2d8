package com.eainde.council.events;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QueueEventSinkTest {

    private final QueueEventSink sink = new QueueEventSink();

    @Test
    void deliversInEmissionOrder() throws InterruptedException {
        sink.emit(CouncilEvent.started(CouncilEvent.PARSING));
        sink.emit(CouncilEvent.completed(CouncilEvent.PARSING, Map.of("application_id", "app-1")));

        assertThat(sink.poll(Duration.ofMillis(10))).hasValueSatisfying(e -> {
            assertThat(e.stage()).isEqualTo("parsing");
            assertThat(e.status()).isEqualTo(CouncilEvent.Status.STARTED);
        });
        assertThat(sink.drain()).singleElement()
                .satisfies(e -> assertThat(e.payload()).containsEntry("application_id", "app-1"));
        assertThat(sink.poll(Duration.ofMillis(10))).isEmpty();
    }

    @Test
    void dropsEventsAfterDisconnect() {
        sink.emit(CouncilEvent.started(CouncilEvent.AGGREGATION));
        sink.close();
        sink.emit(CouncilEvent.finished(Map.of("recommendation", "approve")));

        assertThat(sink.isClosed()).isTrue();
        assertThat(sink.drain()).isEmpty();
    }

    @Test
    void terminalEvents() {
        assertThat(CouncilEvent.finished(Map.of()).isTerminal()).isTrue();
        assertThat(CouncilEvent.error("boom").isTerminal()).isTrue();
        assertThat(CouncilEvent.started(CouncilEvent.deliberationRound(2)).isTerminal()).isFalse();
        assertThat(CouncilEvent.deliberationRound(2)).isEqualTo("deliberation_round_2");
    }

    @Test
    void loggingSinkForwardsEveryEvent() {
        LoggingEventSink logging = new LoggingEventSink(sink);

        logging.emit(CouncilEvent.started(CouncilEvent.SYNTHESIS));
        logging.emit(CouncilEvent.error("gateway down"));

        assertThat(sink.drain()).extracting(CouncilEvent::type)
                .containsExactly(CouncilEvent.Type.STAGE, CouncilEvent.Type.ERROR);
    }
}
