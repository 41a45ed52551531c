package dev.opscrew.domain.stream;

import dev.opscrew.domain.model.StreamEvent;

/**
 * Destination of the events a loop produces.
 */
@FunctionalInterface
public interface StreamEventSink {

    void emit(StreamEvent event);

    /**
     * Sink for delegated sub-agents, whose progress is not forwarded.
     */
    static StreamEventSink discarding() {
        return event -> {
        };
    }
}
