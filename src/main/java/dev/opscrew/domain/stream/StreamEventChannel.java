/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package dev.opscrew.domain.stream;

import dev.opscrew.domain.model.StreamEvent;
import dev.opscrew.domain.model.StreamEventType;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded, ordered hand-off between the loop that produces events and the
 * transport that consumes them.
 *
 * <p>
 * The producer blocks while the buffer is full and gives up once the token is
 * cancelled. The consumer side ({@link #asFlux()}) completes right after the
 * {@code complete} event, or silently when the token is cancelled.
 */
@Slf4j
public class StreamEventChannel implements StreamEventSink {

    public static final int DEFAULT_CAPACITY = 256;
    private static final long POLL_INTERVAL_MS = 50;

    private final BlockingQueue<StreamEvent> queue;
    private final CancellationToken token;

    public StreamEventChannel(int capacity, CancellationToken token) {
        this.queue = new ArrayBlockingQueue<>(capacity > 0 ? capacity : DEFAULT_CAPACITY);
        this.token = token;
    }

    @Override
    public void emit(StreamEvent event) {
        try {
            while (!token.isCancelled()) {
                if (queue.offer(event, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
            log.debug("[Stream] Dropping {} event, invocation cancelled", event.type().wireName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
        }
    }

    /**
     * Consumer view, drained on a bounded-elastic worker. Each subscription
     * drains the same queue, so subscribe once.
     */
    public Flux<StreamEvent> asFlux() {
        return Flux.<StreamEvent>generate(sink -> {
            try {
                StreamEvent event = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                while (event == null) {
                    if (token.isCancelled()) {
                        sink.complete();
                        return;
                    }
                    event = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                }
                sink.next(event);
                if (event.type() == StreamEventType.COMPLETE) {
                    sink.complete();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sink.error(e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).doOnCancel(token::cancel);
    }

    public int buffered() {
        return queue.size();
    }
}
