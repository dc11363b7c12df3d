package me.golemcore.comfyagent.domain.events;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-session ordered event stream.
 *
 * <p>
 * Events are delivered synchronously, in emission order, to every listener of
 * the event's session and then to global listeners. Live clients consume
 * {@link #stream(String)}, which puts a bounded buffer in front of each
 * subscriber and drops the oldest entries when a consumer falls behind, so the
 * emitting agent loop is never blocked by a slow socket.
 */
@Component
@Slf4j
public class EventBus {

    private final Map<String, List<AgentEventListener>> sessionListeners = new ConcurrentHashMap<>();
    private final List<AgentEventListener> globalListeners = new CopyOnWriteArrayList<>();
    private final int subscriberBufferSize;
    private final Clock clock;

    @Autowired
    public EventBus(AgentProperties properties, Clock clock) {
        this(properties.getEvents().getSubscriberBuffer(), clock);
    }

    // Visible for testing
    public EventBus(int subscriberBufferSize, Clock clock) {
        if (subscriberBufferSize <= 0) {
            throw new IllegalArgumentException("subscriberBufferSize must be positive");
        }
        this.subscriberBufferSize = subscriberBufferSize;
        this.clock = clock;
    }

    public AgentEvent emit(String sessionId, AgentEventType type) {
        return emit(sessionId, type, Map.of());
    }

    public AgentEvent emit(String sessionId, AgentEventType type, Map<String, Object> data) {
        AgentEvent event = AgentEvent.builder()
                .type(type)
                .sessionId(sessionId)
                .timestamp(clock.instant())
                .data(data != null ? new LinkedHashMap<>(data) : Map.of())
                .build();
        publish(event);
        return event;
    }

    public void publish(AgentEvent event) {
        List<AgentEventListener> listeners = sessionListeners.get(event.sessionId());
        if (listeners != null) {
            for (AgentEventListener listener : listeners) {
                deliver(listener, event);
            }
        }
        for (AgentEventListener listener : globalListeners) {
            deliver(listener, event);
        }
    }

    public EventSubscription subscribe(String sessionId, AgentEventListener listener) {
        sessionListeners.computeIfAbsent(sessionId, id -> new CopyOnWriteArrayList<>()).add(listener);
        AtomicBoolean closed = new AtomicBoolean(false);
        return () -> {
            if (closed.compareAndSet(false, true)) {
                sessionListeners.computeIfPresent(sessionId, (id, list) -> {
                    list.remove(listener);
                    return list.isEmpty() ? null : list;
                });
            }
        };
    }

    public EventSubscription subscribeAll(AgentEventListener listener) {
        globalListeners.add(listener);
        return () -> globalListeners.remove(listener);
    }

    /**
     * Live view of one session's events with a bounded, drop-oldest buffer.
     */
    public Flux<AgentEvent> stream(String sessionId) {
        return Flux.<AgentEvent>create(sink -> {
            EventSubscription subscription = subscribe(sessionId, sink::next);
            sink.onDispose(subscription::close);
        }, FluxSink.OverflowStrategy.IGNORE)
                .onBackpressureBuffer(subscriberBufferSize,
                        dropped -> log.debug("[EventBus] Dropped {} for slow subscriber of session {}",
                                dropped.type().getWireName(), sessionId),
                        BufferOverflowStrategy.DROP_OLDEST);
    }

    public int subscriberCount(String sessionId) {
        List<AgentEventListener> listeners = sessionListeners.get(sessionId);
        return listeners != null ? listeners.size() : 0;
    }

    private void deliver(AgentEventListener listener, AgentEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) { // NOSONAR - one faulty listener must not break the stream
            log.warn("[EventBus] Listener failed for {}: {}", event.type().getWireName(), e.getMessage());
        }
    }
}
