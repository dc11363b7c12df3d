package me.golemcore.comfyagent.adapter.inbound.web;

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

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Outbound side of one WebSocket connection.
 *
 * <p>
 * Direct replies go through a control sink. Each followed session contributes
 * its own event stream, merged with backpressure so that a slow client only
 * loses the oldest buffered events of that session and never blocks the agent
 * loop.
 */
class LiveConnection {

    private final String id;
    private final Sinks.Many<String> control = Sinks.many().unicast().onBackpressureBuffer();
    private final Sinks.Many<Flux<String>> streams = Sinks.many().unicast().onBackpressureBuffer();
    private final Sinks.Empty<Void> closed = Sinks.empty();
    private final Set<String> followed = ConcurrentHashMap.newKeySet();

    LiveConnection(String id) {
        this.id = id;
    }

    String getId() {
        return id;
    }

    Flux<String> outbound() {
        return Flux.merge(control.asFlux(), streams.asFlux().flatMap(stream -> stream));
    }

    synchronized void send(String json) {
        control.tryEmitNext(json);
    }

    /**
     * Attaches a session's event stream once per connection.
     *
     * @return {@code false} if the session was already followed
     */
    synchronized boolean follow(String sessionId, Flux<String> events) {
        if (!followed.add(sessionId)) {
            return false;
        }
        streams.tryEmitNext(events.takeUntilOther(closed.asMono()));
        return true;
    }

    boolean isFollowing(String sessionId) {
        return followed.contains(sessionId);
    }

    synchronized void close() {
        closed.tryEmitEmpty();
        control.tryEmitComplete();
        streams.tryEmitComplete();
    }
}
