package me.golemcore.comfyagent.domain.service;

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
import me.golemcore.comfyagent.domain.exception.TurnInProgressException;
import me.golemcore.comfyagent.domain.loop.AgentLoop;
import me.golemcore.comfyagent.domain.loop.AgentLoopFactory;
import me.golemcore.comfyagent.domain.model.CancellationToken;
import me.golemcore.comfyagent.domain.model.TurnOutcome;
import me.golemcore.comfyagent.port.outbound.SessionPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs turns on the agent executor with at most one turn per session.
 *
 * <p>
 * A chat for a session whose turn is still running is rejected with
 * {@link TurnInProgressException}. The session is released right before the
 * turn's terminal event, so a client may send its next chat as soon as it sees
 * one. Cancellation flips the running turn's token; the loop notices it at its
 * next checkpoint.
 */
@Service
@Slf4j
public class SessionRunCoordinator {

    private final SessionPort sessionPort;
    private final AgentLoop agentLoop;
    private final ExecutorService agentExecutor;

    private final Map<String, RunningTurn> running = new ConcurrentHashMap<>();

    private record RunningTurn(CancellationToken token, CompletableFuture<TurnOutcome> outcome) {
    }

    @Autowired
    public SessionRunCoordinator(SessionPort sessionPort, AgentLoopFactory agentLoopFactory,
            @Qualifier("agentExecutor") ExecutorService agentExecutor) {
        this(sessionPort, agentLoopFactory.createMainLoop(), agentExecutor);
    }

    // Visible for testing
    public SessionRunCoordinator(SessionPort sessionPort, AgentLoop agentLoop, ExecutorService agentExecutor) {
        this.sessionPort = sessionPort;
        this.agentLoop = agentLoop;
        this.agentExecutor = agentExecutor;
    }

    /**
     * Starts a turn in the background.
     *
     * @throws IllegalArgumentException
     *             if the session does not exist
     * @throws TurnInProgressException
     *             if the session already has a running turn
     */
    public CompletableFuture<TurnOutcome> submit(String sessionId, String userText) {
        if (sessionPort.get(sessionId).isEmpty()) {
            throw new IllegalArgumentException("Session not found: " + sessionId);
        }
        RunningTurn turn = new RunningTurn(new CancellationToken(), new CompletableFuture<>());
        if (running.putIfAbsent(sessionId, turn) != null) {
            throw new TurnInProgressException(sessionId);
        }
        try {
            agentExecutor.execute(() -> runTurn(sessionId, userText, turn));
        } catch (RejectedExecutionException e) {
            running.remove(sessionId, turn);
            throw e;
        }
        return turn.outcome();
    }

    /**
     * @return {@code true} if a running turn was asked to stop
     */
    public boolean cancel(String sessionId) {
        RunningTurn turn = running.get(sessionId);
        if (turn == null) {
            return false;
        }
        boolean changed = turn.token().cancel();
        log.info("[Coordinator] Cancel requested for session {} (already requested: {})", sessionId, !changed);
        return true;
    }

    public boolean isRunning(String sessionId) {
        return running.containsKey(sessionId);
    }

    private void runTurn(String sessionId, String userText, RunningTurn turn) {
        TurnOutcome outcome = null;
        RuntimeException failure = null;
        try {
            outcome = agentLoop.run(sessionId, userText, turn.token(), () -> running.remove(sessionId, turn));
        } catch (RuntimeException e) { // NOSONAR - must not kill executor thread
            log.error("[Coordinator] Turn crashed for session {}", sessionId, e);
            failure = e;
        } finally {
            running.remove(sessionId, turn);
        }
        if (failure != null) {
            turn.outcome().completeExceptionally(failure);
        } else {
            turn.outcome().complete(outcome);
        }
    }
}
