package me.golemcore.comfyagent.adapter.inbound.web;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.comfyagent.domain.events.AgentEvent;
import me.golemcore.comfyagent.domain.events.AgentEventType;
import me.golemcore.comfyagent.domain.events.EventBus;
import me.golemcore.comfyagent.domain.exception.PersistenceException;
import me.golemcore.comfyagent.domain.exception.TurnInProgressException;
import me.golemcore.comfyagent.domain.model.Session;
import me.golemcore.comfyagent.domain.service.SessionRunCoordinator;
import me.golemcore.comfyagent.infrastructure.config.AutoConfiguration;
import me.golemcore.comfyagent.port.outbound.SessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SessionGatewayHandlerTest {

    private static final String SESSION_ID = "session-1";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private SessionPort sessionPort;
    private SessionRunCoordinator coordinator;
    private EventBus eventBus;
    private ObjectMapper objectMapper;
    private SessionGatewayHandler handler;
    private LiveConnection connection;

    @BeforeEach
    void setUp() {
        sessionPort = mock(SessionPort.class);
        coordinator = mock(SessionRunCoordinator.class);
        eventBus = new EventBus(64, Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC")));
        objectMapper = AutoConfiguration.objectMapper();
        handler = new SessionGatewayHandler(sessionPort, coordinator, eventBus, objectMapper);
        connection = new LiveConnection("conn-1");

        when(sessionPort.get(SESSION_ID)).thenReturn(Optional.of(Session.builder().id(SESSION_ID).build()));
        when(sessionPort.get("missing")).thenReturn(Optional.empty());
        when(coordinator.submit(anyString(), anyString())).thenReturn(new CompletableFuture<>());
    }

    private Map<String, Object> parse(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<>() {
            });
        } catch (Exception e) {
            throw new AssertionError("Invalid frame: " + json, e);
        }
    }

    // ==================== Control messages ====================

    @Test
    void shouldAnswerPingWithPong() {
        handler.handleIncoming(connection, "{\"type\":\"ping\"}");

        StepVerifier.create(connection.outbound())
                .assertNext(frame -> assertEquals("pong", parse(frame).get("type")))
                .thenCancel()
                .verify(TIMEOUT);
    }

    @Test
    void shouldRejectInvalidJson() {
        handler.handleIncoming(connection, "not json");

        StepVerifier.create(connection.outbound())
                .assertNext(frame -> assertEquals("Invalid JSON", parse(frame).get("error")))
                .thenCancel()
                .verify(TIMEOUT);
    }

    @Test
    void shouldRejectUnknownMessageType() {
        handler.handleIncoming(connection, "{\"type\":\"dance\"}");

        StepVerifier.create(connection.outbound())
                .assertNext(frame -> {
                    Map<String, Object> parsed = parse(frame);
                    assertEquals("error", parsed.get("type"));
                    assertEquals("Unknown message type: dance", parsed.get("error"));
                })
                .thenCancel()
                .verify(TIMEOUT);
    }

    // ==================== Chat ====================

    @Test
    void shouldCreateSessionForChatWithoutSessionId() {
        when(sessionPort.create(SessionGatewayHandler.WS_SESSION_TITLE))
                .thenReturn(Session.builder().id("new-1").build());

        handler.handleIncoming(connection, "{\"type\":\"chat\",\"message\":\"make a cat\"}");

        StepVerifier.create(connection.outbound())
                .assertNext(frame -> {
                    Map<String, Object> parsed = parse(frame);
                    assertEquals("session_created", parsed.get("type"));
                    assertEquals("new-1", parsed.get("session_id"));
                })
                .thenCancel()
                .verify(TIMEOUT);
        verify(coordinator).submit("new-1", "make a cat");
        assertTrue(connection.isFollowing("new-1"));
    }

    @Test
    void shouldForwardSessionEventsAndTerminalResponse() {
        handler.handleIncoming(connection, "{\"type\":\"chat\",\"session_id\":\"session-1\",\"message\":\"hi\"}");

        StepVerifier.create(connection.outbound())
                .then(() -> {
                    eventBus.emit(SESSION_ID, AgentEventType.THINKING, Map.of("iteration", 1));
                    eventBus.emit(SESSION_ID, AgentEventType.TURN_RESPONSE, Map.of("content", "Hello!"));
                })
                .assertNext(frame -> {
                    Map<String, Object> parsed = parse(frame);
                    assertEquals("event", parsed.get("type"));
                    assertEquals("state.thinking", parsed.get("event_type"));
                    assertEquals(SESSION_ID, parsed.get("session_id"));
                })
                .assertNext(frame -> {
                    Map<String, Object> parsed = parse(frame);
                    assertEquals("response", parsed.get("type"));
                    assertEquals("Hello!", parsed.get("content"));
                })
                .thenCancel()
                .verify(TIMEOUT);
        verify(coordinator).submit(SESSION_ID, "hi");
    }

    @Test
    void shouldReportBusySession() {
        when(coordinator.submit(SESSION_ID, "again")).thenThrow(new TurnInProgressException(SESSION_ID));

        handler.handleIncoming(connection, "{\"type\":\"chat\",\"session_id\":\"session-1\",\"message\":\"again\"}");

        StepVerifier.create(connection.outbound())
                .assertNext(frame -> {
                    Map<String, Object> parsed = parse(frame);
                    assertEquals("error", parsed.get("type"));
                    assertEquals(SESSION_ID, parsed.get("session_id"));
                    assertTrue(parsed.get("error").toString().startsWith("Turn in progress"));
                })
                .thenCancel()
                .verify(TIMEOUT);
    }

    @Test
    void shouldReportStoreFailureAndKeepConnectionUsable() {
        when(sessionPort.create(SessionGatewayHandler.WS_SESSION_TITLE))
                .thenThrow(new PersistenceException("Failed to save session x", new IOException("disk full")));

        assertDoesNotThrow(() -> handler.handleIncoming(connection, "{\"type\":\"chat\",\"message\":\"hi\"}"));
        handler.handleIncoming(connection, "{\"type\":\"ping\"}");

        StepVerifier.create(connection.outbound())
                .assertNext(frame -> {
                    Map<String, Object> parsed = parse(frame);
                    assertEquals("error", parsed.get("type"));
                    assertEquals("Request failed: Failed to save session x", parsed.get("error"));
                })
                .assertNext(frame -> assertEquals("pong", parse(frame).get("type")))
                .thenCancel()
                .verify(TIMEOUT);
        verifyNoInteractions(coordinator);
    }

    @Test
    void shouldReportRejectedSubmission() {
        when(coordinator.submit(SESSION_ID, "hi")).thenThrow(new RejectedExecutionException("executor shut down"));

        assertDoesNotThrow(() -> handler.handleIncoming(connection,
                "{\"type\":\"chat\",\"session_id\":\"session-1\",\"message\":\"hi\"}"));

        StepVerifier.create(connection.outbound())
                .assertNext(frame -> {
                    Map<String, Object> parsed = parse(frame);
                    assertEquals(SESSION_ID, parsed.get("session_id"));
                    assertEquals("Request failed: executor shut down", parsed.get("error"));
                })
                .thenCancel()
                .verify(TIMEOUT);
    }

    @Test
    void shouldRejectChatForUnknownSession() {
        handler.handleIncoming(connection, "{\"type\":\"chat\",\"session_id\":\"missing\",\"message\":\"hi\"}");

        StepVerifier.create(connection.outbound())
                .assertNext(frame -> assertEquals("Session not found: missing", parse(frame).get("error")))
                .thenCancel()
                .verify(TIMEOUT);
        verifyNoInteractions(coordinator);
    }

    @Test
    void shouldRequireMessage() {
        handler.handleIncoming(connection, "{\"type\":\"chat\",\"session_id\":\"session-1\",\"message\":\"  \"}");

        StepVerifier.create(connection.outbound())
                .assertNext(frame -> assertEquals("message is required", parse(frame).get("error")))
                .thenCancel()
                .verify(TIMEOUT);
    }

    // ==================== Cancel and subscribe ====================

    @Test
    void shouldCancelRunningTurn() {
        when(coordinator.cancel(SESSION_ID)).thenReturn(true);

        handler.handleIncoming(connection, "{\"type\":\"cancel\",\"session_id\":\"session-1\"}");

        verify(coordinator).cancel(SESSION_ID);
    }

    @Test
    void shouldReportCancelWithoutRunningTurn() {
        when(coordinator.cancel(SESSION_ID)).thenReturn(false);

        handler.handleIncoming(connection, "{\"type\":\"cancel\",\"session_id\":\"session-1\"}");

        StepVerifier.create(connection.outbound())
                .assertNext(frame -> assertEquals("No turn in progress for session session-1",
                        parse(frame).get("error")))
                .thenCancel()
                .verify(TIMEOUT);
    }

    @Test
    void shouldFollowSessionOnlyOnce() {
        handler.handleIncoming(connection, "{\"type\":\"subscribe\",\"session_id\":\"session-1\"}");
        handler.handleIncoming(connection, "{\"type\":\"subscribe\",\"session_id\":\"session-1\"}");

        StepVerifier.create(connection.outbound())
                .then(() -> {
                    assertEquals(1, eventBus.subscriberCount(SESSION_ID));
                    eventBus.emit(SESSION_ID, AgentEventType.TURN_END, Map.of("iterations", 1));
                })
                .assertNext(frame -> assertEquals("turn.end", parse(frame).get("event_type")))
                .expectNoEvent(Duration.ofMillis(100))
                .thenCancel()
                .verify(TIMEOUT);
    }

    @Test
    void shouldStopForwardingAfterClose() {
        handler.handleIncoming(connection, "{\"type\":\"subscribe\",\"session_id\":\"session-1\"}");

        StepVerifier.create(connection.outbound())
                .then(connection::close)
                .verifyComplete();
    }

    // ==================== Frames ====================

    @Test
    void shouldMapTerminalEventsToFrames() {
        Instant now = Instant.parse("2026-02-14T00:00:00Z");
        Map<String, Object> error = SessionGatewayHandler.toFrame(new AgentEvent(AgentEventType.TURN_ERROR, SESSION_ID,
                now, Map.of("error", "boom", "kind", "fatal_upstream")));
        Map<String, Object> cancelled = SessionGatewayHandler.toFrame(new AgentEvent(AgentEventType.TURN_CANCELLED,
                SESSION_ID, now, Map.of("content", "Request cancelled.")));

        assertEquals("error", error.get("type"));
        assertEquals("boom", error.get("error"));
        assertEquals("fatal_upstream", error.get("kind"));
        assertEquals("cancelled", cancelled.get("type"));
        assertEquals("Request cancelled.", cancelled.get("content"));
    }

    @Test
    void shouldWrapRegularEventWithTimestamp() {
        Map<String, Object> frame = SessionGatewayHandler.toFrame(new AgentEvent(AgentEventType.LLM_RETRY, SESSION_ID,
                Instant.parse("2026-02-14T00:00:00Z"), Map.of("attempt", 1)));

        assertEquals("event", frame.get("type"));
        assertEquals("llm.retry", frame.get("event_type"));
        assertEquals(Map.of("attempt", 1), frame.get("data"));
        assertEquals("2026-02-14T00:00:00Z", frame.get("timestamp"));
    }
}
