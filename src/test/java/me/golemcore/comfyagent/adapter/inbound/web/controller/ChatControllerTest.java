package me.golemcore.comfyagent.adapter.inbound.web.controller;

import me.golemcore.comfyagent.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.comfyagent.adapter.inbound.web.dto.ChatResponse;
import me.golemcore.comfyagent.domain.exception.TurnInProgressException;
import me.golemcore.comfyagent.domain.model.ErrorKind;
import me.golemcore.comfyagent.domain.model.ModelUsage;
import me.golemcore.comfyagent.domain.model.Session;
import me.golemcore.comfyagent.domain.model.TurnOutcome;
import me.golemcore.comfyagent.domain.model.TurnStatus;
import me.golemcore.comfyagent.domain.service.SessionRunCoordinator;
import me.golemcore.comfyagent.port.outbound.SessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ChatControllerTest {

    private SessionPort sessionPort;
    private SessionRunCoordinator coordinator;
    private ChatController controller;

    @BeforeEach
    void setUp() {
        sessionPort = mock(SessionPort.class);
        coordinator = mock(SessionRunCoordinator.class);
        controller = new ChatController(sessionPort, coordinator);
        when(sessionPort.get("s1")).thenReturn(Optional.of(Session.builder().id("s1").build()));
        when(sessionPort.get("missing")).thenReturn(Optional.empty());
    }

    private static TurnOutcome completed(String sessionId) {
        return TurnOutcome.builder()
                .sessionId(sessionId)
                .status(TurnStatus.COMPLETED)
                .content("Here is your workflow.")
                .iterations(2)
                .usage(new ModelUsage(150, 15))
                .duration(Duration.ofSeconds(3))
                .build();
    }

    @Test
    void shouldRunTurnInExistingSession() {
        when(coordinator.submit("s1", "make a cat")).thenReturn(CompletableFuture.completedFuture(completed("s1")));

        ResponseEntity<ChatResponse> response = controller.chat(new ChatRequest("s1", "  make a cat ")).block();

        assertNotNull(response);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        ChatResponse body = response.getBody();
        assertEquals("s1", body.getSessionId());
        assertEquals("completed", body.getStatus());
        assertEquals("Here is your workflow.", body.getResponse());
        assertEquals(2, body.getIterations());
        assertEquals(150L, body.getUsage().get("input_tokens"));
        assertNull(body.getErrorKind());
    }

    @Test
    void shouldCreateSessionWhenNoneGiven() {
        when(sessionPort.create(ChatController.API_SESSION_TITLE)).thenReturn(Session.builder().id("new").build());
        when(coordinator.submit("new", "hi")).thenReturn(CompletableFuture.completedFuture(completed("new")));

        ResponseEntity<ChatResponse> response = controller.chat(new ChatRequest(null, "hi")).block();

        assertNotNull(response);
        assertEquals("new", response.getBody().getSessionId());
    }

    @Test
    void shouldRejectBlankMessage() {
        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.chat(new ChatRequest("s1", " ")));

        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
        verifyNoInteractions(coordinator);
    }

    @Test
    void shouldReturnNotFoundForUnknownSession() {
        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.chat(new ChatRequest("missing", "hi")));

        assertEquals(HttpStatus.NOT_FOUND, error.getStatusCode());
    }

    @Test
    void shouldPropagateBusySession() {
        when(coordinator.submit("s1", "hi")).thenThrow(new TurnInProgressException("s1"));

        assertThrows(TurnInProgressException.class, () -> controller.chat(new ChatRequest("s1", "hi")));
    }

    @Test
    void shouldMapFailedOutcome() {
        TurnOutcome failed = TurnOutcome.builder()
                .sessionId("s1")
                .status(TurnStatus.FAILED)
                .error("Model call failed: invalid api key")
                .errorKind(ErrorKind.FATAL_UPSTREAM)
                .iterations(1)
                .build();

        ChatResponse response = ChatController.toResponse(failed);

        assertEquals("failed", response.getStatus());
        assertEquals("fatal_upstream", response.getErrorKind());
        assertEquals("Model call failed: invalid api key", response.getError());
        assertNull(response.getUsage());
    }
}
