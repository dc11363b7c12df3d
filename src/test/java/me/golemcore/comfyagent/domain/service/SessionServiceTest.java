package me.golemcore.comfyagent.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.comfyagent.domain.exception.PersistenceException;
import me.golemcore.comfyagent.domain.model.ContentBlock;
import me.golemcore.comfyagent.domain.model.ContentBlockType;
import me.golemcore.comfyagent.domain.model.Message;
import me.golemcore.comfyagent.domain.model.MessageRole;
import me.golemcore.comfyagent.domain.model.ModelUsage;
import me.golemcore.comfyagent.domain.model.Session;
import me.golemcore.comfyagent.domain.model.SessionStatus;
import me.golemcore.comfyagent.domain.model.ToolCall;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.infrastructure.config.AutoConfiguration;
import me.golemcore.comfyagent.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SessionServiceTest {

    private static final String SESSIONS_DIR = "sessions";

    private StoragePort storagePort;
    private ObjectMapper objectMapper;
    private Clock clock;
    private AgentProperties properties;
    private ApplicationEventPublisher eventPublisher;
    private SessionService service;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
        objectMapper = AutoConfiguration.objectMapper();
        clock = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));
        properties = new AgentProperties();
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.deleteObject(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        service = new SessionService(storagePort, objectMapper, clock, eventPublisher, properties);
    }

    private static Message assistantWithTools() {
        ToolCall first = ToolCall.builder().id("call-1").name("list_nodes").arguments(Map.of("query", "sampler"))
                .build();
        ToolCall second = ToolCall.builder().id("call-2").name("get_node_info")
                .arguments(Map.of("node_class", "KSampler")).build();
        return Message.assistant("Looking up nodes", List.of(first, second), null);
    }

    // ==================== Lifecycle ====================

    @Test
    void shouldCreateAndPersistSession() {
        Session session = service.create("My session");

        assertNotNull(session.getId());
        assertEquals("My session", session.getTitle());
        assertEquals(SessionStatus.ACTIVE, session.getStatus());
        assertEquals(clock.instant(), session.getCreatedAt());
        assertTrue(service.get(session.getId()).isPresent());
        verify(storagePort).putTextAtomic(eq(SESSIONS_DIR), eq(session.getId() + ".json"), anyString(), eq(false));
    }

    @Test
    void shouldHideChildSessionsFromListing() {
        Session parent = service.create("parent");
        Session child = service.createChild(parent.getId(), "child");

        List<Session> listed = service.listTopLevel();

        assertEquals(List.of(parent.getId()), listed.stream().map(Session::getId).toList());
        assertTrue(child.isChild());
        assertTrue(service.get(child.getId()).isPresent());
    }

    @Test
    void shouldRenameSession() {
        Session session = service.create("old");

        service.rename(session.getId(), "new");

        assertEquals("new", service.get(session.getId()).orElseThrow().getTitle());
    }

    @Test
    void shouldDeleteSessionWithChildren() {
        Session parent = service.create("parent");
        Session child = service.createChild(parent.getId(), "child");

        assertTrue(service.delete(parent.getId()));

        assertTrue(service.get(parent.getId()).isEmpty());
        assertTrue(service.get(child.getId()).isEmpty());
        verify(storagePort).deleteObject(SESSIONS_DIR, parent.getId() + ".json");
        verify(storagePort).deleteObject(SESSIONS_DIR, child.getId() + ".json");
        verify(eventPublisher).publishEvent(new SessionService.SessionDeletedEvent(parent.getId()));
        verify(eventPublisher).publishEvent(new SessionService.SessionDeletedEvent(child.getId()));
    }

    @Test
    void shouldReturnFalseWhenDeletingUnknownSession() {
        assertFalse(service.delete("missing"));
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void shouldRejectAppendToUnknownSession() {
        Message message = Message.userText("hi", null);
        assertThrows(IllegalArgumentException.class, () -> service.appendMessage("missing", message));
    }

    // ==================== History ====================

    @Test
    void shouldAppendMessagesInOrder() {
        Session session = service.create("s");

        service.appendMessage(session.getId(), Message.userText("find a sampler", null));
        service.appendMessage(session.getId(), assistantWithTools());

        List<Message> messages = service.getMessages(session.getId());
        assertEquals(2, messages.size());
        assertEquals(MessageRole.USER, messages.get(0).getRole());
        assertEquals(clock.instant(), messages.get(0).getTimestamp());
        assertEquals(MessageRole.ASSISTANT, messages.get(1).getRole());
    }

    @Test
    void shouldReturnHistorySnapshot() {
        Session session = service.create("s");
        service.appendMessage(session.getId(), Message.userText("one", null));

        List<Message> snapshot = service.getMessages(session.getId());
        service.appendMessage(session.getId(), Message.userText("two", null));

        assertEquals(1, snapshot.size());
    }

    @Test
    void shouldReloadBlocksInEmissionOrder() throws IOException {
        Session session = service.create("s");
        service.appendMessage(session.getId(), Message.userText("find a sampler", null));
        service.appendMessage(session.getId(), assistantWithTools());
        service.appendMessage(session.getId(), Message.toolResults(List.of(
                ContentBlock.toolResult("call-1", "list_nodes", "KSampler", false),
                ContentBlock.toolResult("call-2", "get_node_info", "Not found", true)), null));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(storagePort, atLeastOnce()).putTextAtomic(eq(SESSIONS_DIR), eq(session.getId() + ".json"),
                json.capture(), eq(false));
        String stored = json.getValue();

        StoragePort reloadStorage = mock(StoragePort.class);
        when(reloadStorage.listObjects(SESSIONS_DIR, ""))
                .thenReturn(CompletableFuture.completedFuture(List.of(session.getId() + ".json", "notes.txt")));
        when(reloadStorage.getText(SESSIONS_DIR, session.getId() + ".json"))
                .thenReturn(CompletableFuture.completedFuture(stored));
        SessionService reloaded = new SessionService(reloadStorage, objectMapper, clock, eventPublisher, properties);
        reloaded.loadAll();

        List<Message> messages = reloaded.getMessages(session.getId());
        assertEquals(3, messages.size());
        List<ContentBlock> assistantBlocks = messages.get(1).getBlocks();
        assertEquals(List.of(ContentBlockType.TEXT, ContentBlockType.TOOL_CALL, ContentBlockType.TOOL_CALL),
                assistantBlocks.stream().map(ContentBlock::getType).toList());
        assertEquals("call-1", assistantBlocks.get(1).getToolCallId());
        assertEquals("call-2", assistantBlocks.get(2).getToolCallId());
        assertEquals("KSampler", assistantBlocks.get(2).getArguments().get("node_class"));
        List<ContentBlock> results = messages.get(2).getBlocks();
        assertEquals("call-1", results.get(0).getToolCallId());
        assertFalse(results.get(0).hasError());
        assertTrue(results.get(1).hasError());
        verify(reloadStorage, never()).getText(SESSIONS_DIR, "notes.txt");
    }

    @Test
    void shouldSkipUnreadableSessionFiles() {
        StoragePort reloadStorage = mock(StoragePort.class);
        when(reloadStorage.listObjects(SESSIONS_DIR, ""))
                .thenReturn(CompletableFuture.completedFuture(List.of("broken.json")));
        when(reloadStorage.getText(SESSIONS_DIR, "broken.json"))
                .thenReturn(CompletableFuture.completedFuture("{not json"));
        SessionService reloaded = new SessionService(reloadStorage, objectMapper, clock, eventPublisher, properties);

        reloaded.loadAll();

        assertTrue(reloaded.listTopLevel().isEmpty());
    }

    @Test
    void shouldAccumulateUsage() {
        Session session = service.create("s");

        service.addUsage(session.getId(), new ModelUsage(100, 20));
        service.addUsage(session.getId(), new ModelUsage(50, 5));
        service.addUsage(session.getId(), null);

        Session stored = service.get(session.getId()).orElseThrow();
        assertEquals(150, stored.getTotalInputTokens());
        assertEquals(25, stored.getTotalOutputTokens());
    }

    // ==================== Failures ====================

    @Test
    void shouldRollBackAppendWhenWriteFails() {
        Session session = service.create("s");
        service.appendMessage(session.getId(), Message.userText("kept", null));
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IOException("disk full")));

        Message lost = Message.userText("lost", null);
        PersistenceException error = assertThrows(PersistenceException.class,
                () -> service.appendMessage(session.getId(), lost));

        assertTrue(error.getMessage().contains(session.getId()));
        List<Message> messages = service.getMessages(session.getId());
        assertEquals(1, messages.size());
        assertEquals("kept", messages.get(0).getTextContent());
    }

    @Test
    void shouldRollBackStatusWhenWriteFails() {
        Session session = service.create("s");
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IOException("disk full")));

        String id = session.getId();
        assertThrows(PersistenceException.class, () -> service.updateStatus(id, SessionStatus.COMPLETED));

        assertEquals(SessionStatus.ACTIVE, service.get(id).orElseThrow().getStatus());
    }

    @Test
    void shouldNotRegisterSessionWhenCreateFails() {
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IOException("read-only")));

        assertThrows(PersistenceException.class, () -> service.create("s"));

        assertTrue(service.listTopLevel().isEmpty());
        verify(storagePort, never()).deleteObject(any(), any());
    }
}
