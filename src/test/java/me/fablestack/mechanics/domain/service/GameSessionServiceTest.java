package me.fablestack.mechanics.domain.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.fablestack.mechanics.domain.model.GameSession;
import me.fablestack.mechanics.domain.model.PayloadKeys;
import me.fablestack.mechanics.domain.model.TimelineEvent;
import me.fablestack.mechanics.domain.model.TimelineEventKind;
import me.fablestack.mechanics.port.outbound.StoragePort;
import me.fablestack.mechanics.testsupport.MechanicsFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GameSessionServiceTest {

    private StoragePort storagePort;
    private ObjectMapper objectMapper;
    private GameSessionService service;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        service = new GameSessionService(storagePort, objectMapper,
                Clock.fixed(MechanicsFixture.FIXED_TIME, ZoneOffset.UTC));

        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.deleteObject(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
    }

    // ==================== create / save ====================

    @Test
    void createPersistsNewSession() {
        GameSession session = service.create("The Sunken Keep");

        assertNotNull(session.getId());
        assertEquals("The Sunken Keep", session.getScenarioName());
        assertEquals(MechanicsFixture.FIXED_TIME, session.getCreatedAt());
        assertEquals(1, session.getNextSequence());
        verify(storagePort).putTextAtomic(eq("sessions"), eq(session.getId() + ".json"), anyString(), eq(false));
    }

    @Test
    void saveRoundTripsTimelineThroughJson() throws Exception {
        GameSession session = service.create("The Sunken Keep");
        session.getTimeline().add(TimelineEvent.builder()
                .sequenceNumber(1)
                .timestamp(MechanicsFixture.FIXED_TIME)
                .kind(TimelineEventKind.SKILL_CHECK)
                .payload(Map.of(PayloadKeys.ROLL, 55, PayloadKeys.SUCCESS, true))
                .displayIcon("✅")
                .build());
        session.setNextSequence(2);
        session.setItems(new LinkedHashMap<>(Map.of("rope", 1)));
        service.save(session);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(storagePort, times(2))
                .putTextAtomic(eq("sessions"), eq(session.getId() + ".json"), json.capture(), eq(false));
        String written = json.getValue();
        assertTrue(written.contains("\"skill-check\""));

        GameSession restored = objectMapper.readValue(written, GameSession.class);
        assertEquals(session.getId(), restored.getId());
        assertEquals(2, restored.getNextSequence());
        assertEquals(TimelineEventKind.SKILL_CHECK, restored.getTimeline().get(0).kind());
        assertEquals(55, ((Number) restored.getTimeline().get(0).payload().get(PayloadKeys.ROLL)).intValue());
        assertEquals(Map.of("rope", 1), restored.getItems());
    }

    @Test
    void saveWritesNoLifecycleState() throws Exception {
        GameSession session = service.create("The Sunken Keep");

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(storagePort).putTextAtomic(eq("sessions"), eq(session.getId() + ".json"), json.capture(), eq(false));
        assertFalse(objectMapper.readTree(json.getValue()).has("state"));
    }

    @Test
    void getLoadsDocumentWithLegacyStateField() {
        String legacy = "{\"id\":\"session-9\",\"scenarioName\":\"Keep\",\"state\":\"ARCHIVED\",\"nextSequence\":1}";
        when(storagePort.getText("sessions", "session-9.json")).thenReturn(CompletableFuture.completedFuture(legacy));

        Optional<GameSession> loaded = service.get("session-9");

        assertTrue(loaded.isPresent());
        assertEquals("Keep", loaded.get().getScenarioName());
    }

    @Test
    void savePropagatesStorageFailure() {
        GameSession session = GameSession.builder().id("session-1").build();
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("Disk full")));

        assertThrows(RuntimeException.class, () -> service.save(session));
    }

    // ==================== get ====================

    @Test
    void getLoadsSessionFromStorageOnce() throws Exception {
        GameSession stored = GameSession.builder().id("session-7").scenarioName("Keep")
                .createdAt(MechanicsFixture.FIXED_TIME).build();
        when(storagePort.getText("sessions", "session-7.json"))
                .thenReturn(CompletableFuture.completedFuture(objectMapper.writeValueAsString(stored)));

        Optional<GameSession> first = service.get("session-7");
        Optional<GameSession> second = service.get("session-7");

        assertTrue(first.isPresent());
        assertSame(first.get(), second.get());
        verify(storagePort, times(1)).getText("sessions", "session-7.json");
    }

    @Test
    void getReturnsEmptyForCorruptJson() {
        when(storagePort.getText("sessions", "broken.json"))
                .thenReturn(CompletableFuture.completedFuture("{corrupt}"));

        assertTrue(service.get("broken").isEmpty());
    }

    @Test
    void getReturnsEmptyForMissingFile() {
        when(storagePort.getText("sessions", "missing.json"))
                .thenReturn(CompletableFuture.completedFuture(null));

        assertTrue(service.get("missing").isEmpty());
        assertTrue(service.get(" ").isEmpty());
    }

    // ==================== delete / list ====================

    @Test
    void deleteEvictsCacheAndStorage() {
        GameSession session = service.create("Keep");
        when(storagePort.getText("sessions", session.getId() + ".json"))
                .thenReturn(CompletableFuture.completedFuture(null));

        service.delete(session.getId());

        verify(storagePort).deleteObject("sessions", session.getId() + ".json");
        assertTrue(service.get(session.getId()).isEmpty());
    }

    @Test
    void listAllMergesStoredSessions() throws Exception {
        GameSession stored = GameSession.builder().id("old").scenarioName("Old")
                .createdAt(MechanicsFixture.FIXED_TIME.minusSeconds(60)).build();
        when(storagePort.listObjects("sessions", ""))
                .thenReturn(CompletableFuture.completedFuture(List.of("old.json", "notes.txt")));
        when(storagePort.getText("sessions", "old.json"))
                .thenReturn(CompletableFuture.completedFuture(objectMapper.writeValueAsString(stored)));
        GameSession created = service.create("New");

        List<GameSession> sessions = service.listAll();

        assertEquals(List.of("old", created.getId()), sessions.stream().map(GameSession::getId).toList());
        verify(storagePort, never()).getText("sessions", "notes.txt");
    }

    @Test
    void listAllSurvivesStorageScanFailure() {
        when(storagePort.listObjects("sessions", ""))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("io")));
        service.create("Keep");

        assertEquals(1, service.listAll().size());
    }
}
