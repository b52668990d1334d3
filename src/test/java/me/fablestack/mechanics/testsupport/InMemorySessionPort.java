package me.fablestack.mechanics.testsupport;

import me.fablestack.mechanics.domain.model.GameSession;
import me.fablestack.mechanics.port.outbound.SessionPort;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Session port keeping sessions in a map. {@link #failNextSaves(int)} makes
 * the next saves throw, to exercise commit rollback.
 */
public class InMemorySessionPort implements SessionPort {

    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();
    private final AtomicInteger idSequence = new AtomicInteger();
    private final AtomicInteger failingSaves = new AtomicInteger();
    private final AtomicInteger saveCount = new AtomicInteger();

    @Override
    public GameSession create(String scenarioName) {
        GameSession session = GameSession.builder()
                .id("session-" + idSequence.incrementAndGet())
                .scenarioName(scenarioName)
                .createdAt(Instant.parse("2026-01-15T10:00:00Z"))
                .build();
        sessions.put(session.getId(), session);
        return session;
    }

    @Override
    public Optional<GameSession> get(String sessionId) {
        return Optional.ofNullable(sessionId != null ? sessions.get(sessionId) : null);
    }

    @Override
    public void save(GameSession session) {
        if (failingSaves.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new IllegalStateException("Disk full");
        }
        saveCount.incrementAndGet();
        sessions.put(session.getId(), session);
    }

    @Override
    public void delete(String sessionId) {
        sessions.remove(sessionId);
    }

    @Override
    public List<GameSession> listAll() {
        return new ArrayList<>(sessions.values());
    }

    public void failNextSaves(int count) {
        failingSaves.set(count);
    }

    public int getSaveCount() {
        return saveCount.get();
    }
}
