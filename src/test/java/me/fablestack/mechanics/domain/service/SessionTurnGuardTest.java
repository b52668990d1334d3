package me.fablestack.mechanics.domain.service;

import me.fablestack.mechanics.domain.exception.StateConflictException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionTurnGuardTest {

    private final SessionTurnGuard guard = new SessionTurnGuard();

    @Test
    void shouldRejectSecondClaimOnSameSession() {
        try (SessionTurnGuard.Lease lease = guard.acquire("session-1", "turn")) {
            StateConflictException error = assertThrows(StateConflictException.class,
                    () -> guard.acquire("session-1", "attack"));
            assertTrue(error.getMessage().contains("turn in progress"));
        }
    }

    @Test
    void shouldNotContendAcrossSessions() {
        try (SessionTurnGuard.Lease first = guard.acquire("session-1", "turn");
                SessionTurnGuard.Lease second = guard.acquire("session-2", "turn")) {
            assertTrue(guard.isBusy("session-1"));
            assertTrue(guard.isBusy("session-2"));
        }
    }

    @Test
    void shouldReleaseOnClose() {
        SessionTurnGuard.Lease lease = guard.acquire("session-1", "turn");

        lease.close();

        assertFalse(guard.isBusy("session-1"));
        assertDoesNotThrow(() -> guard.acquire("session-1", "turn").close());
    }

    @Test
    void shouldIgnoreRepeatedCloseOfStaleLease() {
        SessionTurnGuard.Lease stale = guard.acquire("session-1", "turn");
        stale.close();
        SessionTurnGuard.Lease current = guard.acquire("session-1", "restore");

        stale.close();

        assertTrue(guard.isBusy("session-1"));
        current.close();
        assertFalse(guard.isBusy("session-1"));
    }
}
