package me.fablestack.mechanics.adapter.inbound.web.controller;

import me.fablestack.mechanics.adapter.inbound.web.dto.CreateSessionRequest;
import me.fablestack.mechanics.adapter.inbound.web.dto.RestoreRequest;
import me.fablestack.mechanics.adapter.inbound.web.dto.SessionSummaryDto;
import me.fablestack.mechanics.domain.exception.MechanicsValidationException;
import me.fablestack.mechanics.domain.exception.NotFoundException;
import me.fablestack.mechanics.domain.model.Difficulty;
import me.fablestack.mechanics.domain.model.SkillCheckRequest;
import me.fablestack.mechanics.testsupport.MechanicsFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SessionsControllerTest {

    private MechanicsFixture fixture;
    private SessionsController controller;

    @BeforeEach
    void setUp() {
        fixture = new MechanicsFixture();
        controller = new SessionsController(fixture.mechanicsService);
    }

    private String createSession() {
        return controller.createSession(new CreateSessionRequest("The Sunken Keep")).block().getBody().getId();
    }

    private void skillCheck(String sessionId, int roll) {
        fixture.dice.enqueue(roll);
        fixture.mechanicsService.performSkillCheck(sessionId, SkillCheckRequest.builder()
                .statValue(10).skillRank(1).difficulty(Difficulty.NORMAL).build());
    }

    @Test
    void shouldCreateSession() {
        StepVerifier.create(controller.createSession(new CreateSessionRequest("The Sunken Keep")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    SessionSummaryDto body = response.getBody();
                    assertNotNull(body);
                    assertEquals("The Sunken Keep", body.getScenarioName());
                    assertEquals(0, body.getEventCount());
                    assertFalse(body.isInCombat());
                })
                .verifyComplete();
    }

    @Test
    void shouldCreateSessionWithoutBody() {
        StepVerifier.create(controller.createSession(null))
                .assertNext(response -> assertEquals(HttpStatus.CREATED, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldListSessions() {
        createSession();
        createSession();

        StepVerifier.create(controller.listSessions())
                .assertNext(response -> assertEquals(2, response.getBody().size()))
                .verifyComplete();
    }

    @Test
    void shouldSummarizeTimeline() {
        String id = createSession();
        skillCheck(id, 10);

        StepVerifier.create(controller.getSession(id))
                .assertNext(response -> {
                    assertEquals(1, response.getBody().getEventCount());
                    assertEquals(1, response.getBody().getLastSequence());
                })
                .verifyComplete();
    }

    @Test
    void shouldFailForUnknownSession() {
        assertThrows(NotFoundException.class, () -> controller.getSession("missing"));
    }

    @Test
    void shouldDeleteSession() {
        String id = createSession();

        StepVerifier.create(controller.deleteSession(id))
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();
        assertThrows(NotFoundException.class, () -> controller.getSession(id));
    }

    @Test
    void shouldReturnHistoryFromSequence() {
        String id = createSession();
        skillCheck(id, 10);
        skillCheck(id, 90);

        StepVerifier.create(controller.getHistory(id, 2L))
                .assertNext(response -> {
                    assertEquals(1, response.getBody().size());
                    assertEquals(2, response.getBody().get(0).sequenceNumber());
                })
                .verifyComplete();
    }

    @Test
    void shouldRestoreToSequence() {
        String id = createSession();
        skillCheck(id, 10);
        skillCheck(id, 90);

        StepVerifier.create(controller.restore(id, new RestoreRequest(1L)))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(id, response.getBody().getSessionId());
                    assertEquals(1, response.getBody().getLastSequence());
                })
                .verifyComplete();
        StepVerifier.create(controller.getHistory(id, null))
                .assertNext(response -> assertEquals(1, response.getBody().size()))
                .verifyComplete();
    }

    @Test
    void shouldRejectRestoreWithoutTarget() {
        String id = createSession();

        assertThrows(MechanicsValidationException.class, () -> controller.restore(id, new RestoreRequest(null)));
        assertThrows(MechanicsValidationException.class, () -> controller.restore(id, new RestoreRequest(5L)));
    }

    @Test
    void shouldListRestorePoints() {
        String id = createSession();

        StepVerifier.create(controller.getRestorePoints(id))
                .assertNext(response -> assertEquals(List.of(), response.getBody()))
                .verifyComplete();
    }
}
