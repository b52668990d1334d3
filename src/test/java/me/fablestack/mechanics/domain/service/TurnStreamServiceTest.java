package me.fablestack.mechanics.domain.service;

import me.fablestack.mechanics.adapter.outbound.intent.ExplicitIntentResolverAdapter;
import me.fablestack.mechanics.domain.exception.ErrorCode;
import me.fablestack.mechanics.domain.model.Difficulty;
import me.fablestack.mechanics.domain.model.GameSession;
import me.fablestack.mechanics.domain.model.NarrationRequest;
import me.fablestack.mechanics.domain.model.PayloadKeys;
import me.fablestack.mechanics.domain.model.PlayerInput;
import me.fablestack.mechanics.domain.model.StreamFrame;
import me.fablestack.mechanics.domain.model.StreamFrameType;
import me.fablestack.mechanics.domain.model.TimelineEvent;
import me.fablestack.mechanics.domain.model.TimelineEventKind;
import me.fablestack.mechanics.domain.model.TurnAction;
import me.fablestack.mechanics.domain.model.TurnActionType;
import me.fablestack.mechanics.port.outbound.IntentResolverPort;
import me.fablestack.mechanics.port.outbound.NarratorPort;
import me.fablestack.mechanics.testsupport.MechanicsFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TurnStreamServiceTest {

    private MechanicsFixture fixture;
    private NarratorPort narratorPort;
    private TurnStreamService service;
    private String sessionId;

    @BeforeEach
    void setUp() {
        fixture = new MechanicsFixture();
        narratorPort = mock(NarratorPort.class);
        service = new TurnStreamService(fixture.sessionPort, fixture.turnGuard, fixture.mechanicsService,
                new StreamCoordinator(fixture.properties), new ExplicitIntentResolverAdapter(), narratorPort);
        sessionId = fixture.sessionPort.create("The Sunken Keep").getId();
    }

    private static PlayerInput lockpicking() {
        return PlayerInput.builder()
                .text("I pick the lock")
                .actions(List.of(TurnAction.builder()
                        .type(TurnActionType.SKILL_CHECK)
                        .statValue(14)
                        .skillRank(2)
                        .difficulty(Difficulty.NORMAL)
                        .skillName("lockpicking")
                        .build()))
                .build();
    }

    private List<TimelineEventKind> timelineKinds() {
        return fixture.sessionPort.getRequired(sessionId).getTimeline().stream().map(TimelineEvent::kind).toList();
    }

    @Test
    void shouldStreamCommittedMechanicsBeforeNarration() {
        fixture.dice.enqueue(55);
        when(narratorPort.narrate(any())).thenReturn(Flux.just("<<SPEAKER:Mara>>The lock ", "clicks."));

        StepVerifier.create(service.streamTurn(sessionId, lockpicking()))
                .assertNext(frame -> assertEquals(TimelineEventKind.USER_INPUT, frame.event().kind()))
                .assertNext(frame -> {
                    assertEquals(TimelineEventKind.SKILL_CHECK, frame.event().kind());
                    assertEquals(true, frame.event().payload().get(PayloadKeys.SUCCESS));
                })
                .expectNext(StreamFrame.token("The lock "))
                .expectNext(StreamFrame.token("clicks."))
                .expectNext(StreamFrame.endOfTurn())
                .verifyComplete();

        assertEquals(List.of(TimelineEventKind.USER_INPUT, TimelineEventKind.SKILL_CHECK,
                TimelineEventKind.NARRATIVE_CHUNK), timelineKinds());
        TimelineEvent narration = fixture.sessionPort.getRequired(sessionId).getTimeline().get(2);
        assertEquals("The lock clicks.", narration.payload().get(PayloadKeys.TEXT));
        assertEquals(List.of("Mara"), narration.payload().get(PayloadKeys.SPEAKERS));
        assertFalse(fixture.turnGuard.isBusy(sessionId));
    }

    @Test
    void shouldHandNarratorTheCommittedEvents() {
        fixture.dice.enqueue(55);
        when(narratorPort.narrate(any())).thenReturn(Flux.empty());

        StepVerifier.create(service.streamTurn(sessionId, lockpicking()))
                .expectNextCount(3)
                .verifyComplete();

        ArgumentCaptor<NarrationRequest> request = ArgumentCaptor.forClass(NarrationRequest.class);
        verify(narratorPort).narrate(request.capture());
        assertEquals("I pick the lock", request.getValue().playerText());
        assertEquals(2, request.getValue().committedEvents().size());
    }

    @Test
    void shouldStopAtRejectedActionWithoutNarrating() {
        PlayerInput input = PlayerInput.builder()
                .text("I swing at the goblin")
                .actions(List.of(TurnAction.builder()
                        .type(TurnActionType.ATTACK).actorId("hero").targetId("goblin").build()))
                .build();

        StepVerifier.create(service.streamTurn(sessionId, input))
                .assertNext(frame -> assertEquals(TimelineEventKind.USER_INPUT, frame.event().kind()))
                .assertNext(frame -> assertEquals(ErrorCode.STATE_CONFLICT, frame.error().code()))
                .expectNext(StreamFrame.endOfTurn())
                .verifyComplete();

        verify(narratorPort, never()).narrate(any());
        assertEquals(List.of(TimelineEventKind.USER_INPUT), timelineKinds());
    }

    @Test
    void shouldRecordNarratorFailureAsSystemLog() {
        fixture.dice.enqueue(55);
        when(narratorPort.narrate(any())).thenReturn(Flux.error(new IllegalStateException("model offline")));

        StepVerifier.create(service.streamTurn(sessionId, lockpicking()))
                .expectNextCount(2)
                .assertNext(frame -> {
                    assertEquals(TimelineEventKind.SYSTEM_LOG, frame.event().kind());
                    assertEquals("narration_unavailable", frame.event().payload().get(PayloadKeys.CODE));
                })
                .assertNext(frame -> assertEquals(ErrorCode.NARRATION_UNAVAILABLE, frame.error().code()))
                .expectNext(StreamFrame.endOfTurn())
                .verifyComplete();

        assertEquals(List.of(TimelineEventKind.USER_INPUT, TimelineEventKind.SKILL_CHECK,
                TimelineEventKind.SYSTEM_LOG), timelineKinds());
    }

    @Test
    void shouldRejectBlankInput() {
        StepVerifier.create(service.streamTurn(sessionId, PlayerInput.builder().text("  ").build()))
                .assertNext(frame -> assertEquals(ErrorCode.VALIDATION, frame.error().code()))
                .expectNext(StreamFrame.endOfTurn())
                .verifyComplete();

        assertTrue(timelineKinds().isEmpty());
    }

    @Test
    void shouldRejectUnknownSession() {
        StepVerifier.create(service.streamTurn("missing", lockpicking()))
                .assertNext(frame -> assertEquals(ErrorCode.NOT_FOUND, frame.error().code()))
                .expectNext(StreamFrame.endOfTurn())
                .verifyComplete();
    }

    @Test
    void shouldRejectTurnOnBusySession() {
        try (SessionTurnGuard.Lease lease = fixture.turnGuard.acquire(sessionId, "restore")) {
            StepVerifier.create(service.streamTurn(sessionId, lockpicking()))
                    .assertNext(frame -> {
                        assertEquals(StreamFrameType.ERROR, frame.type());
                        assertEquals(ErrorCode.STATE_CONFLICT, frame.error().code());
                    })
                    .expectNext(StreamFrame.endOfTurn())
                    .verifyComplete();
        }
        assertTrue(timelineKinds().isEmpty());
    }

    @Test
    void shouldReleaseSessionWhenConsumerCancels() {
        fixture.dice.enqueue(55);
        when(narratorPort.narrate(any())).thenReturn(Flux.never());

        StepVerifier.create(service.streamTurn(sessionId, lockpicking()))
                .expectNextCount(2)
                .thenCancel()
                .verify();

        assertFalse(fixture.turnGuard.isBusy(sessionId));
        GameSession session = fixture.sessionPort.getRequired(sessionId);
        assertEquals(2, session.getTimeline().size());
    }

    @Test
    void shouldKeepSessionClaimedUntilCancelledMechanicsFinish() throws InterruptedException {
        fixture.dice.enqueue(55);
        CountDownLatch resolving = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        IntentResolverPort slowResolver = (session, input) -> {
            resolving.countDown();
            awaitIgnoringInterrupts(proceed);
            return input.getActions();
        };
        TurnStreamService slowService = new TurnStreamService(fixture.sessionPort, fixture.turnGuard,
                fixture.mechanicsService, new StreamCoordinator(fixture.properties), slowResolver, narratorPort);
        when(narratorPort.narrate(any())).thenReturn(Flux.empty());

        Disposable firstTurn = slowService.streamTurn(sessionId, lockpicking()).subscribe();
        assertTrue(resolving.await(5, TimeUnit.SECONDS));
        firstTurn.dispose();

        assertTrue(fixture.turnGuard.isBusy(sessionId));
        StepVerifier.create(slowService.streamTurn(sessionId, lockpicking()))
                .assertNext(frame -> assertEquals(ErrorCode.STATE_CONFLICT, frame.error().code()))
                .expectNext(StreamFrame.endOfTurn())
                .verifyComplete();

        proceed.countDown();
        waitUntilReleased();

        assertFalse(fixture.turnGuard.isBusy(sessionId));
        assertEquals(List.of(TimelineEventKind.USER_INPUT, TimelineEventKind.SKILL_CHECK), timelineKinds());
        verify(narratorPort, never()).narrate(any());
    }

    @Test
    void shouldSkipMechanicsWhenClaimReleasedBeforeTheyStart() {
        SessionTurnGuard.Lease lease = fixture.turnGuard.acquire(sessionId, "turn");
        TurnStreamService.TurnClaim claim = new TurnStreamService.TurnClaim(lease);

        claim.streamEnded();

        assertFalse(fixture.turnGuard.isBusy(sessionId));
        assertFalse(claim.mechanicsStarted());
    }

    @Test
    void shouldReleaseClaimOnlyAfterBothStreamAndMechanicsEnd() {
        SessionTurnGuard.Lease lease = fixture.turnGuard.acquire(sessionId, "turn");
        TurnStreamService.TurnClaim claim = new TurnStreamService.TurnClaim(lease);

        assertTrue(claim.mechanicsStarted());
        claim.streamEnded();
        assertTrue(fixture.turnGuard.isBusy(sessionId));

        claim.mechanicsFinished();
        assertFalse(fixture.turnGuard.isBusy(sessionId));
    }

    private void waitUntilReleased() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (fixture.turnGuard.isBusy(sessionId) && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
    }

    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
