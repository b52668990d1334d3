package me.fablestack.mechanics.adapter.inbound.web.controller;

import me.fablestack.mechanics.domain.exception.ErrorCode;
import me.fablestack.mechanics.domain.model.PlayerInput;
import me.fablestack.mechanics.domain.model.StreamFrame;
import me.fablestack.mechanics.domain.service.TurnStreamService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TurnsControllerTest {

    private TurnStreamService turnStreamService;
    private TurnsController controller;

    @BeforeEach
    void setUp() {
        turnStreamService = mock(TurnStreamService.class);
        controller = new TurnsController(turnStreamService);
    }

    @Test
    void shouldNameServerSentEventsAfterFrameType() {
        when(turnStreamService.streamTurn(eq("s1"), any())).thenReturn(Flux.just(
                StreamFrame.token("The door creaks."),
                StreamFrame.error(ErrorCode.NARRATION_UNAVAILABLE, "Narration timed out"),
                StreamFrame.endOfTurn()));

        StepVerifier.create(controller.streamTurn("s1", PlayerInput.builder().text("open door").build()))
                .assertNext(event -> {
                    assertEquals("narration_token", event.event());
                    assertEquals("The door creaks.", event.data().token());
                })
                .assertNext(event -> assertEquals("error", event.event()))
                .assertNext(event -> assertEquals("end_of_turn", event.event()))
                .verifyComplete();
    }
}
