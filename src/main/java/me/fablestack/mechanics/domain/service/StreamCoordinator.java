package me.fablestack.mechanics.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.fablestack.mechanics.domain.exception.ErrorCode;
import me.fablestack.mechanics.domain.exception.MechanicsFailure;
import me.fablestack.mechanics.domain.exception.NarrationUnavailableException;
import me.fablestack.mechanics.domain.model.StreamFrame;
import me.fablestack.mechanics.domain.model.TimelineEvent;
import me.fablestack.mechanics.domain.model.TurnMechanics;
import me.fablestack.mechanics.infrastructure.config.MechanicsProperties;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Orders the frames of one turn: committed mechanical events first, then
 * tag-filtered narration tokens, then an explicit end-of-turn frame.
 *
 * <p>
 * Narration is requested only after the mechanics callable has returned, so
 * the narrator never observes unresolved mechanics. Narrator failure or
 * timeout is recorded through the {@link NarrationListener} and surfaced as an
 * error frame; committed mechanics are unaffected. A consumer cancelling the
 * stream abandons narration only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StreamCoordinator {

    private static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    private final MechanicsProperties properties;

    /**
     * Callbacks through which narration outcomes reach the timeline.
     */
    public interface NarrationListener {

        void onNarrationComplete(String text, List<String> speakers);

        /**
         * @return the event recording the failure, emitted to the consumer
         */
        TimelineEvent onNarrationUnavailable(NarrationUnavailableException failure);
    }

    public Flux<StreamFrame> coordinate(Callable<TurnMechanics> mechanics,
            Function<List<TimelineEvent>, Flux<String>> narration, NarrationListener listener) {
        return Mono.fromCallable(mechanics)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(result -> {
                    Flux<StreamFrame> eventFrames = Flux.fromIterable(result.events()).map(StreamFrame::mechanical);
                    if (result.failed()) {
                        return eventFrames.concatWith(Mono.fromSupplier(() -> errorFrame(result.failure())));
                    }
                    return eventFrames.concatWith(narrationFrames(result.events(), narration, listener));
                })
                .onErrorResume(e -> Mono.just(errorFrame(e)))
                .concatWith(Mono.fromSupplier(StreamFrame::endOfTurn))
                .doOnCancel(() -> log.info("[Stream] Consumer cancelled, narration abandoned"));
    }

    private Flux<StreamFrame> narrationFrames(List<TimelineEvent> committed,
            Function<List<TimelineEvent>, Flux<String>> narration, NarrationListener listener) {
        MechanicsProperties.StreamProperties stream = properties.getStream();
        MechanicsProperties.NarrationProperties settings = properties.getNarration();
        NarrationTagFilter filter = new NarrationTagFilter(stream.getTagOpen(), stream.getTagClose(),
                stream.getMaxTagLength());
        AtomicBoolean failed = new AtomicBoolean(false);
        Duration timeout = settings.getTimeout();

        Flux<StreamFrame> tokens = Flux.defer(() -> narration.apply(committed))
                .onBackpressureBuffer(Math.max(1, settings.getBufferSize()))
                .timeout(timeout)
                .concatMap(chunk -> tokenFrame(filter.accept(chunk)))
                .concatWith(Flux.defer(() -> tokenFrame(filter.finish())))
                .onErrorResume(e -> {
                    failed.set(true);
                    NarrationUnavailableException failure = toNarrationFailure(e, timeout);
                    log.warn("[Stream] Narration unavailable: {}", failure.getMessage());
                    return Mono.fromCallable(() -> listener.onNarrationUnavailable(failure))
                            .subscribeOn(Schedulers.boundedElastic())
                            .flatMapMany(event -> Flux.just(StreamFrame.mechanical(event),
                                    StreamFrame.error(ErrorCode.NARRATION_UNAVAILABLE, failure.getMessage())));
                });

        Mono<StreamFrame> completion = Mono.defer(() -> {
            if (failed.get()) {
                return Mono.empty();
            }
            return Mono.<StreamFrame>fromRunnable(
                    () -> listener.onNarrationComplete(filter.getText(), filter.getSpeakers()))
                    .subscribeOn(Schedulers.boundedElastic());
        });
        return tokens.concatWith(completion);
    }

    private Mono<StreamFrame> tokenFrame(String text) {
        return text.isEmpty() ? Mono.empty() : Mono.just(StreamFrame.token(text));
    }

    private NarrationUnavailableException toNarrationFailure(Throwable e, Duration timeout) {
        if (e instanceof NarrationUnavailableException failure) {
            return failure;
        }
        if (e instanceof TimeoutException) {
            return new NarrationUnavailableException("Narration timed out after " + timeout, e);
        }
        return new NarrationUnavailableException("Narrator failed: " + e.getMessage(), e);
    }

    /**
     * Maps a failure to a typed error frame. Unexpected failures are logged and
     * reported without internal detail.
     */
    public static StreamFrame errorFrame(Throwable e) {
        if (e instanceof MechanicsFailure failure) {
            return StreamFrame.error(failure.getErrorCode(), e.getMessage());
        }
        log.error("[Stream] Unexpected error during turn", e);
        return StreamFrame.error(ErrorCode.INTERNAL, INTERNAL_ERROR_MESSAGE);
    }
}
