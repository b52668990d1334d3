package me.fablestack.mechanics.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.fablestack.mechanics.adapter.inbound.web.dto.ApiErrorResponse;
import me.fablestack.mechanics.domain.exception.ErrorCode;
import me.fablestack.mechanics.domain.exception.MechanicsFailure;
import me.fablestack.mechanics.domain.exception.NarrationUnavailableException;
import me.fablestack.mechanics.domain.exception.NotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for API controllers. Maps the mechanics error
 * taxonomy onto HTTP statuses; the error code in the body matches the one
 * turn-stream error frames carry.
 */
@ControllerAdvice(basePackages = "me.fablestack.mechanics.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, codeFor(status), ex.getReason());
    }

    @ExceptionHandler(NotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(NotFoundException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(NarrationUnavailableException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNarrationUnavailable(NarrationUnavailableException ex) {
        log.warn("[API] Narration unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, codeOf(ex, ErrorCode.VALIDATION), ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, codeOf(ex, ErrorCode.STATE_CONFLICT), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL, "Internal server error");
    }

    private Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, ErrorCode code, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .code(code)
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    private ErrorCode codeOf(Exception ex, ErrorCode fallback) {
        return ex instanceof MechanicsFailure failure ? failure.getErrorCode() : fallback;
    }

    private ErrorCode codeFor(HttpStatus status) {
        return switch (status) {
        case BAD_REQUEST, UNSUPPORTED_MEDIA_TYPE -> ErrorCode.VALIDATION;
        case NOT_FOUND -> ErrorCode.NOT_FOUND;
        case CONFLICT -> ErrorCode.STATE_CONFLICT;
        case SERVICE_UNAVAILABLE -> ErrorCode.NARRATION_UNAVAILABLE;
        default -> ErrorCode.INTERNAL;
        };
    }
}
