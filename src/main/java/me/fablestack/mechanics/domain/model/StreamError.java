package me.fablestack.mechanics.domain.model;

import me.fablestack.mechanics.domain.exception.ErrorCode;

public record StreamError(ErrorCode code, String message) {
}
