package me.fablestack.mechanics.domain.exception;

/**
 * Implemented by every typed failure of the mechanics core so transports can
 * render a stable error code without inspecting concrete exception classes.
 */
public interface MechanicsFailure {

    ErrorCode getErrorCode();
}
