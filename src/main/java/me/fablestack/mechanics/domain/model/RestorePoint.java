package me.fablestack.mechanics.domain.model;

import java.time.Instant;

/**
 * Turn boundary the timeline can be rolled back to. Rolling back to
 * {@code sequenceNumber} removes the turn started by the player input the
 * preview shows.
 */
public record RestorePoint(long sequenceNumber, Instant timestamp, String humanPreview) {
}
