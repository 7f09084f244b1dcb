/* (C)2026 */
package com.ammann.impact.model;

import java.time.Instant;

/**
 * Boundary record of a business event. The start anchors pre/post-event windows.
 *
 * @param eventId business event identifier
 * @param start   time the event began
 * @param end     time the event ended, {@code null} while it is ongoing
 */
public record EventBounds(String eventId, Instant start, Instant end) {
}
