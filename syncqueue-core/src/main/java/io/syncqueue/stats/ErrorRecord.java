package io.syncqueue.stats;

import java.time.Instant;

/**
 * One entry of the recent-error ring.
 *
 * @param type      origin of the error, e.g. {@code event_processing} or {@code high_queue}
 * @param message   error message; never {@code null}
 * @param eventId   affected event, or {@code null} for loop-level errors
 * @param exception class name of the causing exception, or {@code null}
 * @param timestamp when the error was recorded
 */
public record ErrorRecord(String type, String message, String eventId, String exception, Instant timestamp) {
}
