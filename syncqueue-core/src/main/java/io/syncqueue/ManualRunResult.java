package io.syncqueue;

/**
 * Outcome of {@link SyncQueueEngine#runPriorityManually}.
 *
 * @param success   {@code false} if the run could not fetch events
 * @param processed events that completed successfully
 * @param total     events fetched
 * @param error     failure description when {@code success} is false
 */
public record ManualRunResult(boolean success, int processed, int total, String error) {

  public static ManualRunResult completed(int processed, int total) {
    return new ManualRunResult(true, processed, total, null);
  }

  public static ManualRunResult failed(String error) {
    return new ManualRunResult(false, 0, 0, error);
  }
}
