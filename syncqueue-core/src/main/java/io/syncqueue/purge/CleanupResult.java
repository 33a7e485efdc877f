package io.syncqueue.purge;

/**
 * Rows removed by one cleanup run. A step that failed or was skipped reports {@code 0}.
 */
public record CleanupResult(int completedDeleted, int deadLetterDeleted) {

  public int total() {
    return completedDeleted + deadLetterDeleted;
  }
}
