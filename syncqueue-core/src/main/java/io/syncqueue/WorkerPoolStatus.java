package io.syncqueue;

/**
 * Occupancy of one priority's workers.
 *
 * @param active  workers currently running an event of this priority
 * @param started workers started for this priority since the engine was built
 */
public record WorkerPoolStatus(int active, long started) {
}
