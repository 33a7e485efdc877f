/**
 * Fixed-delay loop used to drive dispatch ticks and cleanup sweeps.
 */
package io.syncqueue.scheduler;
