/**
 * Dispatch rate limiting.
 */
package io.syncqueue.ratelimit;
