/**
 * Periodic removal of old completed and dead-lettered events.
 */
package io.syncqueue.purge;
