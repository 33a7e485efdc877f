/**
 * Spring Boot auto-configuration for the sync queue engine.
 *
 * <p>Provide an {@link io.syncqueue.spi.EventProcessor} bean and a {@code DataSource};
 * the engine is created, initialized from {@code syncqueue.*} properties and started with
 * the application context.
 */
package io.syncqueue.spring.boot;
