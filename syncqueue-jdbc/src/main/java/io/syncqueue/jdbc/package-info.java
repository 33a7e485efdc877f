/**
 * JDBC implementations of {@link io.syncqueue.spi.EventStore}.
 *
 * <p>{@link io.syncqueue.jdbc.JdbcEventStores#detect(javax.sql.DataSource)} picks the
 * store for a data source from its JDBC URL. Table DDL for each database ships under
 * {@code schema/} on the classpath.
 */
package io.syncqueue.jdbc;
