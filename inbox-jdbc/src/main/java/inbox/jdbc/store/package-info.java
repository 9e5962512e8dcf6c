/**
 * JDBC-based {@link inbox.spi.InboxStore} implementations.
 *
 * <p>{@link inbox.jdbc.store.AbstractJdbcInboxStore} provides shared SQL and row mapping;
 * subclasses supply database-specific idempotent inserts and batched deletes: H2
 * (check-then-insert), MySQL ({@code INSERT IGNORE}) and PostgreSQL
 * ({@code ON CONFLICT DO NOTHING}).
 *
 * @see inbox.jdbc.store.JdbcInboxStores
 */
package inbox.jdbc.store;
