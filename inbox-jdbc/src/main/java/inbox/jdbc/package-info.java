/**
 * JDBC persistence for the inbox cursor and ledger: connection provider, SQL helper,
 * table name validation and schema bootstrap.
 *
 * @see inbox.jdbc.store
 */
package inbox.jdbc;
