/**
 * Durable cursor and dedup ledger.
 */
package inbox.offset;
