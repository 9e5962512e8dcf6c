/**
 * Scheduled removal of expired ledger entries.
 */
package inbox.purge;
