/**
 * Persistent records of the inbox: the {@link inbox.model.Cursor} and the
 * {@link inbox.model.LedgerEntry}.
 */
package inbox.model;
