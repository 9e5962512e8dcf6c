/**
 * Ordered, idempotent draining of pending updates.
 */
package inbox.backlog;
