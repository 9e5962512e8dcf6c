/**
 * Periodic connectivity checks that trigger a backlog drain after an outage.
 */
package inbox.reconnect;
