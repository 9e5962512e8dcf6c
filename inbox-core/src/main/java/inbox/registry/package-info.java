/**
 * Routing of updates to handlers by kind.
 */
package inbox.registry;
