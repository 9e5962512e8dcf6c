package inbox.registry;

import inbox.UpdateHandler;

/**
 * Looks up the handler for an update kind.
 *
 * @see DefaultHandlerRegistry
 */
@FunctionalInterface
public interface HandlerRegistry {

  /**
   * Returns the handler registered for the given kind.
   *
   * @param kind the update kind, e.g. {@code "message"}
   * @return the handler, or {@code null} if none is registered
   */
  UpdateHandler handlerFor(String kind);
}
