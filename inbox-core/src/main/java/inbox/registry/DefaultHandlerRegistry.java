package inbox.registry;

import inbox.UpdateHandler;
import inbox.UpdateKind;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry mapping each update kind to exactly one handler.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry()
 *     .register(StandardUpdateKind.MESSAGE, noteTaker::onMessage)
 *     .register("callback_query", update -> HandleResult.success());
 * }</pre>
 *
 * <p>Registering a second handler for the same kind fails fast. Kinds without a handler
 * are settled as processed by the backlog processor so they cannot block the cursor.
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {

  private final Map<String, UpdateHandler> handlers = new ConcurrentHashMap<>();

  /**
   * Registers a handler for a type-safe kind.
   *
   * @param kind    the update kind
   * @param handler the handler
   * @return this registry for chaining
   * @throws IllegalStateException if a handler is already registered for the kind
   */
  public DefaultHandlerRegistry register(UpdateKind kind, UpdateHandler handler) {
    return register(Objects.requireNonNull(kind, "kind").kindName(), handler);
  }

  /**
   * Registers a handler for a string kind.
   *
   * @param kind    the update kind name
   * @param handler the handler
   * @return this registry for chaining
   * @throws IllegalStateException if a handler is already registered for the kind
   */
  public DefaultHandlerRegistry register(String kind, UpdateHandler handler) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(handler, "handler");
    if (kind.isEmpty()) {
      throw new IllegalArgumentException("kind must not be empty");
    }
    UpdateHandler existing = handlers.putIfAbsent(kind, handler);
    if (existing != null) {
      throw new IllegalStateException("Duplicate handler for kind=" + kind);
    }
    return this;
  }

  @Override
  public UpdateHandler handlerFor(String kind) {
    if (kind == null) {
      return null;
    }
    return handlers.get(kind);
  }

  /**
   * Returns the kinds that currently have a handler.
   */
  public Set<String> kinds() {
    return Collections.unmodifiableSet(handlers.keySet());
  }
}
