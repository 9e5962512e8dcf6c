package inbox;

/**
 * Type-safe routing key for updates.
 *
 * <p>Implement with an enum for compile-time safety, or use
 * {@link StandardUpdateKind} for the kinds a Telegram bot usually subscribes to.
 * Plain strings work too; see {@link inbox.registry.DefaultHandlerRegistry#register(String, UpdateHandler)}.
 */
@FunctionalInterface
public interface UpdateKind {

  /**
   * Returns the kind name as it appears in {@link Update#kind()}.
   */
  String kindName();
}
