package inbox;

/**
 * Business logic for one kind of update: turning a message into a note, answering a
 * callback query, and so on.
 *
 * <h2>Execution Model</h2>
 * <p>Handlers run one at a time, in ascending {@code updateId} order, on a worker thread
 * owned by the {@link inbox.backlog.BacklogProcessor}. Each call is time-boxed; a handler
 * that does not return within the configured timeout is interrupted and the update is
 * treated as a transient failure.
 *
 * <h2>Idempotency</h2>
 * <p>Delivery is at-least-once. A crash between the handler's side effects and the
 * ledger commit replays the update, so handlers with external side effects should be
 * safe to repeat for the same {@link Update#updateId()}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * registry.register(StandardUpdateKind.MESSAGE, update -> {
 *     notes.save(update.chatId(), update.payload());
 *     return HandleResult.success();
 * });
 * }</pre>
 *
 * @see HandleResult
 * @see inbox.registry.HandlerRegistry
 */
@FunctionalInterface
public interface UpdateHandler {

  /**
   * Handles a single update.
   *
   * @param update the update to handle
   * @return the outcome; {@code null} is treated as a transient failure
   * @throws PermanentDeliveryException to reject the update for good
   * @throws Exception any other exception is treated as a transient failure
   */
  HandleResult handle(Update update) throws Exception;
}
