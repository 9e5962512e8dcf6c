package inbox.model;

import inbox.Update;

import java.time.Instant;
import java.util.Objects;

/**
 * Insert-only audit record written when an update is durably marked handled, whatever
 * the outcome (success, permanent failure, or no handler).
 *
 * <p>The ledger is keyed by {@code updateId}; writing the same id twice is a no-op.
 *
 * @param updateId      the settled update id
 * @param messageId     message id, or {@code null}
 * @param chatId        chat id, or {@code null}
 * @param processedTime when the update was settled
 * @param messageType   the update kind
 */
public record LedgerEntry(
    long updateId,
    Long messageId,
    Long chatId,
    Instant processedTime,
    String messageType
) {

  public LedgerEntry {
    Objects.requireNonNull(processedTime, "processedTime");
  }

  /**
   * Builds the ledger entry for an update settled at {@code processedTime}.
   */
  public static LedgerEntry of(Update update, Instant processedTime) {
    return new LedgerEntry(update.updateId(), update.messageId(), update.chatId(),
        processedTime, update.kind());
  }
}
