package inbox;

import java.util.Objects;

/**
 * One event delivered by the message source, identified by a strictly increasing
 * {@code updateId}.
 *
 * <p>{@code chatId} and {@code messageId} are optional because not every kind of update
 * carries a message (an inline query, for example). The {@code payload} is the raw
 * update as received from the source, usually JSON; the inbox never interprets it.
 *
 * @param updateId  source-assigned id, strictly increasing
 * @param chatId    chat the update belongs to, or {@code null}
 * @param messageId message id within the chat, or {@code null}
 * @param kind      routing key used to pick a handler (e.g. {@code "message"})
 * @param payload   raw update body, may be {@code null}
 */
public record Update(long updateId, Long chatId, Long messageId, String kind, String payload) {

  public Update {
    if (updateId <= 0) {
      throw new IllegalArgumentException("updateId must be > 0");
    }
    Objects.requireNonNull(kind, "kind");
    if (kind.isEmpty()) {
      throw new IllegalArgumentException("kind must not be empty");
    }
  }

  /**
   * Shorthand for an update without chat or message coordinates.
   */
  public static Update of(long updateId, String kind, String payload) {
    return new Update(updateId, null, null, kind, payload);
  }

  /**
   * Shorthand for an update addressed to a chat message.
   */
  public static Update of(long updateId, long chatId, long messageId, String kind, String payload) {
    return new Update(updateId, chatId, messageId, kind, payload);
  }
}
