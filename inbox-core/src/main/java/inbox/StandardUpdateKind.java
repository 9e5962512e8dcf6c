package inbox;

/**
 * Update kinds delivered by the Telegram Bot API.
 */
public enum StandardUpdateKind implements UpdateKind {
  MESSAGE("message"),
  EDITED_MESSAGE("edited_message"),
  CALLBACK_QUERY("callback_query"),
  INLINE_QUERY("inline_query"),
  CHAT_MEMBER("chat_member");

  private final String kindName;

  StandardUpdateKind(String kindName) {
    this.kindName = kindName;
  }

  /**
   * Returns the wire name, e.g. {@code "callback_query"}.
   */
  @Override
  public String kindName() {
    return kindName;
  }

  @Override
  public String toString() {
    return kindName;
  }
}
