package inbox.backlog;

/**
 * Summary of one {@link BacklogProcessor#processBacklog} call.
 *
 * @param processed  updates settled as handled, including updates with no handler
 * @param failed     updates settled as permanent failures
 * @param duplicates updates skipped because they were already settled
 * @param stalled    {@code true} if the drain stopped in front of a transient failure,
 *                   a source error or an interrupt, leaving updates for a later drain
 * @param cursor     cursor position after the call
 */
public record DrainResult(int processed, int failed, int duplicates, boolean stalled, long cursor) {

  /**
   * Returns {@code true} if the call settled or skipped nothing.
   */
  public boolean isEmpty() {
    return processed == 0 && failed == 0 && duplicates == 0;
  }
}
