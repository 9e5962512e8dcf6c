package inbox.spi;

import inbox.Update;

import java.util.List;

/**
 * Client for the long-polling message source (for example the Bot API
 * {@code getUpdates} call).
 *
 * <p>Returned updates must be in ascending {@code updateId} order. The inbox never
 * reorders them; it may see the same update more than once and deduplicates by id.
 */
@FunctionalInterface
public interface UpdateSource {

  /**
   * Fetches up to {@code limit} updates with {@code updateId >= offset}.
   *
   * @param offset first update id to return
   * @param limit  maximum number of updates
   * @return updates in ascending id order, empty if none are pending
   * @throws Exception if the source cannot be reached
   */
  List<Update> fetch(long offset, int limit) throws Exception;
}
