package inbox.spi;

/**
 * On-demand reachability check for the message source (for example a {@code getMe} call).
 *
 * <p>Returning {@code false} and throwing are treated the same way: the source is
 * considered unreachable.
 */
@FunctionalInterface
public interface ConnectivityProbe {

  /**
   * Checks whether the message source is reachable right now.
   *
   * @return {@code true} if reachable
   * @throws Exception if the check itself fails
   */
  boolean isReachable() throws Exception;
}
