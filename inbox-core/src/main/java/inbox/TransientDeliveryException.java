package inbox;

/**
 * Thrown by an {@link UpdateHandler} when an update should be retried later, for
 * example after a downstream timeout.
 *
 * <p>Equivalent to returning {@link HandleResult#transientFailure(String)}. The drain
 * stops in front of the update and the cursor is not advanced past it.
 */
public class TransientDeliveryException extends RuntimeException {

  public TransientDeliveryException(String message) {
    super(message);
  }

  public TransientDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
