package inbox;

/**
 * Thrown by an {@link UpdateHandler} to reject an update for good.
 *
 * <p>Equivalent to returning {@link HandleResult#permanentFailure(String)}: the update is
 * recorded in the ledger, counted as failed and never retried automatically.
 */
public class PermanentDeliveryException extends RuntimeException {

  public PermanentDeliveryException(String message) {
    super(message);
  }

  public PermanentDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
