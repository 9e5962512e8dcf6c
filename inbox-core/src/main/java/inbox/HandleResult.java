package inbox;

import java.util.Objects;

/**
 * Outcome reported by an {@link UpdateHandler} for a single update.
 *
 * <ul>
 *   <li>{@link Success}: the update was handled; it is recorded in the ledger and the
 *       cursor moves past it.</li>
 *   <li>{@link PermanentFailure}: the update can never succeed (bad input, rejected by
 *       business rules). It is recorded and skipped for good, so it cannot block the
 *       updates behind it.</li>
 *   <li>{@link TransientFailure}: the update may succeed later (downstream timeout,
 *       rate limit). Nothing is recorded, the cursor stays in front of the update and the
 *       current drain stops so the next drain resumes at exactly this update.</li>
 * </ul>
 *
 * <p>Handlers may also throw {@link PermanentDeliveryException} or
 * {@link TransientDeliveryException}; any other exception counts as transient.
 *
 * @see UpdateHandler
 */
public sealed interface HandleResult
    permits HandleResult.Success, HandleResult.PermanentFailure, HandleResult.TransientFailure {

  /**
   * Singleton success result.
   */
  Success SUCCESS = new Success();

  static Success success() {
    return SUCCESS;
  }

  /**
   * Creates a permanent failure with a human-readable reason for the log.
   *
   * @param reason why the update was rejected
   * @return a permanent failure
   */
  static PermanentFailure permanentFailure(String reason) {
    return new PermanentFailure(reason);
  }

  /**
   * Creates a transient failure with a human-readable reason for the log.
   *
   * @param reason why the update should be retried
   * @return a transient failure
   */
  static TransientFailure transientFailure(String reason) {
    return new TransientFailure(reason);
  }

  /**
   * Update handled.
   */
  record Success() implements HandleResult {
  }

  /**
   * Update rejected for good.
   *
   * @param reason failure description (never null)
   */
  record PermanentFailure(String reason) implements HandleResult {
    public PermanentFailure {
      Objects.requireNonNull(reason, "reason");
    }
  }

  /**
   * Update should be retried by a later drain.
   *
   * @param reason failure description (never null)
   */
  record TransientFailure(String reason) implements HandleResult {
    public TransientFailure {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
