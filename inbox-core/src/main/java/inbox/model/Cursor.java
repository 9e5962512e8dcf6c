package inbox.model;

import java.time.Instant;

/**
 * The singleton cursor row: the highest update id whose outcome is durably settled.
 *
 * <p>{@code lastUpdateId} never decreases. A cursor that was never written reads as
 * {@link #INITIAL}.
 *
 * @param lastUpdateId      highest settled update id, 0 before the first commit
 * @param lastProcessedTime when the cursor last moved, or {@code null} if it never did
 * @param createdAt         when the cursor row was created, or {@code null} if it does not exist yet
 */
public record Cursor(long lastUpdateId, Instant lastProcessedTime, Instant createdAt) {

  /** Cursor of a store that has never committed an update. */
  public static final Cursor INITIAL = new Cursor(0L, null, null);
}
