package inbox.util;

import java.time.Duration;

/**
 * Pause between dispatches. Swappable so tests can observe pauses without waiting.
 */
@FunctionalInterface
public interface Sleeper {

  /** Sleeps on the calling thread with {@link Thread#sleep(long)}. */
  Sleeper THREAD_SLEEP = duration -> {
    if (!duration.isZero() && !duration.isNegative()) {
      Thread.sleep(duration.toMillis());
    }
  };

  /**
   * Pauses for the given duration.
   *
   * @param duration how long to pause; zero means no pause
   * @throws InterruptedException if the thread is interrupted while paused
   */
  void sleep(Duration duration) throws InterruptedException;
}
