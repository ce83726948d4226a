package tabledeploy.reconcile;

import java.time.Duration;

/**
 * Waits between conflict retries; replaced in tests to keep them fast and deterministic.
 */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
