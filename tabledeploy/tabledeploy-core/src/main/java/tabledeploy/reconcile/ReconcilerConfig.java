package tabledeploy.reconcile;

import org.immutables.value.Value;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Operational tuning for value reconciliation. Defaults match the data-table service's batch ceiling of 25 and a
 * short, bounded conflict retry.
 */
@Value.Immutable
public interface ReconcilerConfig {
  static ImmutableReconcilerConfig.Builder builder() {
    return ImmutableReconcilerConfig.builder();
  }

  static ReconcilerConfig defaults() {
    return builder().build();
  }

  /** rows per batch call */
  @Value.Default
  default int batchSize() {
    return 25;
  }

  /** calls per batch, including the first, before conflicted rows are given up on */
  @Value.Default
  default int maxAttempts() {
    return 3;
  }

  @Value.Default
  default Duration retryBackoff() {
    return Duration.ofMillis(200);
  }

  @Value.Default
  default Duration maxRetryBackoff() {
    return Duration.ofSeconds(2);
  }

  /**
   * Whether timeouts and connection failures are retried like lock conflicts (sharing the same attempt bound) rather
   * than failing the affected rows immediately.
   */
  @Value.Default
  default boolean retryTransportErrors() {
    return false;
  }

  /**
   * @return the pause before the given attempt (2 or later): {@link #retryBackoff()} doubled for each earlier retry,
   * capped at {@link #maxRetryBackoff()}
   */
  default Duration backoffBefore(int attempt) {
    checkArgument(attempt >= 2, "the first attempt is not preceded by a backoff");
    Duration backoff = retryBackoff();
    for (int i = 2; i < attempt && backoff.compareTo(maxRetryBackoff()) < 0; i++) {
      backoff = backoff.multipliedBy(2);
    }
    return backoff.compareTo(maxRetryBackoff()) > 0 ? maxRetryBackoff() : backoff;
  }

  @Value.Check
  default void checkValues() {
    checkArgument(maxAttempts() >= 1, "maxAttempts must be at least 1, was %s", maxAttempts());
    checkArgument(!retryBackoff().isNegative(), "retryBackoff must not be negative");
    checkArgument(!maxRetryBackoff().isNegative(), "maxRetryBackoff must not be negative");
  }
}
