package tabledeploy.reconcile;

import org.immutables.value.Value;

import java.util.List;

/**
 * What one reconciliation run did to a table: how many rows were updated, created or failed, and why each failure
 * happened. Every desired row is counted exactly once.
 */
@Value.Immutable
public interface ReconciliationSummary {
  static ImmutableReconciliationSummary.Builder builder() {
    return ImmutableReconciliationSummary.builder();
  }

  String tableName();

  int updated();

  int created();

  int failed();

  List<RowOutcome> failures();

  @Value.Default
  default PhaseStats updatePhase() {
    return PhaseStats.EMPTY;
  }

  @Value.Default
  default PhaseStats createPhase() {
    return PhaseStats.EMPTY;
  }

  default int total() {
    return updated() + created() + failed();
  }

  default boolean isSuccessful() {
    return failed() == 0;
  }

  default String describe() {
    return String.format(
            "%d updated, %d created, %d failed, %d total", updated(), created(), failed(), total());
  }

  @Value.Check
  default void checkCounts() {
    if (failures().size() != failed()) {
      throw new IllegalStateException("failure list does not match failed count: " + failures().size() + " != " + failed());
    }
  }
}
