package tabledeploy.reconcile;

import com.google.common.collect.ImmutableList;
import tabledeploy.model.DesiredRow;
import tabledeploy.model.PrimaryKey;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Collects the outcome of every desired row across both phases, and folds them into a
 * {@link ReconciliationSummary}. Recording a second outcome for the same row is a bug, and fails fast.
 */
public class OutcomeReporter {
  private final String tableName;
  private final Map<PrimaryKey, RowOutcome> outcomes = new LinkedHashMap<>();
  private final Map<Phase, PhaseCounter> phases = new EnumMap<>(Phase.class);

  public OutcomeReporter(String tableName, List<DesiredRow> rows) {
    this.tableName = tableName;
    for (DesiredRow row : rows) {
      checkArgument(!outcomes.containsKey(row.primaryKey()), "Duplicate row: %s", row.primaryKey());
      outcomes.put(row.primaryKey(), null);
    }
    for (Phase phase : Phase.values()) {
      phases.put(phase, new PhaseCounter());
    }
  }

  public void record(RowOutcome outcome) {
    PrimaryKey key = outcome.primaryKey();
    checkArgument(outcomes.containsKey(key), "Not a desired row of table '%s': %s", tableName, key);
    RowOutcome previous = outcomes.put(key, outcome);
    checkState(previous == null, "Row %s already has outcome %s (attempted to record %s)", key, previous, outcome);
  }

  public void phaseStarted(Phase phase, int rows) {
    phases.get(phase).rows += rows;
  }

  public void batchCompleted(Phase phase, int calls, int conflictRetries) {
    PhaseCounter counter = phases.get(phase);
    counter.batches++;
    counter.calls += calls;
    counter.conflictRetries += conflictRetries;
  }

  public void rowNotFound(Phase phase) {
    phases.get(phase).notFound++;
  }

  public boolean hasOutcome(PrimaryKey key) {
    return outcomes.get(key) != null;
  }

  public ReconciliationSummary summarize() {
    List<PrimaryKey> missing = outcomes.entrySet().stream()
            .filter(entry -> entry.getValue() == null)
            .map(Map.Entry::getKey)
            .collect(ImmutableList.toImmutableList());
    checkState(missing.isEmpty(), "No outcome was recorded for rows %s of table '%s'", missing, tableName);

    int updated = 0;
    int created = 0;
    ImmutableList.Builder<RowOutcome> failures = ImmutableList.builder();
    for (RowOutcome outcome : outcomes.values()) {
      switch (outcome.kind()) {
        case UPDATED -> updated++;
        case CREATED -> created++;
        case FAILED -> failures.add(outcome);
      }
    }
    List<RowOutcome> failed = failures.build();
    return ReconciliationSummary.builder()
            .tableName(tableName)
            .updated(updated)
            .created(created)
            .failed(failed.size())
            .failures(failed)
            .updatePhase(phases.get(Phase.UPDATE).toStats())
            .createPhase(phases.get(Phase.CREATE).toStats())
            .build();
  }

  private static class PhaseCounter {
    int rows;
    int batches;
    int calls;
    int conflictRetries;
    int notFound;

    PhaseStats toStats() {
      return new PhaseStats(rows, batches, calls, conflictRetries, notFound);
    }
  }
}
