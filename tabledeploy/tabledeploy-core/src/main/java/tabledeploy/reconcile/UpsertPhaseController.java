package tabledeploy.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tabledeploy.model.DesiredRow;
import tabledeploy.model.TableHandle;

import tabledeploy.model.PrimaryKey;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drives the two phases of one reconciliation run over a table.
 * <ol>
 *   <li>UPDATE: every desired row is submitted as an update.</li>
 *   <li>CREATE: the rows that UPDATE reported as not found (and only those) are submitted as creates.</li>
 * </ol>
 * A row that exists but lacks some of its values has the rest written by UPDATE; only the missing values are
 * submitted in CREATE, and the row counts as updated once they are written.
 * CREATE begins only after every UPDATE batch has settled. Batches are dispatched one at a time, so a row is never
 * in flight in two calls at once. If the thread is interrupted, rows not yet submitted are recorded as failed and
 * a summary is still produced.
 */
public class UpsertPhaseController {
  private static final Logger LOG = LoggerFactory.getLogger(UpsertPhaseController.class);

  private final TableHandle table;
  private final BatchChunker chunker;
  private final ConflictRetryManager retryManager;

  public UpsertPhaseController(TableHandle table, BatchChunker chunker, ConflictRetryManager retryManager) {
    this.table = table;
    this.chunker = chunker;
    this.retryManager = retryManager;
  }

  public ReconciliationSummary run(List<DesiredRow> rows) {
    OutcomeReporter reporter = new OutcomeReporter(table.name(), rows);
    Set<PrimaryKey> partiallyPresent = new HashSet<>();

    LOG.info("Phase 1: attempting to update {} rows of table '{}'", rows.size(), table.name());
    List<DesiredRow> notFound = runPhase(Phase.UPDATE, rows, reporter, partiallyPresent);

    if (!notFound.isEmpty()) {
      LOG.info("Phase 2: creating {} new rows of table '{}'", notFound.size(), table.name());
      runPhase(Phase.CREATE, notFound, reporter, partiallyPresent);
    }

    ReconciliationSummary summary = reporter.summarize();
    LOG.info("Value reconciliation for table '{}': {}", table.name(), summary.describe());
    return summary;
  }

  /**
   * @return the rows (or, for rows already present, the values) the phase found missing
   */
  private List<DesiredRow> runPhase(Phase phase, List<DesiredRow> rows, OutcomeReporter reporter, Set<PrimaryKey> partiallyPresent) {
    reporter.phaseStarted(phase, rows.size());
    List<DesiredRow> notFound = new ArrayList<>();
    for (List<DesiredRow> batch : chunker.chunk(rows)) {
      if (Thread.currentThread().isInterrupted()) {
        LOG.warn("Reconciliation of table '{}' was interrupted; skipping {} batch of {} rows", table.name(), phase, batch.size());
        batch.forEach(row -> reporter.record(RowOutcome.failed(row.primaryKey(), phase, RowOutcome.CANCELLED)));
        continue;
      }

      ConflictRetryManager.BatchReport report;
      try {
        report = retryManager.submit(phase, table, batch);
      } catch (RuntimeException e) {
        LOG.error("Unexpected failure submitting {} batch of {} rows for table '{}'", phase, batch.size(), table.name(), e);
        batch.forEach(row -> reporter.record(RowOutcome.failed(row.primaryKey(), phase, "unexpected error: " + e)));
        continue;
      }

      reporter.batchCompleted(phase, report.calls(), report.conflictRetries());
      for (ConflictRetryManager.RowAttempt attempt : report.rows()) {
        DesiredRow row = attempt.row();
        switch (attempt.disposition()) {
          case SUCCEEDED -> reporter.record(phase == Phase.UPDATE || partiallyPresent.contains(row.primaryKey())
                  ? RowOutcome.updated(row.primaryKey())
                  : RowOutcome.created(row.primaryKey()));
          case NOT_FOUND -> {
            reporter.rowNotFound(phase);
            notFound.add(row);
          }
          case INCOMPLETE -> {
            LOG.debug("Row [{}] of table '{}' is missing values for {}", row.primaryKey(), table.name(), row.attributes());
            partiallyPresent.add(row.primaryKey());
            reporter.rowNotFound(phase);
            notFound.add(row);
          }
          case FAILED -> reporter.record(RowOutcome.failed(row.primaryKey(), phase, attempt.cause()));
        }
      }
      LOG.debug("{} batch of {} rows for table '{}' settled after {} calls", phase, batch.size(), table.name(), report.calls());
    }
    return notFound;
  }
}
