package tabledeploy.reconcile;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tabledeploy.model.DesiredRow;
import tabledeploy.model.LockScope;
import tabledeploy.model.PrimaryKey;
import tabledeploy.model.TableHandle;
import tabledeploy.remote.RemoteConflictException;
import tabledeploy.remote.RemoteMutationApi;
import tabledeploy.remote.RemoteServiceException;
import tabledeploy.remote.RowMutation;
import tabledeploy.remote.RowResult;
import tabledeploy.remote.TransportException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Submits one batch, retrying the rows that were rejected for an outdated lock version.
 * <p/>
 * Each attempt reads lock versions through the {@link LockVersionCache} and submits every row still pending. Rows
 * that come back with a conflict have their scopes invalidated, and are resubmitted (alone) with fresh versions
 * after a short backoff, up to {@link ReconcilerConfig#maxAttempts()} calls in total. Validation failures and
 * other remote errors are never retried. Transport failures are retried the same way only when
 * {@link ReconcilerConfig#retryTransportErrors()} is set; rows that run out of attempts fail with the cause of the
 * last rejection.
 */
public class ConflictRetryManager {
  private static final Logger LOG = LoggerFactory.getLogger(ConflictRetryManager.class);

  private final RemoteMutationApi api;
  private final LockVersionCache lockVersions;
  private final ReconcilerConfig config;
  private final Sleeper sleeper;

  public ConflictRetryManager(RemoteMutationApi api, LockVersionCache lockVersions, ReconcilerConfig config, Sleeper sleeper) {
    this.api = api;
    this.lockVersions = lockVersions;
    this.config = config;
    this.sleeper = sleeper;
  }

  /**
   * @return one {@link RowAttempt} per row of {@code batch}, in batch order
   */
  public BatchReport submit(Phase phase, TableHandle table, List<DesiredRow> batch) {
    Map<PrimaryKey, RowAttempt> settled = new HashMap<>();
    Map<PrimaryKey, DesiredRow> pending = new LinkedHashMap<>();
    batch.forEach(row -> pending.put(row.primaryKey(), row));

    int calls = 0;
    int retries = 0;
    for (int attempt = 1; !pending.isEmpty(); attempt++) {
      List<DesiredRow> conflicted;
      String rejection = RowOutcome.RETRIES_EXHAUSTED;
      try {
        List<RowMutation> mutations = new ArrayList<>(pending.size());
        for (DesiredRow row : pending.values()) {
          mutations.add(RowMutation.of(row, lockVersions.getAll(table, scopesOf(table, row))));
        }
        calls++;
        List<RowResult> results = phase == Phase.UPDATE
                ? api.batchUpdate(table, mutations)
                : api.batchCreate(table, mutations);
        conflicted = settle(phase, table, pending, results, settled);
      } catch (RemoteConflictException e) {
        LOG.debug("{} batch of {} rows for table '{}' was rejected as conflicting: {}",
                phase, pending.size(), table.name(), e.getMessage());
        conflicted = ImmutableList.copyOf(pending.values());
      } catch (TransportException e) {
        if (!config.retryTransportErrors()) {
          LOG.error("{} batch for table '{}' failed to reach the service", phase, table.name(), e);
          failAll(pending.values(), settled, "transport error: " + e.getMessage());
          break;
        }
        LOG.warn("{} batch for table '{}' failed to reach the service, will retry: {}", phase, table.name(), e.getMessage());
        conflicted = ImmutableList.copyOf(pending.values());
        rejection = "transport error: " + e.getMessage();
      } catch (RemoteServiceException e) {
        LOG.error("{} batch for table '{}' failed", phase, table.name(), e);
        failAll(pending.values(), settled, "remote error: " + e.getMessage());
        break;
      }

      pending.clear();
      if (conflicted.isEmpty()) break;

      for (DesiredRow row : conflicted) {
        lockVersions.invalidateAll(table, scopesOf(table, row));
      }

      if (attempt >= config.maxAttempts()) {
        LOG.warn("Giving up on {} rows of table '{}' after {} attempts: {}", conflicted.size(), table.name(), attempt, rejection);
        failAll(conflicted, settled, rejection);
        break;
      }

      retries++;
      try {
        sleeper.sleep(config.backoffBefore(attempt + 1));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        failAll(conflicted, settled, "interrupted while waiting to retry");
        break;
      }
      LOG.info("Retrying {} rejected rows of table '{}' with fresh lock versions (attempt {} of {})",
              conflicted.size(), table.name(), attempt + 1, config.maxAttempts());
      conflicted.forEach(row -> pending.put(row.primaryKey(), row));
    }

    List<RowAttempt> attempts = batch.stream()
            .map(row -> settled.get(row.primaryKey()))
            .collect(ImmutableList.toImmutableList());
    return new BatchReport(attempts, calls, retries);
  }

  private List<DesiredRow> settle(
          Phase phase,
          TableHandle table,
          Map<PrimaryKey, DesiredRow> pending,
          List<RowResult> results,
          Map<PrimaryKey, RowAttempt> settled
  ) {
    Map<PrimaryKey, RowResult> resultsByKey = new HashMap<>();
    for (RowResult result : results) {
      if (!pending.containsKey(result.primaryKey())) {
        LOG.warn("Ignoring {} result for a row that was not submitted: {}", phase, result);
      } else if (resultsByKey.putIfAbsent(result.primaryKey(), result) != null) {
        LOG.warn("Ignoring duplicate {} result: {}", phase, result);
      }
    }

    List<DesiredRow> conflicted = new ArrayList<>();
    for (DesiredRow row : pending.values()) {
      RowResult result = resultsByKey.get(row.primaryKey());
      if (result == null) {
        settled.put(row.primaryKey(), RowAttempt.failed(row, "the service returned no result for this row"));
        continue;
      }
      switch (result.status()) {
        case SUCCESS -> {
          settled.put(row.primaryKey(), RowAttempt.succeeded(row));
          // a successful write advances the version of every scope it touched
          lockVersions.invalidateAll(table, scopesOf(table, row));
        }
        case VALIDATION_ERROR -> {
          LOG.warn("{} of row [{}] in table '{}' failed validation: {}", phase, row.primaryKey(), table.name(), result.message());
          settled.put(row.primaryKey(), RowAttempt.failed(row, result.message()));
        }
        case NOT_FOUND -> settled.put(row.primaryKey(), phase == Phase.UPDATE
                ? RowAttempt.notFound(row)
                : RowAttempt.failed(row, "not found: " + result.message()));
        case INCOMPLETE -> {
          lockVersions.invalidateAll(table, scopesOf(table, row));
          settled.put(row.primaryKey(), phase == Phase.UPDATE
                  ? RowAttempt.incomplete(row.restrictedTo(result.missingAttributes()))
                  : RowAttempt.failed(row, "values still missing after create: " + result.missingAttributes()));
        }
        case CONFLICT -> conflicted.add(row);
        case ERROR -> {
          LOG.warn("{} of row [{}] in table '{}' failed: {}", phase, row.primaryKey(), table.name(), result.message());
          settled.put(row.primaryKey(), RowAttempt.failed(row, result.message()));
        }
      }
    }
    return conflicted;
  }

  private static void failAll(Iterable<DesiredRow> rows, Map<PrimaryKey, RowAttempt> settled, String cause) {
    for (DesiredRow row : rows) {
      settled.put(row.primaryKey(), RowAttempt.failed(row, cause));
    }
  }

  private static List<LockScope> scopesOf(TableHandle table, DesiredRow row) {
    return LockScope.scopesFor(table.lockLevel(), row);
  }

  public enum Disposition {
    SUCCEEDED,
    NOT_FOUND,
    /** the row exists but lacks some values; {@link RowAttempt#row()} carries only those still to be created */
    INCOMPLETE,
    FAILED
  }

  public record RowAttempt(DesiredRow row, Disposition disposition, String cause) {
    static RowAttempt succeeded(DesiredRow row) {
      return new RowAttempt(row, Disposition.SUCCEEDED, "");
    }

    static RowAttempt notFound(DesiredRow row) {
      return new RowAttempt(row, Disposition.NOT_FOUND, "");
    }

    static RowAttempt incomplete(DesiredRow remainder) {
      return new RowAttempt(remainder, Disposition.INCOMPLETE, "");
    }

    static RowAttempt failed(DesiredRow row, String cause) {
      return new RowAttempt(row, Disposition.FAILED, cause);
    }
  }

  public record BatchReport(List<RowAttempt> rows, int calls, int conflictRetries) {
  }
}
