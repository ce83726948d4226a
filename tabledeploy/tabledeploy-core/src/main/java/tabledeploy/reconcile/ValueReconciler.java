package tabledeploy.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tabledeploy.model.ConfigurationException;
import tabledeploy.model.DesiredRow;
import tabledeploy.model.PrimaryKey;
import tabledeploy.model.TableHandle;
import tabledeploy.model.TableSchema;
import tabledeploy.remote.LockTokenFetchApi;
import tabledeploy.remote.RemoteMutationApi;

import javax.inject.Inject;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reconciles the desired rows of a table against the data-table service, with an update-first upsert.
 * <p/>
 * Each call is an independent run with its own {@link LockVersionCache}. Declarations that can never succeed
 * (a batch size the service won't accept, rows that don't fit the table's schema, two rows with the same primary
 * key) are rejected with a {@link ConfigurationException} before anything is sent. Past that point, row-level
 * failures never abort the run: they are recorded in the returned {@link ReconciliationSummary}.
 */
public class ValueReconciler {
  private static final Logger LOG = LoggerFactory.getLogger(ValueReconciler.class);

  private final RemoteMutationApi mutationApi;
  private final LockTokenFetchApi lockTokenApi;
  private final ReconcilerConfig config;
  private final Sleeper sleeper;

  @Inject
  public ValueReconciler(
          RemoteMutationApi mutationApi,
          LockTokenFetchApi lockTokenApi,
          ReconcilerConfig config,
          Sleeper sleeper
  ) {
    this.mutationApi = mutationApi;
    this.lockTokenApi = lockTokenApi;
    this.config = config;
    this.sleeper = sleeper;
  }

  public ReconciliationSummary reconcile(TableHandle table, TableSchema schema, List<DesiredRow> rows) {
    BatchChunker chunker = new BatchChunker(config.batchSize(), mutationApi.maxBatchSize());
    if (!schema.tableName().equals(table.name())) {
      LOG.warn("Reconciling table '{}' with the schema declared for '{}'", table.name(), schema.tableName());
    }
    List<DesiredRow> normalized = normalize(schema, rows);

    ConflictRetryManager retryManager = new ConflictRetryManager(
            mutationApi,
            new LockVersionCache(lockTokenApi),
            config,
            sleeper
    );
    return new UpsertPhaseController(table, chunker, retryManager).run(normalized);
  }

  private static List<DesiredRow> normalize(TableSchema schema, List<DesiredRow> rows) {
    List<DesiredRow> normalized = new ArrayList<>(rows.size());
    Set<PrimaryKey> keys = new HashSet<>();
    for (DesiredRow row : rows) {
      DesiredRow checked = schema.normalize(row);
      if (!keys.add(checked.primaryKey())) {
        throw ConfigurationException.format(
                "Table '%s' declares more than one row with primary key [%s]", schema.tableName(), checked.primaryKey());
      }
      normalized.add(checked);
    }
    return normalized;
  }
}
