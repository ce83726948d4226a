package tabledeploy.remote;

import tabledeploy.model.TableHandle;

import java.util.List;

/**
 * Batch value writes against a provisioned data table.
 * <p/>
 * Both calls return one {@link RowResult} per submitted mutation (matched by primary key, in any order). Row-level
 * problems are reported as results; a failure of the call as a whole is thrown as a {@link RemoteServiceException}
 * ({@link RemoteConflictException} when the whole batch was rejected for an outdated lock version,
 * {@link TransportException} when the service could not be reached).
 */
public interface RemoteMutationApi {
  List<RowResult> batchUpdate(TableHandle table, List<RowMutation> mutations);

  List<RowResult> batchCreate(TableHandle table, List<RowMutation> mutations);

  /**
   * @return the largest number of rows accepted by a single batch call
   */
  int maxBatchSize();
}
