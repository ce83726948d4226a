package tabledeploy.reconcile;

import com.google.common.collect.Iterables;
import tabledeploy.model.ConfigurationException;

import java.util.List;

/**
 * Splits rows into consecutive batches of at most {@link #batchSize()} elements, preserving order.
 */
public class BatchChunker {
  private final int batchSize;

  /**
   * @throws ConfigurationException unless {@code 0 < batchSize <= serviceCeiling}
   */
  public BatchChunker(int batchSize, int serviceCeiling) {
    if (batchSize <= 0) {
      throw ConfigurationException.format("Batch size must be positive, was %d", batchSize);
    }
    if (batchSize > serviceCeiling) {
      throw ConfigurationException.format(
              "Batch size %d exceeds the service's limit of %d rows per call", batchSize, serviceCeiling);
    }
    this.batchSize = batchSize;
  }

  public int batchSize() {
    return batchSize;
  }

  /**
   * @return a lazy view of {@code rows} in batches; every row appears in exactly one batch
   */
  public <T> Iterable<List<T>> chunk(Iterable<T> rows) {
    return Iterables.partition(rows, batchSize);
  }
}
