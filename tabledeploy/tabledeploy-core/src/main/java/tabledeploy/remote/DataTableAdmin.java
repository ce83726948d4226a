package tabledeploy.remote;

import tabledeploy.model.AttributeSpec;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read and delete access to the data tables of an instance, for post-deployment verification and cleanup.
 */
public interface DataTableAdmin {
  List<TableSummary> listTables();

  List<AttributeSpec> describeAttributes(TableSummary table);

  /**
   * @return up to {@code limit} stored values of the table, rendered as the service reports them
   */
  List<StoredValue> sampleValues(TableSummary table, int limit);

  /**
   * @return the id of the deleted table, or empty if no table has that name
   */
  Optional<String> deleteTable(String tableName);

  record TableSummary(String id, String name) {
  }

  record StoredValue(Map<String, String> primaryValues, String attributeName, String value) {
  }
}
