package tabledeploy.deploy;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tabledeploy.remote.DataTableAdmin;
import tabledeploy.remote.RemoteServiceException;

import javax.inject.Inject;
import java.util.List;
import java.util.Optional;

/**
 * Deletes the declared tables, by name, from the instance.
 */
public class TableCleanup {
  private static final Logger LOG = LoggerFactory.getLogger(TableCleanup.class);

  private final DataTableAdmin admin;

  @Inject
  public TableCleanup(DataTableAdmin admin) {
    this.admin = admin;
  }

  public List<Result> deleteAll(List<String> tableNames) {
    ImmutableList.Builder<Result> results = ImmutableList.builder();
    for (String tableName : tableNames) {
      results.add(delete(tableName));
    }
    return results.build();
  }

  public Result delete(String tableName) {
    try {
      Optional<String> deleted = admin.deleteTable(tableName);
      if (deleted.isPresent()) {
        LOG.info("Deleted data table '{}' ({})", tableName, deleted.get());
        return new Result(tableName, Status.DELETED, deleted.get());
      }
      LOG.info("Data table '{}' does not exist", tableName);
      return new Result(tableName, Status.NOT_FOUND, "table does not exist");
    } catch (RemoteServiceException e) {
      LOG.warn("Failed to delete data table '{}'", tableName, e);
      return new Result(tableName, Status.FAILED, e.getMessage());
    }
  }

  public enum Status {
    DELETED,
    NOT_FOUND,
    FAILED
  }

  public record Result(String tableName, Status status, String detail) {
    public String render() {
      String marker = switch (status) {
        case DELETED -> "[OK]";
        case NOT_FOUND -> "[SKIP]";
        case FAILED -> "[FAIL]";
      };
      return String.format("%s %s: %s (%s)", marker, tableName, status.name().toLowerCase(), detail);
    }
  }
}
