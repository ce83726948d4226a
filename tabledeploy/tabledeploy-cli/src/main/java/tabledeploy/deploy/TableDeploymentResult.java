package tabledeploy.deploy;

import org.immutables.value.Value;
import tabledeploy.reconcile.ReconciliationSummary;
import tabledeploy.remote.AttributeProvisioning;

import java.util.List;
import java.util.Optional;

/**
 * What deploying one table did. Attribute and value results are empty when that step was skipped (nothing was
 * declared) or never reached (the table failed first).
 */
@Value.Immutable
public interface TableDeploymentResult {
  static ImmutableTableDeploymentResult.Builder builder() {
    return ImmutableTableDeploymentResult.builder();
  }

  static TableDeploymentResult failed(String tableName, String error) {
    return builder().tableName(tableName).status(Status.FAILED).error(error).build();
  }

  enum Status {
    CREATED,
    EXISTING,
    FAILED
  }

  String tableName();

  Status status();

  Optional<String> tableId();

  Optional<String> error();

  Optional<List<AttributeProvisioning>> attributes();

  Optional<ReconciliationSummary> values();

  /**
   * @return false if the table failed, or any of its attributes or rows did
   */
  default boolean isSuccessful() {
    return status() != Status.FAILED
            && attributes().map(list -> list.stream().noneMatch(a -> a.status() == AttributeProvisioning.Status.FAILED)).orElse(true)
            && values().map(ReconciliationSummary::isSuccessful).orElse(true);
  }
}
