package tabledeploy.deploy;

import org.immutables.value.Value;

import java.util.List;

@Value.Immutable
public interface DeploymentReport {
  static ImmutableDeploymentReport.Builder builder() {
    return ImmutableDeploymentReport.builder();
  }

  String instanceArn();

  List<TableDeploymentResult> tables();

  default boolean isSuccessful() {
    return tables().stream().allMatch(TableDeploymentResult::isSuccessful);
  }
}
