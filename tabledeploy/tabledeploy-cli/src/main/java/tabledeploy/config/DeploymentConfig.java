package tabledeploy.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;
import tabledeploy.model.TableSpec;

import java.util.List;

/**
 * The contents of {@code data_tables_config.json}: the target Connect instance and the tables to deploy to it.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableDeploymentConfig.class)
@JsonDeserialize(as = ImmutableDeploymentConfig.class)
public interface DeploymentConfig {
  static ImmutableDeploymentConfig.Builder builder() {
    return ImmutableDeploymentConfig.builder();
  }

  @JsonProperty("instanceARN")
  String instanceArn();

  List<TableSpec> dataTables();
}
