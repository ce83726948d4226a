package tabledeploy.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import tabledeploy.aws.ConnectClientConfig;
import tabledeploy.model.ConfigurationException;
import tabledeploy.reconcile.ReconcilerConfig;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Application settings under {@code tabledeploy}, from {@code reference.conf} overlaid by system properties and an
 * optional HOCON file.
 */
public class TableDeploySettings {
  public static final String ROOT = "tabledeploy";

  private final Config config;

  public TableDeploySettings(Config config) {
    this.config = config.getConfig(ROOT);
  }

  public static TableDeploySettings load(Optional<Path> overrideFile) {
    Config fileConfig = overrideFile.map(TableDeploySettings::parseFile).orElseGet(ConfigFactory::empty);
    return new TableDeploySettings(fileConfig.withFallback(ConfigFactory.load()).resolve());
  }

  private static Config parseFile(Path file) {
    if (!Files.exists(file)) throw ConfigurationException.format("Settings file not found: %s", file);
    try {
      return ConfigFactory.parseFile(file.toFile());
    } catch (ConfigException e) {
      throw new ConfigurationException("Invalid settings file " + file + ": " + e.getMessage(), e);
    }
  }

  public Path configDir() {
    return Path.of(config.getString("config-dir"));
  }

  public int verifySampleSize() {
    return config.getInt("verify.sample-size");
  }

  public ReconcilerConfig reconcilerConfig() {
    Config reconciler = config.getConfig("reconciler");
    try {
      return ReconcilerConfig.builder()
              .batchSize(reconciler.getInt("batch-size"))
              .maxAttempts(reconciler.getInt("max-attempts"))
              .retryBackoff(reconciler.getDuration("retry-backoff"))
              .maxRetryBackoff(reconciler.getDuration("max-retry-backoff"))
              .retryTransportErrors(reconciler.getBoolean("retry-transport-errors"))
              .build();
    } catch (ConfigException | IllegalArgumentException e) {
      throw new ConfigurationException("Invalid " + ROOT + ".reconciler settings: " + e.getMessage(), e);
    }
  }

  /**
   * @param instance the instance ARN declared by the deployment being run
   */
  public ConnectClientConfig connectClientConfig(String instance) {
    Config aws = config.getConfig("aws");
    try {
      return ConnectClientConfig.builder()
              .instance(instance)
              .region(aws.getString("region"))
              .endpoint(optionalString(aws, "endpoint").map(URI::create))
              .credentialsProviderType(aws.getEnum(ConnectClientConfig.CredentialsProviderType.class, "credentials-provider"))
              .profileName(optionalString(aws, "profile-name"))
              .maxValuesPerCall(aws.getInt("max-values-per-call"))
              .pageSize(aws.getInt("page-size"))
              .connectionTimeout(aws.getDuration("connection-timeout"))
              .socketTimeout(aws.getDuration("socket-timeout"))
              .build();
    } catch (ConfigException e) {
      throw new ConfigurationException("Invalid " + ROOT + ".aws settings: " + e.getMessage(), e);
    }
  }

  private static Optional<String> optionalString(Config config, String path) {
    return config.hasPath(path) ? Optional.of(config.getString(path)).filter(s -> !s.isBlank()) : Optional.empty();
  }
}
