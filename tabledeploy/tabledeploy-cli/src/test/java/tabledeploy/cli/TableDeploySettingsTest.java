package tabledeploy.cli;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tabledeploy.aws.ConnectClientConfig;
import tabledeploy.model.ConfigurationException;
import tabledeploy.reconcile.ReconcilerConfig;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableDeploySettingsTest {
  @TempDir Path tempDir;

  @Test
  void referenceDefaultsMatchTheBuiltInDefaults() {
    TableDeploySettings settings = TableDeploySettings.load(Optional.empty());

    assertThat(settings.reconcilerConfig()).isEqualTo(ReconcilerConfig.defaults());
    assertThat(settings.configDir()).isEqualTo(Path.of("config"));
    assertThat(settings.verifySampleSize()).isEqualTo(5);

    ConnectClientConfig connect = settings.connectClientConfig("arn:aws:connect:ca-central-1:1:instance/abc");
    assertThat(connect).isEqualTo(ConnectClientConfig.builder().instance("arn:aws:connect:ca-central-1:1:instance/abc").build());
    assertThat(connect.instanceId()).isEqualTo("abc");
  }

  @Test
  void overrideFileTakesPrecedence() throws IOException {
    Path file = tempDir.resolve("settings.conf");
    Files.writeString(file, String.join("\n",
            "tabledeploy.reconciler { batch-size = 10, max-attempts = 5, retry-transport-errors = true }",
            "tabledeploy.aws { region = us-east-1, endpoint = \"http://localhost:4566\", credentials-provider = Profile, profile-name = ops }"));

    TableDeploySettings settings = TableDeploySettings.load(Optional.of(file));

    ReconcilerConfig reconciler = settings.reconcilerConfig();
    assertThat(reconciler.batchSize()).isEqualTo(10);
    assertThat(reconciler.maxAttempts()).isEqualTo(5);
    assertThat(reconciler.retryTransportErrors()).isTrue();
    assertThat(reconciler.retryBackoff()).isEqualTo(Duration.ofMillis(200));

    ConnectClientConfig connect = settings.connectClientConfig("abc");
    assertThat(connect.region()).isEqualTo("us-east-1");
    assertThat(connect.resolvedEndpoint()).isEqualTo(URI.create("http://localhost:4566"));
    assertThat(connect.credentialsProviderType()).isEqualTo(ConnectClientConfig.CredentialsProviderType.Profile);
    assertThat(connect.profileName()).isEqualTo(Optional.of("ops"));
  }

  @Test
  void invalidSettingsAreConfigurationErrors() {
    TableDeploySettings settings = new TableDeploySettings(ConfigFactory.parseString(
            "tabledeploy.reconciler { batch-size = 25, max-attempts = 0, retry-backoff = 1s, max-retry-backoff = 1s, retry-transport-errors = false }"
                    + "\ntabledeploy.aws { region = x, credentials-provider = Bogus }"));

    assertThrows(ConfigurationException.class, settings::reconcilerConfig);
    assertThrows(ConfigurationException.class, () -> settings.connectClientConfig("abc"));
    assertThrows(ConfigurationException.class, () -> TableDeploySettings.load(Optional.of(tempDir.resolve("missing.conf"))));
  }
}
