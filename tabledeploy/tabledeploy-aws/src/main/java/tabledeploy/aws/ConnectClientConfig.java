package tabledeploy.aws;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.immutables.value.Value;
import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import tabledeploy.model.ConfigurationException;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/**
 * Where and how to reach the Amazon Connect data-tables API of one instance.
 */
@Value.Immutable
public interface ConnectClientConfig {
  String DEFAULT_REGION = "ca-central-1";
  int MAX_VALUES_PER_CALL = 25;

  static ImmutableConnectClientConfig.Builder builder() {
    return ImmutableConnectClientConfig.builder();
  }

  /**
   * The instance ARN ({@code arn:aws:connect:<region>:<account>:instance/<id>}) or bare instance id.
   */
  String instance();

  @Value.Default
  default String region() {
    return DEFAULT_REGION;
  }

  /** overrides {@code https://connect.<region>.amazonaws.com}, for proxies and local fakes */
  Optional<URI> endpoint();

  @Value.Default
  default CredentialsProviderType credentialsProviderType() {
    return CredentialsProviderType.Default;
  }

  /** the named profile, for {@link CredentialsProviderType#Profile} */
  Optional<String> profileName();

  /** value entries per batch call; the service accepts at most {@value #MAX_VALUES_PER_CALL} */
  @Value.Default
  default int maxValuesPerCall() {
    return MAX_VALUES_PER_CALL;
  }

  /** page size for list calls */
  @Value.Default
  default int pageSize() {
    return 100;
  }

  @Value.Default
  default Duration connectionTimeout() {
    return Duration.ofSeconds(10);
  }

  @Value.Default
  default Duration socketTimeout() {
    return Duration.ofSeconds(30);
  }

  @JsonIgnore
  @Value.Derived
  @Value.Auxiliary
  default String instanceId() {
    int slash = instance().lastIndexOf("instance/");
    return slash < 0 ? instance() : instance().substring(slash + "instance/".length());
  }

  @JsonIgnore
  @Value.Derived
  @Value.Auxiliary
  default Region sdkRegion() {
    return Region.of(region());
  }

  @JsonIgnore
  @Value.Derived
  @Value.Auxiliary
  default URI resolvedEndpoint() {
    return endpoint().orElseGet(() -> URI.create("https://connect." + region() + ".amazonaws.com"));
  }

  @JsonIgnore
  @Value.Lazy
  default AwsCredentialsProvider credentialsProvider() {
    return credentialsProviderType().getProvider(this);
  }

  @Value.Check
  default void checkValues() {
    if (instance().isBlank() || instanceId().isBlank()) {
      throw new ConfigurationException("A Connect instance ARN or id is required");
    }
    if (maxValuesPerCall() < 1 || maxValuesPerCall() > MAX_VALUES_PER_CALL) {
      throw ConfigurationException.format(
              "maxValuesPerCall must be between 1 and %d, was %d", MAX_VALUES_PER_CALL, maxValuesPerCall());
    }
    if (credentialsProviderType() == CredentialsProviderType.Profile && profileName().isEmpty()) {
      throw new ConfigurationException("credentialsProviderType Profile requires a profileName");
    }
  }

  enum CredentialsProviderType {
    Default {
      @Override
      AwsCredentialsProvider getProvider(ConnectClientConfig config) {
        return DefaultCredentialsProvider.create();
      }
    },
    Profile {
      @Override
      AwsCredentialsProvider getProvider(ConnectClientConfig config) {
        return ProfileCredentialsProvider.create(config.profileName().orElseThrow());
      }
    },
    Anonymous {
      @Override
      AwsCredentialsProvider getProvider(ConnectClientConfig config) {
        return AnonymousCredentialsProvider.create();
      }
    };

    abstract AwsCredentialsProvider getProvider(ConnectClientConfig config);
  }
}
