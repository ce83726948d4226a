package tabledeploy.aws;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import tabledeploy.remote.DataTableAdmin;
import tabledeploy.remote.LockTokenFetchApi;
import tabledeploy.remote.RemoteMutationApi;
import tabledeploy.remote.TableProvisioner;

import javax.inject.Singleton;

/**
 * Binds the remote data-table contracts to the Amazon Connect implementations for one instance. The enclosing
 * injector supplies the {@link com.fasterxml.jackson.databind.ObjectMapper} used for request and response bodies.
 */
public class ConnectModule extends AbstractModule {
  private final ConnectClientConfig config;

  public ConnectModule(ConnectClientConfig config) {
    this.config = config;
  }

  @Override
  protected void configure() {
    bind(ConnectClientConfig.class).toInstance(config);
    bind(RemoteMutationApi.class).to(ConnectRemoteMutationApi.class).in(Singleton.class);
    bind(LockTokenFetchApi.class).to(ConnectLockTokenFetchApi.class).in(Singleton.class);
    bind(TableProvisioner.class).to(ConnectTableProvisioner.class).in(Singleton.class);
    bind(DataTableAdmin.class).to(ConnectDataTableAdmin.class).in(Singleton.class);
  }

  @Provides
  @Singleton
  AwsCredentialsProvider credentialsProvider() {
    return config.credentialsProvider();
  }

  @Provides
  @Singleton
  SdkHttpClient httpClient() {
    return ApacheHttpClient.builder()
            .connectionTimeout(config.connectionTimeout())
            .socketTimeout(config.socketTimeout())
            .build();
  }
}
