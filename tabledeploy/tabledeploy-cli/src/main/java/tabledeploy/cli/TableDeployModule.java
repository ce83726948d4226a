package tabledeploy.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Module;
import com.google.inject.Provides;
import tabledeploy.config.DeploymentConfigLoader;
import tabledeploy.reconcile.ReconcilerConfig;
import tabledeploy.reconcile.Sleeper;

import javax.inject.Singleton;

/**
 * Wires the deployment pipeline. The remote data-table service comes from {@code remoteModule}: the Amazon Connect
 * bindings in production.
 */
public class TableDeployModule extends AbstractModule {
  private final TableDeploySettings settings;
  private final Module remoteModule;

  public TableDeployModule(TableDeploySettings settings, Module remoteModule) {
    this.settings = settings;
    this.remoteModule = remoteModule;
  }

  @Override
  protected void configure() {
    install(remoteModule);
    bind(TableDeploySettings.class).toInstance(settings);
    bind(ReconcilerConfig.class).toInstance(settings.reconcilerConfig());
    bind(Sleeper.class).toInstance(Sleeper.SYSTEM);
  }

  @Provides
  @Singleton
  ObjectMapper objectMapper() {
    return DeploymentConfigLoader.buildObjectMapper();
  }
}
