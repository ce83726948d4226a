package tabledeploy.cli;

import com.google.inject.Guice;
import com.google.inject.Injector;
import picocli.CommandLine;
import tabledeploy.config.DeploymentConfigLoader;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * A command run against the instance declared in the config directory.
 */
abstract class TableDeploySubCommand implements Callable<Integer> {
  @CommandLine.ParentCommand TableDeployCommand parent;
  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  private TableDeploySettings settings;

  protected TableDeploySettings settings() {
    if (settings == null) settings = parent.settings();
    return settings;
  }

  protected Path configDir() {
    return parent.configDir(settings());
  }

  protected DeploymentConfigLoader loader() {
    return new DeploymentConfigLoader(DeploymentConfigLoader.buildObjectMapper());
  }

  protected Injector injector(String instanceArn) {
    TableDeploySettings settings = settings();
    return Guice.createInjector(new TableDeployModule(
            settings,
            parent.remoteModule(settings.connectClientConfig(instanceArn))
    ));
  }

  protected PrintWriter out() {
    return spec.commandLine().getOut();
  }
}
