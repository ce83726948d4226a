package tabledeploy.cli;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Module;
import picocli.CommandLine;
import tabledeploy.aws.ConnectClientConfig;
import tabledeploy.aws.ConnectModule;

import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;

@CommandLine.Command(
        name = "tabledeploy",
        description = "Deploys Amazon Connect data tables, their attributes and values from a config directory",
        mixinStandardHelpOptions = true,
        subcommands = {DeployCommand.class, VerifyCommand.class, CleanupCommand.class}
)
public class TableDeployCommand implements Runnable {
  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(
          names = {"-c", "--config-dir"},
          description = "Directory holding data_tables_config.json, attributes/ and attribute_values/ (default: tabledeploy.config-dir)"
  )
  public Path configDir;

  @CommandLine.Option(
          names = "--settings",
          description = "HOCON file overriding the tabledeploy settings (optional)"
  )
  public Path settingsFile;

  private Function<ConnectClientConfig, Module> remoteModuleFactory = ConnectModule::new;

  public static void main(String... args) {
    System.exit(newCommandLine(new TableDeployCommand()).execute(args));
  }

  public static CommandLine newCommandLine(TableDeployCommand command) {
    return new CommandLine(command)
            .setExecutionExceptionHandler(new ConfigurationErrorHandler());
  }

  @Override
  public void run() {
    spec.commandLine().usage(spec.commandLine().getOut());
  }

  /**
   * Replaces the Amazon Connect bindings, e.g. with an in-memory service.
   */
  @VisibleForTesting
  public TableDeployCommand withRemoteModule(Function<ConnectClientConfig, Module> remoteModuleFactory) {
    this.remoteModuleFactory = remoteModuleFactory;
    return this;
  }

  TableDeploySettings settings() {
    return TableDeploySettings.load(Optional.ofNullable(settingsFile));
  }

  Path configDir(TableDeploySettings settings) {
    return Optional.ofNullable(configDir).orElseGet(settings::configDir);
  }

  Module remoteModule(ConnectClientConfig config) {
    return remoteModuleFactory.apply(config);
  }
}
