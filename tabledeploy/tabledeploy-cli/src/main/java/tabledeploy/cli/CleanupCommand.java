package tabledeploy.cli;

import picocli.CommandLine;
import tabledeploy.config.DeploymentConfig;
import tabledeploy.deploy.TableCleanup;
import tabledeploy.model.TableSpec;

import java.util.List;
import java.util.stream.Collectors;

@CommandLine.Command(name = "cleanup", description = "Deletes every data table declared in the config directory")
public class CleanupCommand extends TableDeploySubCommand {
  @Override
  public Integer call() {
    DeploymentConfig config = loader().loadDeploymentConfig(configDir());
    List<String> tableNames = config.dataTables().stream().map(TableSpec::name).collect(Collectors.toList());
    List<TableCleanup.Result> results = injector(config.instanceArn())
            .getInstance(TableCleanup.class)
            .deleteAll(tableNames);

    out().println("Cleanup Results:");
    results.forEach(result -> out().println(result.render()));
    out().flush();
    return results.stream().anyMatch(result -> result.status() == TableCleanup.Status.FAILED) ? 1 : 0;
  }
}
