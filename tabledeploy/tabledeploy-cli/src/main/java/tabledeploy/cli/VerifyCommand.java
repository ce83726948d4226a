package tabledeploy.cli;

import picocli.CommandLine;
import tabledeploy.config.DeploymentConfig;
import tabledeploy.deploy.DataTableInspector;

import java.util.Optional;

@CommandLine.Command(name = "verify", description = "Lists the data tables of the instance with their attributes and sample values")
public class VerifyCommand extends TableDeploySubCommand {
  @CommandLine.Option(names = "--sample-size", description = "Values to show per table (default: tabledeploy.verify.sample-size)")
  Integer sampleSize;

  @Override
  public Integer call() {
    DeploymentConfig config = loader().loadDeploymentConfig(configDir());
    injector(config.instanceArn())
            .getInstance(DataTableInspector.class)
            .inspect(out(), Optional.ofNullable(sampleSize).orElseGet(settings()::verifySampleSize));
    return 0;
  }
}
