package tabledeploy.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import tabledeploy.config.Deployment;
import tabledeploy.deploy.DeploymentPipeline;
import tabledeploy.deploy.DeploymentReport;
import tabledeploy.deploy.DeploymentReportPrinter;

@CommandLine.Command(name = "deploy", description = "Creates missing tables and attributes, then upserts every declared value")
public class DeployCommand extends TableDeploySubCommand {
  private static final Logger LOG = LoggerFactory.getLogger(DeployCommand.class);

  @Override
  public Integer call() {
    Deployment deployment = loader().load(configDir());
    DeploymentReport report = injector(deployment.instanceArn())
            .getInstance(DeploymentPipeline.class)
            .deploy(deployment);
    new DeploymentReportPrinter(out()).print(report);
    if (!report.isSuccessful()) {
      LOG.warn("Deployment finished with failures");
      return 1;
    }
    return 0;
  }
}
