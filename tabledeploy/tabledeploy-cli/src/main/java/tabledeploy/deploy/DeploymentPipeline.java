package tabledeploy.deploy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tabledeploy.config.Deployment;
import tabledeploy.config.TableDeclaration;
import tabledeploy.model.ConfigurationException;
import tabledeploy.model.TableHandle;
import tabledeploy.reconcile.ReconciliationSummary;
import tabledeploy.reconcile.ValueReconciler;
import tabledeploy.remote.AttributeProvisioning;
import tabledeploy.remote.RemoteServiceException;
import tabledeploy.remote.TableProvisioner;
import tabledeploy.remote.TableProvisioning;

import javax.inject.Inject;
import java.util.List;

/**
 * Deploys each declared table in turn: ensure the table, ensure its attributes, then reconcile its values.
 * <p/>
 * A table that fails is reported and the pipeline continues with the next one. If the thread is interrupted, the
 * tables not yet started are reported as failed.
 */
public class DeploymentPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(DeploymentPipeline.class);
  static final String CANCELLED = "deployment cancelled before this table was started";

  private final TableProvisioner provisioner;
  private final ValueReconciler reconciler;

  @Inject
  public DeploymentPipeline(TableProvisioner provisioner, ValueReconciler reconciler) {
    this.provisioner = provisioner;
    this.reconciler = reconciler;
  }

  public DeploymentReport deploy(Deployment deployment) {
    LOG.info("Deploying {} data tables to {}", deployment.tables().size(), deployment.instanceArn());
    ImmutableDeploymentReport.Builder report = DeploymentReport.builder().instanceArn(deployment.instanceArn());
    for (TableDeclaration table : deployment.tables()) {
      if (Thread.currentThread().isInterrupted()) {
        report.addTables(TableDeploymentResult.failed(table.name(), CANCELLED));
        continue;
      }
      try {
        report.addTables(deployTable(table));
      } catch (TableDeploymentException e) {
        LOG.error("Deployment of table '{}' failed", e.tableName(), e);
        report.addTables(TableDeploymentResult.failed(e.tableName(), e.getMessage()));
      }
    }
    return report.build();
  }

  TableDeploymentResult deployTable(TableDeclaration table) {
    TableProvisioning provisioning;
    try {
      provisioning = provisioner.ensureTable(table.table());
    } catch (RemoteServiceException e) {
      throw new TableDeploymentException(table.name(), e.getMessage(), e);
    }
    TableHandle handle = provisioning.table();
    ImmutableTableDeploymentResult.Builder result = TableDeploymentResult.builder()
            .tableName(table.name())
            .tableId(handle.id())
            .status(provisioning.created() ? TableDeploymentResult.Status.CREATED : TableDeploymentResult.Status.EXISTING);

    if (table.attributes().isPresent()) {
      try {
        List<AttributeProvisioning> attributes = provisioner.ensureAttributes(handle, table.attributes().get());
        result.attributes(attributes);
      } catch (RemoteServiceException e) {
        throw new TableDeploymentException(table.name(), "attributes: " + e.getMessage(), e);
      }
    } else {
      LOG.info("No attributes declared for table '{}'", table.name());
    }

    if (table.rows().isPresent()) {
      try {
        ReconciliationSummary summary = reconciler.reconcile(handle, table.schema().orElseThrow(), table.rows().get());
        LOG.info("Values of table '{}': {}", table.name(), summary.describe());
        result.values(summary);
      } catch (ConfigurationException e) {
        throw new TableDeploymentException(table.name(), "values: " + e.getMessage(), e);
      }
    }
    return result.build();
  }
}
