package tabledeploy.deploy;

import tabledeploy.reconcile.ReconciliationSummary;
import tabledeploy.reconcile.RowOutcome;
import tabledeploy.remote.AttributeProvisioning;

import java.io.PrintWriter;
import java.util.List;

/**
 * Renders a {@link DeploymentReport} for the console, one {@code [OK]}, {@code [SKIP]} or {@code [FAIL]} line per
 * table followed by its details.
 */
public class DeploymentReportPrinter {
  static final String RULE = "=".repeat(50);

  private final PrintWriter out;

  public DeploymentReportPrinter(PrintWriter out) {
    this.out = out;
  }

  public void print(DeploymentReport report) {
    out.println("Deployment Results:");
    out.println(RULE);
    for (TableDeploymentResult table : report.tables()) {
      printTable(table);
    }
    out.flush();
  }

  private void printTable(TableDeploymentResult table) {
    switch (table.status()) {
      case CREATED -> out.printf("[OK] %s: created (%s)%n", table.tableName(), table.tableId().orElse("?"));
      case EXISTING -> out.printf("[SKIP] %s: data table already exists (%s)%n", table.tableName(), table.tableId().orElse("?"));
      case FAILED -> out.printf("[FAIL] %s: failed%n", table.tableName());
    }
    table.error().ifPresent(error -> out.printf("  - Error: %s%n", error));
    table.attributes().ifPresent(this::printAttributes);
    table.values().ifPresent(this::printValues);
  }

  private void printAttributes(List<AttributeProvisioning> attributes) {
    long created = attributes.stream().filter(a -> a.status() == AttributeProvisioning.Status.CREATED).count();
    long skipped = attributes.stream().filter(a -> a.status() == AttributeProvisioning.Status.SKIPPED).count();
    long failed = attributes.size() - created - skipped;
    out.printf("  - attributes: %d created, %d skipped, %d failed%n", created, skipped, failed);
    for (AttributeProvisioning attribute : attributes) {
      attribute.error().ifPresent(error -> out.printf("    [FAIL] %s: %s%n", attribute.attributeName(), error));
    }
  }

  private void printValues(ReconciliationSummary summary) {
    out.printf("  - values: %s%n", summary.describe());
    for (RowOutcome failure : summary.failures()) {
      out.printf("    [FAIL] [%s] in %s: %s%n", failure.primaryKey(), failure.phase(), failure.cause().orElse(""));
    }
  }
}
