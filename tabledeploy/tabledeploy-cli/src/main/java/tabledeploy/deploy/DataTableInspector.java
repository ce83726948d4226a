package tabledeploy.deploy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tabledeploy.model.AttributeSpec;
import tabledeploy.remote.DataTableAdmin;
import tabledeploy.remote.DataTableAdmin.StoredValue;
import tabledeploy.remote.DataTableAdmin.TableSummary;
import tabledeploy.remote.RemoteServiceException;

import javax.inject.Inject;
import java.io.PrintWriter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints what an instance actually holds: every data table, its attributes (primary ones marked) and a sample of
 * its stored values. A table that can't be read is reported inline and the listing goes on.
 */
public class DataTableInspector {
  private static final Logger LOG = LoggerFactory.getLogger(DataTableInspector.class);

  private final DataTableAdmin admin;

  @Inject
  public DataTableInspector(DataTableAdmin admin) {
    this.admin = admin;
  }

  /**
   * @return the number of tables listed
   */
  public int inspect(PrintWriter out, int sampleSize) {
    List<TableSummary> tables = admin.listTables();
    out.println("Data Tables Found:");
    out.println(DeploymentReportPrinter.RULE);
    for (TableSummary table : tables) {
      out.printf("%nTable: %s%n", table.name());
      out.printf("   ID: %s%n", table.id());
      printAttributes(out, table);
      printValues(out, table, sampleSize);
    }
    out.flush();
    return tables.size();
  }

  private void printAttributes(PrintWriter out, TableSummary table) {
    try {
      List<AttributeSpec> attributes = admin.describeAttributes(table);
      out.printf("   Attributes (%d):%n", attributes.size());
      for (AttributeSpec attribute : attributes) {
        out.printf("      - %s (%s)%s%n", attribute.name(), attribute.valueType(), attribute.primary() ? " [PRIMARY]" : "");
      }
      out.printf("   Primary Keys: %s%n", attributes.stream()
              .filter(AttributeSpec::primary)
              .map(AttributeSpec::name)
              .collect(Collectors.toList()));
    } catch (RemoteServiceException e) {
      LOG.warn("Unable to list attributes of table '{}'", table.name(), e);
      out.printf("   Attributes: error - %s%n", e.getMessage());
    }
  }

  private void printValues(PrintWriter out, TableSummary table, int sampleSize) {
    try {
      List<StoredValue> values = admin.sampleValues(table, sampleSize);
      out.printf("   Values: %d shown (at most %d)%n", values.size(), sampleSize);
      for (StoredValue value : values) {
        out.printf("      %s %s = %s%n", value.primaryValues(), value.attributeName(), value.value());
      }
    } catch (RemoteServiceException e) {
      LOG.warn("Unable to list values of table '{}'", table.name(), e);
      out.printf("   Values: error - %s%n", e.getMessage());
    }
  }
}
