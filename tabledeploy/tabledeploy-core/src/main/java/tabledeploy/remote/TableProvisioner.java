package tabledeploy.remote;

import tabledeploy.model.AttributeSpec;
import tabledeploy.model.TableHandle;
import tabledeploy.model.TableSpec;

import java.util.List;

/**
 * Creates tables and attributes that don't exist yet. Existing tables and attributes are left untouched, even if
 * their declaration has since changed.
 */
public interface TableProvisioner {
  /**
   * @return the handle of the table named by {@code spec}, creating it first if necessary
   */
  TableProvisioning ensureTable(TableSpec spec);

  List<AttributeProvisioning> ensureAttributes(TableHandle table, List<AttributeSpec> attributes);
}
