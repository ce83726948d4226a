package tabledeploy.remote;

import tabledeploy.model.TableHandle;

public record TableProvisioning(TableHandle table, boolean created) {
  public static TableProvisioning created(TableHandle table) {
    return new TableProvisioning(table, true);
  }

  public static TableProvisioning existing(TableHandle table) {
    return new TableProvisioning(table, false);
  }
}
