package tabledeploy.config;

import tabledeploy.model.AttributeSpec;
import tabledeploy.model.DesiredRow;
import tabledeploy.model.TableSchema;
import tabledeploy.model.TableSpec;

import java.util.List;
import java.util.Optional;

/**
 * Everything declared for one table. The attribute and value declarations are each optional: a table without an
 * attributes file is created but gets no attributes, and one without a values file gets no rows.
 */
public record TableDeclaration(TableSpec table, Optional<List<AttributeSpec>> attributes, Optional<List<DesiredRow>> rows) {
  public String name() {
    return table.name();
  }

  /**
   * @return the schema the rows are checked against; empty when no attributes are declared
   */
  public Optional<TableSchema> schema() {
    return attributes.map(declared -> TableSchema.of(table.name(), declared));
  }
}
