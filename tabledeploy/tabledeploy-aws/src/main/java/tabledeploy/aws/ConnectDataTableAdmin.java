package tabledeploy.aws;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tabledeploy.model.AttributeSpec;
import tabledeploy.model.ValueKind;
import tabledeploy.remote.DataTableAdmin;

import javax.inject.Inject;
import java.util.List;
import java.util.Optional;

public class ConnectDataTableAdmin implements DataTableAdmin {
  private static final Logger LOG = LoggerFactory.getLogger(ConnectDataTableAdmin.class);

  private final ConnectDataTablesClient client;

  @Inject
  public ConnectDataTableAdmin(ConnectDataTablesClient client) {
    this.client = client;
  }

  @Override
  public List<TableSummary> listTables() {
    return client.listDataTables().stream()
            .map(summary -> new TableSummary(summary.path("Id").asText(), summary.path("Name").asText()))
            .collect(ImmutableList.toImmutableList());
  }

  @Override
  public List<AttributeSpec> describeAttributes(TableSummary table) {
    ImmutableList.Builder<AttributeSpec> attributes = ImmutableList.builder();
    for (JsonNode attribute : client.listAttributes(table.id())) {
      String valueType = attribute.path("ValueType").asText();
      ValueKind kind;
      try {
        kind = ValueKind.valueOf(valueType);
      } catch (IllegalArgumentException e) {
        LOG.warn("Attribute '{}' of table '{}' has unrecognized value type '{}'",
                attribute.path("Name").asText(), table.name(), valueType);
        continue;
      }
      attributes.add(AttributeSpec.builder()
              .name(attribute.path("Name").asText())
              .valueType(kind)
              .primary(attribute.path("Primary").asBoolean(false))
              .description(attribute.path("Description").asText(""))
              .build());
    }
    return attributes.build();
  }

  @Override
  public List<StoredValue> sampleValues(TableSummary table, int limit) {
    return client.listValues(table.id(), client.json().createObjectNode(), limit).stream()
            .map(value -> new StoredValue(
                    ConnectValueEncoding.primaryValuesOf(value),
                    value.path("AttributeName").asText(),
                    value.path("Value").asText()))
            .collect(ImmutableList.toImmutableList());
  }

  @Override
  public Optional<String> deleteTable(String tableName) {
    Optional<TableSummary> table = listTables().stream()
            .filter(summary -> summary.name().equals(tableName))
            .findFirst();
    table.ifPresent(summary -> {
      client.deleteDataTable(summary.id());
      LOG.info("Deleted data table '{}' ({})", summary.name(), summary.id());
    });
    return table.map(TableSummary::id);
  }
}
