package tabledeploy.aws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tabledeploy.model.LockScope;
import tabledeploy.model.LockVersion;
import tabledeploy.model.PrimaryKey;
import tabledeploy.model.TableHandle;
import tabledeploy.remote.LockTokenFetchApi;

import javax.inject.Inject;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads current lock versions: the table's own for {@code DATA_TABLE}, the attribute's for {@code ATTRIBUTE}, and
 * those of stored values for {@code PRIMARY_VALUE} and {@code VALUE}.
 * <p/>
 * The table version is taken from DescribeDataTable. When that carries none, the {@code DataTable} version that
 * ListDataTableAttributes reports with each attribute is used instead; every attribute carries the same one.
 */
public class ConnectLockTokenFetchApi implements LockTokenFetchApi {
  private static final Logger LOG = LoggerFactory.getLogger(ConnectLockTokenFetchApi.class);
  private static final String TABLE_VERSION_FIELD = "DataTable";

  private final ConnectDataTablesClient client;
  private final ConnectValueEncoding encoding;

  @Inject
  public ConnectLockTokenFetchApi(ConnectDataTablesClient client) {
    this.client = client;
    this.encoding = new ConnectValueEncoding(client.json());
  }

  @Override
  public LockVersion fetchToken(TableHandle table, LockScope scope) {
    LockVersion version = switch (scope.level()) {
      case NONE -> LockVersion.none();
      case DATA_TABLE -> tableVersion(table);
      case ATTRIBUTE -> attributeVersion(table, scope.attributeName().orElseThrow());
      case PRIMARY_VALUE -> valueVersion(table, scope.primaryKey().orElseThrow(), Optional.empty());
      case VALUE -> valueVersion(table, scope.primaryKey().orElseThrow(), scope.attributeName());
    };
    LOG.debug("Table '{}' reports {} for {}", table.name(), version, scope);
    return version;
  }

  private LockVersion tableVersion(TableHandle table) {
    LockVersion described = encoding.lockVersionOf(client.describeDataTable(table.id()).path("DataTable"));
    if (described.isPresent()) return described;

    for (JsonNode attribute : client.listAttributes(table.id())) {
      JsonNode tableVersion = attribute.path("LockVersion").path(TABLE_VERSION_FIELD);
      if (tableVersion.isTextual()) {
        ObjectNode lockVersion = client.json().createObjectNode();
        lockVersion.putObject("LockVersion").put(TABLE_VERSION_FIELD, tableVersion.asText());
        return encoding.lockVersionOf(lockVersion);
      }
    }
    return LockVersion.none();
  }

  private LockVersion attributeVersion(TableHandle table, String attributeName) {
    return client.listAttributes(table.id()).stream()
            .filter(attribute -> attributeName.equals(attribute.path("Name").asText()))
            .findFirst()
            .map(encoding::lockVersionOf)
            .orElse(LockVersion.none());
  }

  /**
   * @param attributeName the value's attribute, or empty for any value of the row
   */
  private LockVersion valueVersion(TableHandle table, PrimaryKey key, Optional<String> attributeName) {
    ObjectNode filter = client.json().createObjectNode();
    filter.set("PrimaryAttributeValues", encoding.primaryValues(key));
    attributeName.ifPresent(name -> filter.putArray("AttributeNames").add(name));

    Map<String, String> primaryValues = encoding.primaryValuesOf(key);
    List<JsonNode> values = client.listValues(table.id(), filter, client.config().pageSize());
    return values.stream()
            .filter(value -> ConnectValueEncoding.primaryValuesOf(value).equals(primaryValues))
            .filter(value -> attributeName.map(name -> name.equals(value.path("AttributeName").asText())).orElse(true))
            .findFirst()
            .map(encoding::lockVersionOf)
            .orElse(LockVersion.none());
  }
}
