package tabledeploy.aws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tabledeploy.model.AttributeSpec;
import tabledeploy.model.TableHandle;
import tabledeploy.model.TableSpec;
import tabledeploy.model.ValidationRule;
import tabledeploy.remote.AttributeProvisioning;
import tabledeploy.remote.RemoteServiceException;
import tabledeploy.remote.TableProvisioner;
import tabledeploy.remote.TableProvisioning;

import javax.inject.Inject;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Creates data tables (published immediately) and their attributes. A table is matched by name; an attribute
 * that already exists is skipped without comparing its definition.
 */
public class ConnectTableProvisioner implements TableProvisioner {
  private static final Logger LOG = LoggerFactory.getLogger(ConnectTableProvisioner.class);

  private final ConnectDataTablesClient client;

  @Inject
  public ConnectTableProvisioner(ConnectDataTablesClient client) {
    this.client = client;
  }

  @Override
  public TableProvisioning ensureTable(TableSpec spec) {
    Optional<JsonNode> existing = client.listDataTables().stream()
            .filter(summary -> spec.name().equals(summary.path("Name").asText()))
            .findFirst();
    if (existing.isPresent()) {
      String id = existing.get().path("Id").asText();
      LOG.info("Data table '{}' already exists ({})", spec.name(), id);
      return TableProvisioning.existing(TableHandle.of(id, spec.name(), spec.lockLevel()));
    }

    ObjectNode request = client.json().createObjectNode()
            .put("Name", spec.name())
            .put("Description", spec.description())
            .put("TimeZone", spec.timeZone())
            .put("ValueLockLevel", spec.lockLevel().name())
            .put("Status", "PUBLISHED");
    ObjectNode tags = request.putObject("Tags");
    spec.tags().forEach(tags::put);

    JsonNode response = client.createDataTable(request);
    String id = response.path("Id").asText();
    if (id.isEmpty()) throw new RemoteServiceException("CreateDataTable returned no Id for '" + spec.name() + "': " + response);
    LOG.info("Created data table '{}' ({})", spec.name(), id);
    return TableProvisioning.created(TableHandle.of(id, spec.name(), spec.lockLevel()));
  }

  @Override
  public List<AttributeProvisioning> ensureAttributes(TableHandle table, List<AttributeSpec> attributes) {
    Set<String> existing = client.listAttributes(table.id()).stream()
            .map(attribute -> attribute.path("Name").asText())
            .collect(Collectors.toSet());

    ImmutableList.Builder<AttributeProvisioning> results = ImmutableList.builder();
    for (AttributeSpec attribute : attributes) {
      if (existing.contains(attribute.name())) {
        LOG.debug("Attribute '{}' of table '{}' already exists", attribute.name(), table.name());
        results.add(AttributeProvisioning.skipped(attribute.name()));
        continue;
      }
      try {
        client.createAttribute(table.id(), attributeRequest(attribute));
        LOG.info("Created attribute '{}' of table '{}'", attribute.name(), table.name());
        results.add(AttributeProvisioning.created(attribute.name()));
      } catch (RemoteServiceException e) {
        LOG.warn("Failed to create attribute '{}' of table '{}': {}", attribute.name(), table.name(), e.getMessage());
        results.add(AttributeProvisioning.failed(attribute.name(), e.getMessage()));
      }
    }
    return results.build();
  }

  ObjectNode attributeRequest(AttributeSpec attribute) {
    ObjectNode request = client.json().createObjectNode()
            .put("Name", attribute.name())
            .put("ValueType", attribute.valueType().name())
            .put("Description", attribute.description())
            .put("Primary", attribute.primary());
    attribute.validation().ifPresent(rule -> request.set("Validation", validation(rule)));
    return request;
  }

  private ObjectNode validation(ValidationRule rule) {
    ObjectNode validation = client.json().createObjectNode();
    putInt(validation, "MinLength", rule.minLength());
    putInt(validation, "MaxLength", rule.maxLength());
    putInt(validation, "MinValues", rule.minValues());
    putInt(validation, "MaxValues", rule.maxValues());
    rule.ignoreCase().ifPresent(ignoreCase -> validation.put("IgnoreCase", ignoreCase));
    putNumber(validation, "Minimum", rule.minimum());
    putNumber(validation, "Maximum", rule.maximum());
    putNumber(validation, "ExclusiveMinimum", rule.exclusiveMinimum());
    putNumber(validation, "ExclusiveMaximum", rule.exclusiveMaximum());
    putNumber(validation, "MultipleOf", rule.multipleOf());
    rule.enumeration().ifPresent(enumeration -> {
      ObjectNode node = validation.putObject("Enum").put("Strict", enumeration.strict());
      enumeration.values().forEach(node.putArray("Values")::add);
    });
    return validation;
  }

  private static void putInt(ObjectNode node, String field, OptionalInt value) {
    value.ifPresent(v -> node.put(field, v));
  }

  private static void putNumber(ObjectNode node, String field, Optional<BigDecimal> value) {
    value.ifPresent(v -> node.put(field, v));
  }
}
