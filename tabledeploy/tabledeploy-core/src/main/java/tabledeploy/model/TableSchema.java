package tabledeploy.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.immutables.value.Value;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The declared attributes of one table. The attributes flagged {@link AttributeSpec#primary primary}, in
 * declaration order, form the table's primary key.
 */
@Value.Immutable
public interface TableSchema {
  static ImmutableTableSchema.Builder builder() {
    return ImmutableTableSchema.builder();
  }

  static TableSchema of(String tableName, List<AttributeSpec> attributes) {
    return builder().tableName(tableName).addAllAttributes(attributes).build();
  }

  String tableName();

  List<AttributeSpec> attributes();

  @Value.Lazy
  default Map<String, AttributeSpec> attributesByName() {
    return attributes().stream().collect(ImmutableMap.toImmutableMap(AttributeSpec::name, Function.identity()));
  }

  @Value.Lazy
  default List<AttributeSpec> primaryKeyAttributes() {
    return attributes().stream().filter(AttributeSpec::primary).collect(ImmutableList.toImmutableList());
  }

  default Optional<AttributeSpec> attribute(String name) {
    return Optional.ofNullable(attributesByName().get(name));
  }

  @Value.Check
  default void checkAttributes() {
    Set<String> seen = new HashSet<>();
    for (AttributeSpec attribute : attributes()) {
      if (!seen.add(attribute.name())) {
        throw ConfigurationException.format("Table '%s' declares attribute '%s' more than once", tableName(), attribute.name());
      }
    }
    if (attributes().stream().noneMatch(AttributeSpec::primary)) {
      throw ConfigurationException.format("Table '%s' declares no primary attribute", tableName());
    }
  }

  /**
   * Checks that {@code row} names every primary attribute exactly once and only non-primary attributes otherwise,
   * with values of the declared kinds.
   *
   * @return the row with its primary values in primary-key order
   * @throws ConfigurationException if the row does not fit this schema
   */
  default DesiredRow normalize(DesiredRow row) {
    Map<String, NamedValue> primaryValues = new LinkedHashMap<>();
    for (NamedValue primaryValue : row.primaryValues()) {
      AttributeSpec spec = attribute(primaryValue.attributeName())
              .orElseThrow(() -> ConfigurationException.format(
                      "Table '%s' has no attribute '%s' (primary values %s)",
                      tableName(), primaryValue.attributeName(), row.primaryValues()));
      if (!spec.primary()) {
        throw ConfigurationException.format(
                "Attribute '%s' of table '%s' is not primary but was given as a primary value",
                spec.name(), tableName());
      }
      checkKind(spec, primaryValue);
      if (primaryValues.put(spec.name(), primaryValue) != null) {
        throw ConfigurationException.format(
                "Primary attribute '%s' of table '%s' appears more than once in %s",
                spec.name(), tableName(), row.primaryValues());
      }
    }

    List<String> missing = primaryKeyAttributes().stream()
            .map(AttributeSpec::name)
            .filter(name -> !primaryValues.containsKey(name))
            .collect(Collectors.toList());
    if (!missing.isEmpty()) {
      throw ConfigurationException.format(
              "Row %s of table '%s' is missing primary values for %s", row.primaryValues(), tableName(), missing);
    }

    Set<String> seenAttributes = new HashSet<>();
    for (NamedValue value : row.attributes()) {
      AttributeSpec spec = attribute(value.attributeName())
              .orElseThrow(() -> ConfigurationException.format(
                      "Table '%s' has no attribute '%s' (row %s)", tableName(), value.attributeName(), row.primaryValues()));
      if (spec.primary()) {
        throw ConfigurationException.format(
                "Primary attribute '%s' of table '%s' must be given as a primary value, not an attribute (row %s)",
                spec.name(), tableName(), row.primaryValues());
      }
      if (!seenAttributes.add(spec.name())) {
        throw ConfigurationException.format(
                "Attribute '%s' appears more than once in row %s of table '%s'", spec.name(), row.primaryValues(), tableName());
      }
      checkKind(spec, value);
    }

    return DesiredRow.builder()
            .primaryValues(primaryKeyAttributes().stream()
                    .map(attr -> primaryValues.get(attr.name()))
                    .collect(Collectors.toList()))
            .attributes(row.attributes())
            .build();
  }

  private void checkKind(AttributeSpec spec, NamedValue value) {
    if (value.value().kind() != spec.valueType()) {
      throw ConfigurationException.format(
              "Attribute '%s' of table '%s' is declared %s but was given a %s value (%s)",
              spec.name(), tableName(), spec.valueType(), value.value().kind(), value.value());
    }
  }
}
