package tabledeploy.model;

import com.google.common.collect.ImmutableList;
import org.immutables.value.Value;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One unit of desired state: the primary-key values that identify a row, and the non-key attribute values it
 * should hold.
 */
@Value.Immutable
public interface DesiredRow {
  static ImmutableDesiredRow.Builder builder() {
    return ImmutableDesiredRow.builder();
  }

  static DesiredRow of(PrimaryKey primaryKey, List<NamedValue> attributes) {
    return builder().primaryValues(primaryKey.values()).addAllAttributes(attributes).build();
  }

  List<NamedValue> primaryValues();

  List<NamedValue> attributes();

  @Value.Lazy
  default PrimaryKey primaryKey() {
    return new PrimaryKey(primaryValues());
  }

  /**
   * @return this row carrying only the named non-key attributes
   */
  default DesiredRow restrictedTo(Set<String> attributeNames) {
    return builder()
            .primaryValues(primaryValues())
            .addAllAttributes(attributes().stream()
                    .filter(value -> attributeNames.contains(value.attributeName()))
                    .collect(ImmutableList.toImmutableList()))
            .build();
  }

  default Optional<AttributeValue> attribute(String attributeName) {
    return attributes().stream()
            .filter(v -> v.attributeName().equals(attributeName))
            .map(NamedValue::value)
            .findFirst();
  }
}
