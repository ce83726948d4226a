package tabledeploy.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import java.util.Optional;

@Value.Immutable
@JsonSerialize(as = ImmutableAttributeSpec.class)
@JsonDeserialize(as = ImmutableAttributeSpec.class)
public interface AttributeSpec {
  static ImmutableAttributeSpec.Builder builder() {
    return ImmutableAttributeSpec.builder();
  }

  static AttributeSpec primary(String name, ValueKind valueType) {
    return builder().name(name).valueType(valueType).primary(true).build();
  }

  static AttributeSpec of(String name, ValueKind valueType) {
    return builder().name(name).valueType(valueType).build();
  }

  String name();

  ValueKind valueType();

  @Value.Default
  default boolean primary() {
    return false;
  }

  @Value.Default
  default String description() {
    return "";
  }

  Optional<ValidationRule> validation();
}
