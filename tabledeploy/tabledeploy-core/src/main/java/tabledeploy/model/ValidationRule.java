package tabledeploy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Validation constraints attached to an attribute. Length and enum constraints apply to text (and to each element
 * of a text list); bounds and {@code multipleOf} apply to numbers (and to each element of a number list);
 * {@code minValues}/{@code maxValues} bound the size of list values.
 * <p/>
 * The data-table service evaluates these rules itself; {@link #check} mirrors its behavior for the in-memory
 * service used in tests and for dry runs.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableValidationRule.class)
@JsonDeserialize(as = ImmutableValidationRule.class)
public interface ValidationRule {
  static ImmutableValidationRule.Builder builder() {
    return ImmutableValidationRule.builder();
  }

  OptionalInt minLength();

  OptionalInt maxLength();

  OptionalInt minValues();

  OptionalInt maxValues();

  Optional<Boolean> ignoreCase();

  Optional<BigDecimal> minimum();

  Optional<BigDecimal> maximum();

  Optional<BigDecimal> exclusiveMinimum();

  Optional<BigDecimal> exclusiveMaximum();

  Optional<BigDecimal> multipleOf();

  @JsonProperty("enum")
  Optional<EnumRule> enumeration();

  /**
   * @return a description of the first constraint {@code value} violates, or empty if it satisfies them all
   */
  default Optional<String> check(String attributeName, AttributeValue value) {
    if (value instanceof AttributeValue.Text text) {
      return checkText(attributeName, text.value());
    } else if (value instanceof AttributeValue.Number number) {
      return checkNumber(attributeName, number.value());
    } else if (value instanceof AttributeValue.TextList list) {
      return checkSize(attributeName, list.values().size())
              .or(() -> list.values().stream()
                      .map(element -> checkText(attributeName, element))
                      .flatMap(Optional::stream)
                      .findFirst());
    } else if (value instanceof AttributeValue.NumberList list) {
      return checkSize(attributeName, list.values().size())
              .or(() -> list.values().stream()
                      .map(element -> checkNumber(attributeName, element))
                      .flatMap(Optional::stream)
                      .findFirst());
    }
    return Optional.empty();
  }

  private Optional<String> checkText(String attributeName, String text) {
    int length = text.length();
    if (minLength().isPresent() && length < minLength().getAsInt()) {
      return violation(attributeName, text, "is shorter than minLength " + minLength().getAsInt());
    }
    if (maxLength().isPresent() && length > maxLength().getAsInt()) {
      return violation(attributeName, text, "exceeds maxLength " + maxLength().getAsInt());
    }
    return enumeration()
            .filter(EnumRule::strict)
            .filter(rule -> !rule.allows(text, ignoreCase().orElse(false)))
            .flatMap(rule -> violation(attributeName, text, "is not one of the allowed values " + rule.values()));
  }

  private Optional<String> checkNumber(String attributeName, BigDecimal number) {
    if (minimum().isPresent() && number.compareTo(minimum().get()) < 0) {
      return violation(attributeName, number.toPlainString(), "is less than minimum " + minimum().get().toPlainString());
    }
    if (maximum().isPresent() && number.compareTo(maximum().get()) > 0) {
      return violation(attributeName, number.toPlainString(), "is greater than maximum " + maximum().get().toPlainString());
    }
    if (exclusiveMinimum().isPresent() && number.compareTo(exclusiveMinimum().get()) <= 0) {
      return violation(attributeName, number.toPlainString(), "is not greater than exclusiveMinimum " + exclusiveMinimum().get().toPlainString());
    }
    if (exclusiveMaximum().isPresent() && number.compareTo(exclusiveMaximum().get()) >= 0) {
      return violation(attributeName, number.toPlainString(), "is not less than exclusiveMaximum " + exclusiveMaximum().get().toPlainString());
    }
    if (multipleOf().isPresent()
            && multipleOf().get().signum() != 0
            && number.remainder(multipleOf().get()).signum() != 0) {
      return violation(attributeName, number.toPlainString(), "is not a multiple of " + multipleOf().get().toPlainString());
    }
    return Optional.empty();
  }

  private Optional<String> checkSize(String attributeName, int size) {
    if (minValues().isPresent() && size < minValues().getAsInt()) {
      return Optional.of(String.format("Attribute '%s' has %d values, fewer than minValues %d", attributeName, size, minValues().getAsInt()));
    }
    if (maxValues().isPresent() && size > maxValues().getAsInt()) {
      return Optional.of(String.format("Attribute '%s' has %d values, more than maxValues %d", attributeName, size, maxValues().getAsInt()));
    }
    return Optional.empty();
  }

  private static Optional<String> violation(String attributeName, String value, String problem) {
    return Optional.of(String.format("Validation failed for attribute '%s': value '%s' %s", attributeName, value, problem));
  }

  @Value.Immutable
  @JsonSerialize(as = ImmutableEnumRule.class)
  @JsonDeserialize(as = ImmutableEnumRule.class)
  interface EnumRule {
    static ImmutableEnumRule.Builder builder() {
      return ImmutableEnumRule.builder();
    }

    @Value.Default
    default boolean strict() {
      return true;
    }

    List<String> values();

    default boolean allows(String value, boolean ignoreCase) {
      if (!ignoreCase) return values().contains(value);
      String lowered = value.toLowerCase(Locale.ROOT);
      return values().stream().anyMatch(allowed -> allowed.toLowerCase(Locale.ROOT).equals(lowered));
    }
  }
}
