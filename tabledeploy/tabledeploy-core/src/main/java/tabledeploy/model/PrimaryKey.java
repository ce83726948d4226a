package tabledeploy.model;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The ordered primary-key values identifying one row. Order follows the table's primary attributes, and takes
 * part in equality: two keys with the same pairs in a different order are different keys.
 */
public record PrimaryKey(List<NamedValue> values) {
  public PrimaryKey {
    values = ImmutableList.copyOf(values);
    checkArgument(!values.isEmpty(), "A primary key needs at least one value");
  }

  public static PrimaryKey of(NamedValue... values) {
    return new PrimaryKey(List.of(values));
  }

  public static PrimaryKey of(String attributeName, AttributeValue value) {
    return of(NamedValue.of(attributeName, value));
  }

  public Optional<AttributeValue> valueOf(String attributeName) {
    return values.stream()
            .filter(v -> v.attributeName().equals(attributeName))
            .map(NamedValue::value)
            .findFirst();
  }

  @Override
  public String toString() {
    return Joiner.on(", ").join(values);
  }
}
