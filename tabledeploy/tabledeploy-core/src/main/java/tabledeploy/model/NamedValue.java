package tabledeploy.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

public record NamedValue(String attributeName, AttributeValue value) {
  public NamedValue {
    checkArgument(attributeName != null && !attributeName.isBlank(), "attributeName is required");
    checkNotNull(value, "value for %s", attributeName);
  }

  public static NamedValue of(String attributeName, AttributeValue value) {
    return new NamedValue(attributeName, value);
  }

  @Override
  public String toString() {
    return attributeName + "=" + value;
  }
}
