package tabledeploy.model;

import com.google.common.collect.ImmutableList;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A typed value literal for a single attribute. List kinds hold their elements as ordered scalars; any textual
 * encoding (delimited strings, JSON arrays) belongs to whoever reads or writes them.
 */
public sealed interface AttributeValue {
  ValueKind kind();

  static AttributeValue text(String value) {
    return new Text(value);
  }

  static AttributeValue number(BigDecimal value) {
    return new Number(value);
  }

  static AttributeValue number(String value) {
    return new Number(new BigDecimal(value));
  }

  static AttributeValue bool(boolean value) {
    return new Bool(value);
  }

  static AttributeValue textList(List<String> values) {
    return new TextList(ImmutableList.copyOf(values));
  }

  static AttributeValue numberList(List<BigDecimal> values) {
    return new NumberList(ImmutableList.copyOf(values));
  }

  record Text(String value) implements AttributeValue {
    public Text {
      checkNotNull(value, "value");
    }

    @Override
    public ValueKind kind() {
      return ValueKind.TEXT;
    }

    @Override
    public String toString() {
      return value;
    }
  }

  record Number(BigDecimal value) implements AttributeValue {
    public Number {
      checkNotNull(value, "value");
    }

    @Override
    public ValueKind kind() {
      return ValueKind.NUMBER;
    }

    /**
     * BigDecimal equality is scale-sensitive; "1.0" and "1" are the same number here.
     */
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Number other && value.compareTo(other.value) == 0;
    }

    @Override
    public int hashCode() {
      return value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
      return value.toPlainString();
    }
  }

  record Bool(boolean value) implements AttributeValue {
    @Override
    public ValueKind kind() {
      return ValueKind.BOOLEAN;
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  record TextList(List<String> values) implements AttributeValue {
    public TextList {
      values = ImmutableList.copyOf(values);
    }

    @Override
    public ValueKind kind() {
      return ValueKind.TEXT_LIST;
    }

    @Override
    public String toString() {
      return values.toString();
    }
  }

  record NumberList(List<BigDecimal> values) implements AttributeValue {
    public NumberList {
      values = ImmutableList.copyOf(values);
    }

    @Override
    public ValueKind kind() {
      return ValueKind.NUMBER_LIST;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof NumberList other) || values.size() != other.values.size()) return false;
      for (int i = 0; i < values.size(); i++) {
        if (values.get(i).compareTo(other.values.get(i)) != 0) return false;
      }
      return true;
    }

    @Override
    public int hashCode() {
      return values.stream().map(BigDecimal::stripTrailingZeros).collect(Collectors.toList()).hashCode();
    }

    @Override
    public String toString() {
      return values.stream().map(BigDecimal::toPlainString).collect(Collectors.joining(", ", "[", "]"));
    }
  }
}
