package tabledeploy.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import java.util.List;

/**
 * {@code attribute_values/<table>.json}: rows as written by hand, before their values are typed against the
 * table's attribute declarations.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableValuesFile.class)
@JsonDeserialize(as = ImmutableValuesFile.class)
public interface ValuesFile {
  List<Row> values();

  @Value.Immutable
  @JsonSerialize(as = ImmutableRow.class)
  @JsonDeserialize(as = ImmutableRow.class)
  interface Row {
    List<Entry> primaryValues();

    List<Entry> attributes();
  }

  /**
   * One {@code {attributeName, value}} pair. The value is kept as parsed: a string, number, boolean, or array.
   */
  @Value.Immutable
  @JsonSerialize(as = ImmutableEntry.class)
  @JsonDeserialize(as = ImmutableEntry.class)
  interface Entry {
    String attributeName();

    JsonNode value();
  }
}
