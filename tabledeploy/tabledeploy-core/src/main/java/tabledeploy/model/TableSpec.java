package tabledeploy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import java.util.Map;

@Value.Immutable
@JsonSerialize(as = ImmutableTableSpec.class)
@JsonDeserialize(as = ImmutableTableSpec.class)
public interface TableSpec {
  String DEFAULT_TIME_ZONE = "US/Eastern";

  static ImmutableTableSpec.Builder builder() {
    return ImmutableTableSpec.builder();
  }

  String name();

  @Value.Default
  default String description() {
    return "";
  }

  @Value.Default
  default String timeZone() {
    return DEFAULT_TIME_ZONE;
  }

  @JsonProperty("valueLockLevel")
  @Value.Default
  default LockLevel lockLevel() {
    return LockLevel.NONE;
  }

  Map<String, String> tags();
}
