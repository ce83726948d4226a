package tabledeploy.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;
import tabledeploy.model.AttributeSpec;

import java.util.List;

/**
 * {@code attributes/<table>.json}
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAttributesFile.class)
@JsonDeserialize(as = ImmutableAttributesFile.class)
public interface AttributesFile {
  List<AttributeSpec> attributes();
}
