package tabledeploy.aws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import tabledeploy.model.AttributeValue;
import tabledeploy.model.LockVersion;
import tabledeploy.model.NamedValue;
import tabledeploy.model.PrimaryKey;

import java.util.Map;

/**
 * The wire form of values and lock versions.
 * <p/>
 * Every value travels as a string: list values as a JSON array inside that string. A lock version is the
 * {@code LockVersion} object the service reported, kept verbatim (as compact JSON) in the {@link LockVersion}
 * token, so that it can be sent back unchanged.
 */
public class ConnectValueEncoding {
  private final ObjectMapper mapper;

  public ConnectValueEncoding(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public String encode(AttributeValue value) {
    if (value instanceof AttributeValue.TextList list) {
      return writeJson(mapper.valueToTree(list.values()));
    } else if (value instanceof AttributeValue.NumberList list) {
      ArrayNode array = mapper.createArrayNode();
      list.values().forEach(array::add);
      return writeJson(array);
    }
    return value.toString();
  }

  public ArrayNode primaryValues(PrimaryKey key) {
    ArrayNode array = mapper.createArrayNode();
    for (NamedValue value : key.values()) {
      array.addObject()
              .put("AttributeName", value.attributeName())
              .put("Value", encode(value.value()));
    }
    return array;
  }

  /**
   * @return the primary values of a response entry, by attribute name
   */
  public static Map<String, String> primaryValuesOf(JsonNode entry) {
    ImmutableMap.Builder<String, String> values = ImmutableMap.builder();
    for (JsonNode value : entry.path("PrimaryValues")) {
      values.put(value.path("AttributeName").asText(), value.path("Value").asText());
    }
    return values.buildKeepingLast();
  }

  /**
   * @return the primary values of {@code key} as they appear in response entries
   */
  public Map<String, String> primaryValuesOf(PrimaryKey key) {
    ImmutableMap.Builder<String, String> values = ImmutableMap.builder();
    for (NamedValue value : key.values()) {
      values.put(value.attributeName(), encode(value.value()));
    }
    return values.build();
  }

  public ObjectNode lockVersionNode(LockVersion version) {
    if (!version.isPresent()) return mapper.createObjectNode();
    try {
      JsonNode node = mapper.readTree(version.token().orElseThrow());
      if (node instanceof ObjectNode object) return object;
      throw new IllegalArgumentException("Not a Connect lock version: " + version);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Not a Connect lock version: " + version, e);
    }
  }

  /**
   * @return the {@code LockVersion} of a response entry as an opaque token; none if absent or empty
   */
  public LockVersion lockVersionOf(JsonNode entry) {
    JsonNode lockVersion = entry.path("LockVersion");
    if (!lockVersion.isObject() || lockVersion.isEmpty()) return LockVersion.none();
    return LockVersion.of(writeJson(lockVersion));
  }

  private String writeJson(JsonNode node) {
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(e);
    }
  }
}
