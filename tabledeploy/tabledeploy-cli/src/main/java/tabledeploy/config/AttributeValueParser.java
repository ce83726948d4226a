package tabledeploy.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Streams;
import tabledeploy.model.AttributeValue;
import tabledeploy.model.ConfigurationException;
import tabledeploy.model.ValueKind;

import java.math.BigDecimal;
import java.util.List;

/**
 * Types a value written in a values file according to its attribute's declared kind.
 * <p/>
 * Scalars may be written as JSON scalars or as strings. List values may be written as JSON arrays or as
 * comma-delimited strings: text elements are kept exactly as split, number elements are trimmed before parsing.
 */
public class AttributeValueParser {
  private static final Splitter COMMA = Splitter.on(',');

  private AttributeValueParser() {
  }

  public static AttributeValue parse(String attributeName, ValueKind kind, JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      throw ConfigurationException.format("Attribute '%s' has no value", attributeName);
    }
    return switch (kind) {
      case TEXT -> AttributeValue.text(scalarText(attributeName, kind, node));
      case NUMBER -> AttributeValue.number(number(attributeName, scalarText(attributeName, kind, node).trim()));
      case BOOLEAN -> AttributeValue.bool(bool(attributeName, node));
      case TEXT_LIST -> AttributeValue.textList(elements(attributeName, kind, node));
      case NUMBER_LIST -> AttributeValue.numberList(elements(attributeName, kind, node).stream()
              .map(element -> number(attributeName, element.trim()))
              .collect(ImmutableList.toImmutableList()));
    };
  }

  private static String scalarText(String attributeName, ValueKind kind, JsonNode node) {
    if (node.isContainerNode()) {
      throw ConfigurationException.format("Attribute '%s' is declared %s but was given %s", attributeName, kind, node);
    }
    return node.isNumber() ? node.decimalValue().toPlainString() : node.asText();
  }

  private static List<String> elements(String attributeName, ValueKind kind, JsonNode node) {
    if (node.isArray()) {
      return Streams.stream(node)
              .map(element -> scalarText(attributeName, kind, element))
              .collect(ImmutableList.toImmutableList());
    }
    return COMMA.splitToList(scalarText(attributeName, kind, node));
  }

  private static BigDecimal number(String attributeName, String text) {
    try {
      return new BigDecimal(text);
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
              String.format("Attribute '%s' expects a number but was given '%s'", attributeName, text), e);
    }
  }

  private static boolean bool(String attributeName, JsonNode node) {
    if (node.isBoolean()) return node.booleanValue();
    String text = node.isTextual() ? node.textValue().trim() : "";
    if (text.equalsIgnoreCase("true")) return true;
    if (text.equalsIgnoreCase("false")) return false;
    throw ConfigurationException.format("Attribute '%s' expects true or false but was given %s", attributeName, node);
  }
}
