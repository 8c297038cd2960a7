package dev.athenaeum.source;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Null-tolerant accessors over vendor JSON payloads. Missing, null and blank all read as null. */
final class JsonFields {

  private JsonFields() {}

  static @Nullable String text(JsonNode node, String field) {
    return text(node.path(field));
  }

  static @Nullable String text(JsonNode value) {
    if (value == null || value.isMissingNode() || value.isNull() || value.isContainerNode()) {
      return null;
    }
    String text = value.asText();
    return text.isBlank() ? null : text.trim();
  }

  static @Nullable Integer integer(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isIntegralNumber()) {
      return value.asInt();
    }
    if (value.isTextual()) {
      try {
        return Integer.valueOf(value.asText().trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  /** First element of a JSON array field, or the field itself when it is a plain string. */
  static @Nullable String firstText(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isArray()) {
      for (JsonNode element : value) {
        String text = text(element);
        if (text != null) {
          return text;
        }
      }
      return null;
    }
    return text(value);
  }

  /**
   * Treats a field as a list: arrays yield their elements, a single object yields itself, missing
   * yields nothing. XML payloads collapse one-element lists into a single object.
   */
  static List<JsonNode> elements(JsonNode node, String field) {
    JsonNode value = node.path(field);
    List<JsonNode> elements = new ArrayList<>();
    if (value.isArray()) {
      value.forEach(elements::add);
    } else if (!value.isMissingNode() && !value.isNull()) {
      elements.add(value);
    }
    return elements;
  }
}
