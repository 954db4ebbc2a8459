package org.waabox.vigia.channel.kafka;

import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.vigia.ChangeEvent;
import org.waabox.vigia.EventType;

/**
 * Converts {@link ChangeEvent} instances to and from the JSON messages
 * carried by the change topic.
 *
 * <p>A message holds the fields {@code resource}, {@code eventType},
 * {@code before} and {@code after}. Both record images are JSON objects
 * or absent. Decoded events are always live events.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChangeEventCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The type of a decoded record image. */
  private static final TypeReference<Map<String, Object>> IMAGE =
      new TypeReference<Map<String, Object>>() { };

  private ChangeEventCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a change event into a JSON string.
   *
   * @param event the event to serialize, never null.
   * @return the JSON representation of the event, never null.
   */
  public static String serialize(final ChangeEvent event) {
    Objects.requireNonNull(event, "event cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("resource", event.resource());
    node.put("eventType", event.eventType().name());
    if (event.before() != null) {
      node.set("before", MAPPER.valueToTree(event.before()));
    }
    if (event.after() != null) {
      node.set("after", MAPPER.valueToTree(event.after()));
    }
    return node.toString();
  }

  /**
   * Deserializes a JSON string into a live {@link ChangeEvent}.
   *
   * @param json the JSON string to parse, never null.
   * @return the parsed event, never null.
   * @throws IllegalArgumentException if the JSON is malformed, misses
   *     required fields or names an unknown event type.
   */
  public static ChangeEvent deserialize(final String json) {
    Objects.requireNonNull(json, "json cannot be null");

    try {
      final JsonNode node = MAPPER.readTree(json);
      if (node == null || !node.isObject()) {
        throw new IllegalArgumentException(
            "Change event must be a JSON object: " + json);
      }
      final String resource = requireField(node, "resource").asText();
      final EventType type = EventType.valueOf(
          requireField(node, "eventType").asText());

      return ChangeEvent.live(resource, type, image(node, "before"),
          image(node, "after"));
    } catch (final IllegalArgumentException e) {
      throw e;
    } catch (final Exception e) {
      throw new IllegalArgumentException(
          "Failed to deserialize ChangeEvent from JSON: " + json, e);
    }
  }

  /** Returns the record image stored under the given field.
   *
   * @param node the parent JSON node.
   * @param field the image field name.
   * @return the image, or null if the field is absent or null.
   * @throws IllegalArgumentException if the field is not an object.
   */
  private static Map<String, Object> image(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isObject()) {
      throw new IllegalArgumentException(
          "Field " + field + " must be an object in JSON: " + node);
    }
    return MAPPER.convertValue(value, IMAGE);
  }

  /** Returns the field node for the given key or throws if missing.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the field node, never null.
   * @throws IllegalArgumentException if the field is missing.
   */
  private static JsonNode requireField(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException(
          "Missing field: " + field + " in JSON: " + node);
    }
    return value;
  }
}
