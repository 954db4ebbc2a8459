package org.waabox.vigia.channel.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.waabox.vigia.ChangeEvent;
import org.waabox.vigia.EventType;

/** Unit tests for {@link ChangeEventCodec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ChangeEventCodecTest {

  @Test
  void whenSerializing_givenUpdateEvent_shouldWriteAllFields() {
    final Map<String, Object> before = new LinkedHashMap<>();
    before.put("id", 7);
    before.put("name", "old");
    final Map<String, Object> after = new LinkedHashMap<>();
    after.put("id", 7);
    after.put("name", "new");

    final String json = ChangeEventCodec.serialize(ChangeEvent.live(
        "widgets", EventType.UPDATE, before, after));

    assertTrue(json.contains("\"resource\":\"widgets\""));
    assertTrue(json.contains("\"eventType\":\"UPDATE\""));
    assertTrue(json.contains("\"before\":{\"id\":7,\"name\":\"old\"}"));
    assertTrue(json.contains("\"after\":{\"id\":7,\"name\":\"new\"}"));
  }

  @Test
  void whenSerializing_givenDeleteWithoutAfter_shouldOmitAfter() {
    final String json = ChangeEventCodec.serialize(ChangeEvent.live(
        "widgets", EventType.DELETE, Map.of("id", 7), null));

    assertFalse(json.contains("\"after\""));
  }

  @Test
  void whenDeserializing_givenValidJson_shouldParseLiveEvent() {
    final String json = "{\"resource\":\"widgets\","
        + "\"eventType\":\"INSERT\","
        + "\"after\":{\"id\":1,\"name\":\"bolt\",\"price\":2.5}}";

    final ChangeEvent event = ChangeEventCodec.deserialize(json);

    assertEquals("widgets", event.resource());
    assertEquals(EventType.INSERT, event.eventType());
    assertNull(event.before());
    assertEquals(1, event.after().get("id"));
    assertEquals("bolt", event.after().get("name"));
    assertEquals(2.5, event.after().get("price"));
    assertFalse(event.isSynthesized());
  }

  @Test
  void whenDeserializing_givenNullImages_shouldKeepThemNull() {
    final ChangeEvent event = ChangeEventCodec.deserialize(
        "{\"resource\":\"widgets\",\"eventType\":\"DELETE\","
        + "\"before\":{\"id\":3},\"after\":null}");

    assertEquals(EventType.DELETE, event.eventType());
    assertEquals(3, event.before().get("id"));
    assertNull(event.after());
  }

  @Test
  void whenDeserializing_givenMissingResource_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> ChangeEventCodec.deserialize("{\"eventType\":\"INSERT\"}"));
  }

  @Test
  void whenDeserializing_givenUnknownEventType_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> ChangeEventCodec.deserialize(
            "{\"resource\":\"widgets\",\"eventType\":\"TRUNCATE\"}"));
  }

  @Test
  void whenDeserializing_givenScalarImage_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> ChangeEventCodec.deserialize(
            "{\"resource\":\"widgets\",\"eventType\":\"INSERT\","
            + "\"after\":42}"));
  }

  @Test
  void whenDeserializing_givenMalformedJson_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> ChangeEventCodec.deserialize("{not json"));
  }

  @Test
  void whenDeserializing_givenJsonArray_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> ChangeEventCodec.deserialize("[1,2]"));
  }
}
