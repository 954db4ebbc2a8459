package org.waabox.vigia;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ChangeEvent}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ChangeEventTest {

  @Test
  void whenPolling_givenRecord_shouldSynthesizeUpdateWithoutBefore() {
    final ChangeEvent event = ChangeEvent.polled("widgets",
        Map.of("id", 7));

    assertEquals(EventType.UPDATE, event.eventType());
    assertNull(event.before());
    assertEquals(7, event.after().get("id"));
    assertTrue(event.isSynthesized());
  }

  @Test
  void whenCreating_givenMutableRecord_shouldKeepAnUnmodifiableCopy() {
    final Map<String, Object> record = new HashMap<>();
    record.put("id", 1);
    record.put("name", null);

    final ChangeEvent event = ChangeEvent.live("widgets", EventType.INSERT,
        null, record);
    record.put("id", 2);

    assertEquals(1, event.after().get("id"));
    assertTrue(event.after().containsKey("name"));
    assertFalse(event.isSynthesized());
    assertThrows(UnsupportedOperationException.class, () ->
        event.after().put("id", 3)
    );
  }

  @Test
  void whenCreating_givenNullResource_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        ChangeEvent.live(null, EventType.INSERT, null, Map.of())
    );
  }
}
