package org.waabox.vigia;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link EventFilter}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class EventFilterTest {

  @Test
  void whenMatching_givenAny_shouldMatchEveryType() {
    for (final EventType type : EventType.values()) {
      assertTrue(EventFilter.ANY.matches(type));
    }
  }

  @Test
  void whenMatching_givenSpecificFilter_shouldMatchOnlyItsType() {
    assertTrue(EventFilter.INSERT.matches(EventType.INSERT));
    assertFalse(EventFilter.INSERT.matches(EventType.UPDATE));
    assertFalse(EventFilter.DELETE.matches(EventType.INSERT));
  }

  @Test
  void whenAccepting_givenLiveEvent_shouldUseItsType() {
    final ChangeEvent delete = ChangeEvent.live("widgets", EventType.DELETE,
        Map.of("id", 1), null);

    assertTrue(EventFilter.DELETE.accepts(delete));
    assertFalse(EventFilter.UPDATE.accepts(delete));
  }

  @Test
  void whenAccepting_givenPolledEvent_shouldRejectOnlyDeleteFilter() {
    final ChangeEvent polled = ChangeEvent.polled("widgets",
        Map.of("id", 1));

    assertTrue(EventFilter.ANY.accepts(polled));
    assertTrue(EventFilter.INSERT.accepts(polled));
    assertTrue(EventFilter.UPDATE.accepts(polled));
    assertFalse(EventFilter.DELETE.accepts(polled));
  }
}
