package org.waabox.vigia;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link BackoffPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class BackoffPolicyTest {

  @Test
  void whenComputingDelays_givenDefaultPolicy_shouldDoubleUntilCap() {
    final BackoffPolicy policy = BackoffPolicy.defaultPolicy();

    assertEquals(Optional.of(Duration.ofMillis(1000)), policy.delayFor(0));
    assertEquals(Optional.of(Duration.ofMillis(2000)), policy.delayFor(1));
    assertEquals(Optional.of(Duration.ofMillis(4000)), policy.delayFor(2));
    assertTrue(policy.delayFor(3).isEmpty());
  }

  @Test
  void whenComputingDelays_givenSmallCap_shouldNeverExceedIt() {
    final BackoffPolicy policy = BackoffPolicy.of(Duration.ofSeconds(1),
        Duration.ofSeconds(3), 10);

    assertEquals(Duration.ofSeconds(2), policy.delayFor(1).get());
    assertEquals(Duration.ofSeconds(3), policy.delayFor(2).get());
    assertEquals(Duration.ofSeconds(3), policy.delayFor(9).get());
  }

  @Test
  void whenComputingDelays_givenHugeAttempt_shouldNotOverflow() {
    final BackoffPolicy policy = BackoffPolicy.of(Duration.ofSeconds(1),
        Duration.ofSeconds(30), Integer.MAX_VALUE);

    assertEquals(Duration.ofSeconds(30), policy.delayFor(70).get());
  }

  @Test
  void whenComputingDelays_givenZeroAttempts_shouldNeverRetry() {
    final BackoffPolicy policy = BackoffPolicy.of(Duration.ofSeconds(1),
        Duration.ofSeconds(30), 0);

    assertTrue(policy.delayFor(0).isEmpty());
  }

  @Test
  void whenComputingDelays_givenNegativeAttempt_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        BackoffPolicy.defaultPolicy().delayFor(-1)
    );
  }

  @Test
  void whenCreating_givenMaxBelowBase_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        BackoffPolicy.of(Duration.ofSeconds(5), Duration.ofSeconds(1), 3)
    );
  }

  @Test
  void whenCreating_givenZeroBase_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        BackoffPolicy.of(Duration.ZERO, Duration.ofSeconds(1), 3)
    );
  }

  @Test
  void whenCreating_givenNegativeAttempts_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        BackoffPolicy.of(Duration.ofSeconds(1), Duration.ofSeconds(1), -1)
    );
  }

  @Test
  void whenCreating_givenNullBase_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        BackoffPolicy.of(null, Duration.ofSeconds(1), 3)
    );
  }
}
