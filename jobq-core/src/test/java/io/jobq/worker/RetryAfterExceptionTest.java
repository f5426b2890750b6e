package io.jobq.worker;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryAfterExceptionTest {

  @Test
  void carriesDelayAndMessage() {
    RetryAfterException e = new RetryAfterException(Duration.ofSeconds(30), "429");

    assertEquals(Duration.ofSeconds(30), e.retryAfter());
    assertEquals("429", e.getMessage());
  }

  @Test
  void defaultMessageNamesDelay() {
    assertEquals("Retry after PT5S", new RetryAfterException(Duration.ofSeconds(5)).getMessage());
  }

  @Test
  void negativeOrNullDelayIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new RetryAfterException(Duration.ofSeconds(-1)));
    assertThrows(NullPointerException.class, () -> new RetryAfterException(null, "x"));
  }
}
