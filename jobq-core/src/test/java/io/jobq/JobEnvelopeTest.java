package io.jobq;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JobEnvelopeTest {

  @Test
  void defaultsAreApplied() {
    Instant before = Instant.now();
    JobEnvelope envelope = JobEnvelope.of("email", "{}");

    assertEquals("email", envelope.jobType());
    assertEquals("{}", envelope.payload());
    assertEquals(JobEnvelope.DEFAULT_MAX_ATTEMPTS, envelope.maxAttempts());
    assertFalse(envelope.runAt().isBefore(before));
    assertDoesNotThrow(() -> UUID.fromString(envelope.jobId()));
  }

  @Test
  void generatedIdsSortInCreationOrder() {
    String first = JobEnvelope.of("t", "a").jobId();
    String second = JobEnvelope.of("t", "b").jobId();

    assertNotEquals(first, second);
    assertTrue(first.compareTo(second) < 0);
  }

  @Test
  void delayIsRelativeToBuildTime() {
    Instant before = Instant.now();
    JobEnvelope envelope = JobEnvelope.builder("t").payload("p").delay(Duration.ofMinutes(5)).build();

    assertFalse(envelope.runAt().isBefore(before.plus(Duration.ofMinutes(5))));
  }

  @Test
  void invalidSettingsAreRejected() {
    assertThrows(NullPointerException.class, () -> JobEnvelope.builder("t").build());
    assertThrows(IllegalArgumentException.class, () -> JobEnvelope.of("", "p"));
    assertThrows(IllegalArgumentException.class,
        () -> JobEnvelope.builder("t").payload("p").maxAttempts(0).build());
    assertThrows(IllegalArgumentException.class, () -> JobEnvelope.builder("t").payload("p")
        .runAt(Instant.now()).delay(Duration.ofSeconds(1)).build());
    assertThrows(IllegalArgumentException.class,
        () -> JobEnvelope.builder("t").payload("p").delay(Duration.ofSeconds(-1)).build());
  }

  @Test
  void explicitIdIsKept() {
    assertEquals("job-42", JobEnvelope.builder("t").jobId("job-42").payload("p").build().jobId());
  }
}
