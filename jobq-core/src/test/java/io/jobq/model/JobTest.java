package io.jobq.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JobTest {

  @Test
  void deadLetterRequiresFailedAndExhausted() {
    assertTrue(job(JobStatus.FAILED, 3, 3).deadLetter());
    assertFalse(job(JobStatus.FAILED, 2, 3).deadLetter());
    assertFalse(job(JobStatus.RUNNING, 3, 3).deadLetter());
  }

  @Test
  void updateCopiesMutableFieldsAndReplacesSelectively() {
    Job job = job(JobStatus.RUNNING, 1, 5);

    JobUpdate update = JobUpdate.of(job).withAttempts(2).withLastError("timeout");

    assertEquals(JobStatus.RUNNING, update.status());
    assertEquals(2, update.attempts());
    assertEquals("timeout", update.lastError());
    assertEquals("w1", update.lockBy());
    assertEquals(job.lockAt(), update.lockAt());
  }

  @Test
  void updateRejectsNegativeAttempts() {
    assertThrows(IllegalArgumentException.class,
        () -> JobUpdate.of(job(JobStatus.PENDING, 0, 1)).withAttempts(-1));
  }

  private static Job job(JobStatus status, int attempts, int maxAttempts) {
    Instant now = Instant.now();
    return new Job("id-1", "type", "payload", status, attempts, maxAttempts,
        now, null, now, "w1", null);
  }
}
