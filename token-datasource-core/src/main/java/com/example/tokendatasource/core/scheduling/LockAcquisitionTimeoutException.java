package com.example.tokendatasource.core.scheduling;

import java.time.Duration;

/** The distributed lock for a job was not obtained within the lock timeout. */
public class LockAcquisitionTimeoutException extends RuntimeException {

  private final String jobId;
  private final Duration lockTimeout;

  public LockAcquisitionTimeoutException(final String jobId, final Duration lockTimeout) {
    super("Lock for job %s not acquired within %s".formatted(jobId, lockTimeout));
    this.jobId = jobId;
    this.lockTimeout = lockTimeout;
  }

  public LockAcquisitionTimeoutException(
      final String jobId, final Duration lockTimeout, final Throwable cause) {
    super("Lock for job %s not acquired within %s".formatted(jobId, lockTimeout), cause);
    this.jobId = jobId;
    this.lockTimeout = lockTimeout;
  }

  public String jobId() {
    return jobId;
  }

  public Duration lockTimeout() {
    return lockTimeout;
  }
}
