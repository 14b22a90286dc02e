package com.example.tokendatasource.core.scheduling;

/** A {@link RecurringWorker} failed during a tick. */
public class JobExecutionException extends RuntimeException {

  private final String jobId;

  public JobExecutionException(final String jobId, final Throwable cause) {
    super("Job %s failed: %s".formatted(jobId, cause.getMessage()), cause);
    this.jobId = jobId;
  }

  public String jobId() {
    return jobId;
  }
}
