package com.example.tokendatasource.core.scheduling;

/**
 * Lifecycle of a registered job.
 *
 * <pre>
 * REGISTERED -> SCHEDULED -> LOCK_ACQUIRED -> RUNNING -> COMPLETED -> SCHEDULED
 *                         \-> SKIPPED -> SCHEDULED          \-> FAILED -> SCHEDULED
 * </pre>
 */
public enum JobState {
  REGISTERED,
  SCHEDULED,
  LOCK_ACQUIRED,
  RUNNING,
  COMPLETED,
  SKIPPED,
  FAILED
}
