package com.example.tokendatasource.core.scheduling;

import java.util.Objects;

/**
 * A recurring job: a unique id, when it runs, and what it runs.
 *
 * @param id unique per process, also the distributed lock name (at most 64 characters)
 * @param schedule when ticks fire
 * @param action the work
 */
public record RecurringJobSpec(String id, CronSchedule schedule, RecurringWorker action) {

  public RecurringJobSpec {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(schedule, "schedule");
    Objects.requireNonNull(action, "action");
    if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
    if (id.length() > 64) throw new IllegalArgumentException("id must be at most 64 characters");
  }

  /**
   * Creates a spec from a five-field cron expression.
   *
   * @throws IllegalArgumentException if the expression is invalid
   */
  public static RecurringJobSpec of(
      final String id, final String cronExpression, final RecurringWorker action) {
    return new RecurringJobSpec(id, CronSchedule.parse(cronExpression), action);
  }
}
