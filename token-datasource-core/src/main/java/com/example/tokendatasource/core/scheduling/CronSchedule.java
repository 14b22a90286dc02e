package com.example.tokendatasource.core.scheduling;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;
import org.springframework.scheduling.support.CronExpression;

/**
 * Five-field cron schedule: minute, hour, day-of-month, month, day-of-week. {@code * * * * *}
 * fires at the start of every minute.
 */
public final class CronSchedule {

  private final String expression;
  private final CronExpression cron;

  private CronSchedule(final String expression, final CronExpression cron) {
    this.expression = expression;
    this.cron = cron;
  }

  /**
   * Parses a five-field cron expression.
   *
   * @throws IllegalArgumentException if the expression does not have exactly five fields or a
   *     field is invalid
   */
  public static CronSchedule parse(final String expression) {
    Objects.requireNonNull(expression, "expression");
    final var fields = expression.trim().split("\\s+");
    if (fields.length != 5)
      throw new IllegalArgumentException(
          "Cron expression must have 5 fields (minute hour day-of-month month day-of-week): "
              + expression);
    final var normalized = String.join(" ", fields);
    // Spring expects a leading seconds field.
    return new CronSchedule(normalized, CronExpression.parse("0 " + normalized));
  }

  /**
   * Next fire time strictly after {@code after}.
   *
   * @param after reference instant
   * @param zone zone the fields are interpreted in
   * @return next fire time, empty if the expression never fires again
   */
  public Optional<Instant> next(final Instant after, final ZoneId zone) {
    return Optional.ofNullable(cron.next(after.atZone(zone))).map(ZonedDateTime::toInstant);
  }

  public String expression() {
    return expression;
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof CronSchedule other && expression.equals(other.expression);
  }

  @Override
  public int hashCode() {
    return expression.hashCode();
  }

  @Override
  public String toString() {
    return expression;
  }
}
