package com.example.tokendatasource.core.scheduling;

import com.example.tokendatasource.core.config.Settings;
import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Options for the job lock storage. Immutable once built.
 *
 * @param lockTimeout how long a tick waits for the distributed lock before it is skipped
 * @param autoMigrateSchema create the lock table on startup if it does not exist
 * @param lockTableName table holding lock rows
 * @param lockHoldLimit upper bound a lock row stays valid for if its holder never releases it
 * @param lockPollInterval pause between lock attempts while waiting
 */
public record StorageOptions(
    Duration lockTimeout,
    boolean autoMigrateSchema,
    String lockTableName,
    Duration lockHoldLimit,
    Duration lockPollInterval) {

  public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofMinutes(5);
  public static final String DEFAULT_LOCK_TABLE = "shedlock";
  public static final Duration DEFAULT_LOCK_HOLD_LIMIT = Duration.ofHours(1);
  public static final Duration DEFAULT_LOCK_POLL_INTERVAL = Duration.ofSeconds(1);

  private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

  public StorageOptions {
    requirePositive(lockTimeout, "lockTimeout");
    requirePositive(lockHoldLimit, "lockHoldLimit");
    requirePositive(lockPollInterval, "lockPollInterval");
    Objects.requireNonNull(lockTableName, "lockTableName");
    if (!TABLE_NAME.matcher(lockTableName).matches())
      throw new IllegalArgumentException("lockTableName is not a plain SQL identifier");
  }

  /** 5 minute lock timeout, schema auto-migration on. */
  public static StorageOptions defaults() {
    return new StorageOptions(
        DEFAULT_LOCK_TIMEOUT,
        true,
        DEFAULT_LOCK_TABLE,
        DEFAULT_LOCK_HOLD_LIMIT,
        DEFAULT_LOCK_POLL_INTERVAL);
  }

  /**
   * Reads {@code jobs.lock-timeout}, {@code jobs.auto-migrate-schema}, {@code jobs.lock-table},
   * {@code jobs.lock-hold-limit} and {@code jobs.lock-poll-interval}, falling back to {@link
   * #defaults()}.
   */
  public static StorageOptions fromEnvironment() {
    return new StorageOptions(
        Settings.duration("jobs.lock-timeout", DEFAULT_LOCK_TIMEOUT),
        Settings.bool("jobs.auto-migrate-schema", true),
        Settings.string("jobs.lock-table", DEFAULT_LOCK_TABLE),
        Settings.duration("jobs.lock-hold-limit", DEFAULT_LOCK_HOLD_LIMIT),
        Settings.duration("jobs.lock-poll-interval", DEFAULT_LOCK_POLL_INTERVAL));
  }

  public StorageOptions withLockTimeout(final Duration timeout) {
    return new StorageOptions(
        timeout, autoMigrateSchema, lockTableName, lockHoldLimit, lockPollInterval);
  }

  public StorageOptions withAutoMigrateSchema(final boolean migrate) {
    return new StorageOptions(lockTimeout, migrate, lockTableName, lockHoldLimit, lockPollInterval);
  }

  public StorageOptions withLockTableName(final String tableName) {
    return new StorageOptions(
        lockTimeout, autoMigrateSchema, tableName, lockHoldLimit, lockPollInterval);
  }

  private static void requirePositive(final Duration value, final String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero())
      throw new IllegalArgumentException(name + " must be positive");
  }
}
