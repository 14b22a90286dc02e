package com.example.tokendatasource.core.scheduling;

import static java.lang.System.Logger.Level.INFO;

import com.example.tokendatasource.core.jdbc.TokenConnectionFactory;
import com.example.tokendatasource.core.jdbc.TokenDataSource;
import java.lang.System.Logger;
import java.util.Objects;
import javax.sql.DataSource;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Storage backend for job locks. Every storage operation (schema check, lock insert, update and
 * release) runs on connections from the DataSource it was configured with, so a token-backed
 * DataSource keeps lock storage on the current credential.
 *
 * <p>Locks are rows in a ShedLock table; lock expiry is evaluated against database time so
 * processes with skewed clocks agree on it.
 */
public final class JobStorage {

  private static final Logger logger = System.getLogger(JobStorage.class.getName());

  private final StorageOptions options;
  private final JdbcTemplate jdbcTemplate;
  private final LockProvider lockProvider;

  JobStorage(
      final StorageOptions options, final JdbcTemplate jdbcTemplate, final LockProvider lockProvider) {
    this.options = Objects.requireNonNull(options, "options");
    this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
    this.lockProvider = Objects.requireNonNull(lockProvider, "lockProvider");
  }

  /**
   * Wires lock storage to a token-backed connection factory.
   *
   * @param options storage options
   * @param factory source of every storage connection
   * @return configured storage, schema migrated if {@link StorageOptions#autoMigrateSchema()}
   */
  public static JobStorage configure(
      final StorageOptions options, final TokenConnectionFactory factory) {
    return configure(options, new TokenDataSource(factory));
  }

  /**
   * Wires lock storage to a DataSource, typically a pool over a {@link TokenDataSource}.
   *
   * @param options storage options
   * @param dataSource source of every storage connection
   * @return configured storage, schema migrated if {@link StorageOptions#autoMigrateSchema()}
   */
  public static JobStorage configure(final StorageOptions options, final DataSource dataSource) {
    final var jdbcTemplate = new JdbcTemplate(dataSource);
    final var lockProvider =
        new JdbcTemplateLockProvider(
            JdbcTemplateLockProvider.Configuration.builder()
                .withJdbcTemplate(jdbcTemplate)
                .withTableName(options.lockTableName())
                .usingDbTime()
                .build());

    final var storage = new JobStorage(options, jdbcTemplate, lockProvider);
    if (options.autoMigrateSchema()) storage.migrateSchema();
    return storage;
  }

  /** Creates the lock table if it does not exist. Safe to repeat. */
  public void migrateSchema() {
    jdbcTemplate.execute(
        """
        CREATE TABLE IF NOT EXISTS %s (
          name VARCHAR(64) NOT NULL,
          lock_until TIMESTAMP NOT NULL,
          locked_at TIMESTAMP NOT NULL,
          locked_by VARCHAR(255) NOT NULL,
          PRIMARY KEY (name)
        )
        """
            .formatted(options.lockTableName()));
    logger.log(INFO, "Lock table {0} is present", options.lockTableName());
  }

  /** Distributed lock over this storage, bounded by {@link StorageOptions#lockTimeout()}. */
  public DistributedJobLock distributedLock() {
    return new DistributedJobLock(lockProvider, options);
  }

  public LockProvider lockProvider() {
    return lockProvider;
  }

  public StorageOptions options() {
    return options;
  }
}
