package com.example;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.tokendatasource.core.CredentialBroker;
import com.example.tokendatasource.core.config.Settings;
import com.example.tokendatasource.core.credentials.RdsIamTokenSource;
import com.example.tokendatasource.core.credentials.RefreshPolicy;
import com.example.tokendatasource.core.credentials.SecretsManagerTokenSource;
import com.example.tokendatasource.core.credentials.TokenSource;
import com.example.tokendatasource.core.jdbc.ConnectionSettings;
import com.example.tokendatasource.core.jdbc.ConnectionSetupHook;
import com.example.tokendatasource.core.jdbc.DbClient;
import com.example.tokendatasource.core.scheduling.JobStorage;
import com.example.tokendatasource.core.scheduling.RecurringJobScheduler;
import com.example.tokendatasource.core.scheduling.RecurringJobSpec;
import com.example.tokendatasource.core.scheduling.StorageOptions;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import javax.sql.DataSource;
import org.hibernate.SessionFactory;
import org.hibernate.boot.registry.StandardServiceRegistryBuilder;
import org.hibernate.cfg.Configuration;

/**
 * Hibernate and recurring-job example: one credential cache shared by two connection factories.
 *
 * <p>The ORM factory feeds a HikariCP pool consumed by Hibernate; the jobs factory feeds a second
 * pool consumed by the lock storage. A heartbeat job runs every minute under the distributed lock.
 */
public class Main {

  private static final System.Logger LOGGER = System.getLogger(Main.class.getName());

  static final String HEARTBEAT_JOB = "heartbeat";

  private static volatile Application INSTANCE;

  private static final CountDownLatch STOPPED = new CountDownLatch(1);

  public static void main(String[] args) throws InterruptedException {
    application().scheduler().start();
    STOPPED.await();
  }

  /** Components built from the environment, created once per process. */
  public record Application(
      CredentialBroker broker,
      HikariDataSource ormPool,
      SessionFactory sessionFactory,
      HikariDataSource jobsPool,
      RecurringJobScheduler scheduler,
      HeartbeatWorker heartbeat) {}

  public static synchronized Application application() {
    if (INSTANCE == null) {
      final var settings = ConnectionSettings.fromEnvironment();
      final var tokenSource = settings.password().isPresent() ? null : tokenSource(settings);
      final var broker =
          CredentialBroker.builder()
              .settings(settings)
              .tokenSource(tokenSource)
              .tokenScope(Settings.lookup("db.token.scope").orElse(null))
              .refreshPolicy(refreshPolicy(tokenSource))
              .build();
      INSTANCE = wire(broker, StorageOptions.fromEnvironment());
      Runtime.getRuntime().addShutdownHook(new Thread(Main::shutdown));
    }
    return INSTANCE;
  }

  static Application wire(final CredentialBroker broker, final StorageOptions storageOptions) {
    final var ormPool =
        hikariPool("hibernate-orm-pool", broker.dataSource("orm", ConnectionSetupHook.NONE), 10);
    final var sessionFactory = buildSessionFactory(ormPool);

    final var jobsPool =
        hikariPool(
            "jobs-storage-pool",
            broker.dataSource(
                "jobs", ConnectionSetupHook.execute("SET application_name = 'recurring-jobs'")),
            2);
    final var storage = JobStorage.configure(storageOptions, jobsPool);

    final var heartbeat = new HeartbeatWorker(new DbClient(ormPool), 3, Duration.ofSeconds(2));
    final var scheduler = RecurringJobScheduler.builder().lock(storage.distributedLock()).build();
    scheduler.register(RecurringJobSpec.of(HEARTBEAT_JOB, "* * * * *", heartbeat));

    LOGGER.log(INFO, "Wired ORM and job storage for {0}", broker.settings());
    return new Application(broker, ormPool, sessionFactory, jobsPool, scheduler, heartbeat);
  }

  static TokenSource tokenSource(final ConnectionSettings settings) {
    final var kind = Settings.string("db.token.source", "rds-iam");
    return switch (kind) {
      case "rds-iam" -> new RdsIamTokenSource(settings.username());
      case "secrets-manager" -> new SecretsManagerTokenSource();
      default -> throw new IllegalStateException("Unknown db.token.source: " + kind);
    };
  }

  /** RDS IAM tokens expire after 15 minutes, so that source refreshes every 10 by default. */
  static RefreshPolicy refreshPolicy(final TokenSource tokenSource) {
    return tokenSource instanceof RdsIamTokenSource
        ? RefreshPolicy.fromEnvironment(RdsIamTokenSource.REFRESH_INTERVAL)
        : RefreshPolicy.fromEnvironment();
  }

  static SessionFactory buildSessionFactory(final DataSource dataSource) {
    final var hibernateCfg = new Configuration();
    hibernateCfg.setProperty("hibernate.dialect", "org.hibernate.dialect.PostgreSQLDialect");
    hibernateCfg.setProperty("hibernate.hbm2ddl.auto", "none");

    final var serviceRegistry =
        new StandardServiceRegistryBuilder()
            .applySetting("hibernate.connection.datasource", dataSource)
            .applySettings(hibernateCfg.getProperties())
            .build();

    return hibernateCfg.buildSessionFactory(serviceRegistry);
  }

  static HikariDataSource hikariPool(
      final String poolName, final DataSource tokenDataSource, final int maximumPoolSize) {
    final var cfg = new HikariConfig();
    cfg.setDataSource(tokenDataSource);
    cfg.setPoolName(poolName);
    cfg.setMaximumPoolSize(maximumPoolSize);
    // Pooled connections are reopened, with the then-current token, at least this often.
    cfg.setMaxLifetime(Duration.ofMinutes(10).toMillis());
    return new HikariDataSource(cfg);
  }

  public static synchronized void shutdown() {
    if (INSTANCE != null) {
      final var app = INSTANCE;
      INSTANCE = null;
      close("scheduler", app.scheduler());
      close("session factory", app.sessionFactory());
      close("ORM pool", app.ormPool());
      close("jobs pool", app.jobsPool());
      close("credential broker", app.broker());
    }
    STOPPED.countDown();
  }

  private static void close(final String what, final AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (final Exception e) {
      LOGGER.log(WARNING, "Failed to close " + what, e);
    }
  }
}
