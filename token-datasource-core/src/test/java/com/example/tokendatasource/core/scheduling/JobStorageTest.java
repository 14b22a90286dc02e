package com.example.tokendatasource.core.scheduling;

import static org.junit.jupiter.api.Assertions.*;

import com.example.tokendatasource.core.credentials.PasswordProvider;
import com.example.tokendatasource.core.jdbc.ConnectionSettings;
import com.example.tokendatasource.core.jdbc.TokenConnectionFactory;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class JobStorageTest {

  private String h2Url;
  private AtomicInteger opens;
  private TokenConnectionFactory factory;

  @BeforeEach
  void setUp() {
    h2Url = "jdbc:h2:mem:jobs-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
    opens = new AtomicInteger();
    factory =
        TokenConnectionFactory.builder()
            .name("jobs")
            .settings(
                ConnectionSettings.builder()
                    .host("localhost")
                    .database("jobs")
                    .username("sa")
                    .build())
            .passwordProvider(PasswordProvider.fixed("token"))
            .opener(
                (url, props) -> {
                  opens.incrementAndGet();
                  return DriverManager.getConnection(h2Url, props);
                })
            .build();
  }

  private int lockTableRows(final String table) throws SQLException {
    try (final var conn = DriverManager.getConnection(h2Url, "sa", "token");
        final var rs = conn.createStatement().executeQuery("SELECT COUNT(*) FROM " + table)) {
      rs.next();
      return rs.getInt(1);
    }
  }

  @Test
  @DisplayName("Should create the lock table on configure and tolerate repeated migrations")
  void shouldMigrateSchemaIdempotently() throws SQLException {
    final var storage = JobStorage.configure(StorageOptions.defaults(), factory);

    storage.migrateSchema();
    storage.migrateSchema();

    assertEquals(0, lockTableRows("shedlock"));
    assertTrue(opens.get() >= 3, "every storage operation opens a connection via the factory");
  }

  @Test
  @DisplayName("Should leave the schema alone when auto-migration is off")
  void shouldNotMigrateWhenDisabled() {
    JobStorage.configure(
        StorageOptions.defaults().withAutoMigrateSchema(false).withLockTableName("job_locks"),
        factory);

    assertThrows(SQLException.class, () -> lockTableRows("job_locks"));
  }

  @Test
  @DisplayName("Locks taken through storage exclude other holders until released")
  void locksExcludeOtherHolders() throws SQLException {
    final var options =
        StorageOptions.defaults().withLockTableName("job_locks").withLockTimeout(Duration.ofMillis(300));
    final var p1 = JobStorage.configure(options, factory).distributedLock();
    final var p2 = JobStorage.configure(options, factory).distributedLock();

    final var held = p1.acquire("nightly-report");
    assertEquals(1, lockTableRows("job_locks"));

    final var ex =
        assertThrows(LockAcquisitionTimeoutException.class, () -> p2.acquire("nightly-report"));
    assertEquals(Duration.ofMillis(300), ex.lockTimeout());
    assertNotNull(p2.acquire("other-job"));

    held.unlock();
    assertNotNull(p2.acquire("nightly-report"));
  }
}
