package com.example.tokendatasource.core;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.tokendatasource.core.credentials.Credential;
import com.example.tokendatasource.core.credentials.ManualDelayScheduler;
import com.example.tokendatasource.core.credentials.RefreshPolicy;
import com.example.tokendatasource.core.credentials.TokenSource;
import com.example.tokendatasource.core.jdbc.ConnectionSettings;
import com.example.tokendatasource.core.jdbc.ConnectionSetupHook;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class CredentialBrokerTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  private ManualDelayScheduler scheduler;
  private List<String> passwords;

  @BeforeEach
  void setUp() {
    scheduler = new ManualDelayScheduler(T0);
    passwords = new ArrayList<>();
  }

  private CredentialBroker.Builder broker(final ConnectionSettings settings) {
    return CredentialBroker.builder()
        .settings(settings)
        .scheduler(scheduler)
        .refreshPolicy(new RefreshPolicy(Duration.ofHours(4), Duration.ofSeconds(10)))
        .opener(
            (url, props) -> {
              passwords.add(props.getProperty("password"));
              return mock(Connection.class);
            });
  }

  private static ConnectionSettings.Builder settings() {
    return ConnectionSettings.builder()
        .host("mydb.cluster-abc.us-east-1.rds.amazonaws.com")
        .database("app")
        .username("app_user");
  }

  @Test
  @DisplayName("A static password disables token fetching entirely")
  void staticPasswordDisablesTokenFetching() throws Exception {
    final var tokenSource = mock(TokenSource.class);

    try (final var broker = broker(settings().password("static-pw").build()).tokenSource(tokenSource).build()) {
      broker.connectionFactory("orm", ConnectionSetupHook.NONE).getConnection();
      broker.dataSource("jobs", ConnectionSetupHook.NONE).getConnection();
      scheduler.advanceBy(Duration.ofHours(24));

      assertTrue(broker.credentialCache().isEmpty());
      assertEquals(List.of("static-pw", "static-pw"), passwords);
      assertTrue(scheduler.pendingDueTimes().isEmpty());
    }
    verifyNoInteractions(tokenSource);
  }

  @Test
  @DisplayName("Factories share one cache and see each refreshed token")
  void factoriesShareOneCache() throws Exception {
    final var tokens = new ArrayList<>(List.of("A", "B"));
    final var scopes = new ArrayList<String>();
    final TokenSource tokenSource =
        scope -> {
          scopes.add(scope);
          return new Credential(tokens.remove(0), scheduler.now(), scheduler.now().plusSeconds(900));
        };

    try (final var broker = broker(settings().build()).tokenSource(tokenSource).build()) {
      final var orm = broker.connectionFactory("orm", ConnectionSetupHook.NONE);
      final var jobs = broker.connectionFactory("jobs", ConnectionSetupHook.NONE);

      scheduler.advanceBy(Duration.ZERO);
      orm.getConnection();
      jobs.getConnection();
      scheduler.advanceBy(Duration.ofHours(4));
      orm.getConnection();
      jobs.getConnection();

      assertEquals(List.of("A", "A", "B", "B"), passwords);
      assertEquals(
          List.of(
              "mydb.cluster-abc.us-east-1.rds.amazonaws.com:5432",
              "mydb.cluster-abc.us-east-1.rds.amazonaws.com:5432"),
          scopes);
      assertSame(broker.passwordProvider(), broker.credentialCache().orElseThrow());
    }
  }

  @Test
  @DisplayName("Should use an explicit token scope when given")
  void shouldUseExplicitTokenScope() {
    final var scopes = new ArrayList<String>();
    try (final var broker =
        broker(settings().build())
            .tokenSource(
                scope -> {
                  scopes.add(scope);
                  return new Credential("t", scheduler.now(), scheduler.now().plusSeconds(60));
                })
            .tokenScope("prod/db/app")
            .build()) {
      scheduler.advanceBy(Duration.ZERO);
      assertEquals("prod/db/app", broker.credentialCache().orElseThrow().scope());
      assertEquals(List.of("prod/db/app"), scopes);
    }
  }

  @Test
  @DisplayName("Should require a token source when no password is configured")
  void shouldRequireTokenSourceWithoutPassword() {
    assertThrows(IllegalStateException.class, () -> broker(settings().build()).build());
  }

  @Test
  @DisplayName("Should stop refreshing on close")
  void shouldStopRefreshingOnClose() {
    final var broker =
        broker(settings().build())
            .tokenSource(scope -> new Credential("t", scheduler.now(), scheduler.now().plusSeconds(60)))
            .build();
    scheduler.advanceBy(Duration.ZERO);
    assertFalse(scheduler.pendingDueTimes().isEmpty());

    broker.close();

    assertTrue(scheduler.pendingDueTimes().isEmpty());
  }
}
