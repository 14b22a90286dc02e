package com.example;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.tokendatasource.core.credentials.CredentialCache;
import com.example.tokendatasource.core.credentials.RdsIamTokenSource;
import com.example.tokendatasource.core.credentials.SecretsManagerTokenSource;
import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.*;
import software.amazon.awssdk.services.rds.RdsUtilities;

public class MainTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty("credential.refresh.success-interval");
  }

  @Test
  @DisplayName("RDS IAM tokens refresh every 10 minutes by default")
  void rdsIamRefreshesInsideTokenLifetime() {
    final var rdsIam =
        new RdsIamTokenSource(mock(RdsUtilities.class), "app_user", Clock.systemUTC());

    final var policy = Main.refreshPolicy(rdsIam);

    assertEquals(Duration.ofMinutes(10), policy.successInterval());
    assertDoesNotThrow(
        () -> {
          try (final var cache =
              CredentialCache.builder()
                  .tokenSource(rdsIam)
                  .scope("db:5432")
                  .refreshPolicy(policy)
                  .build()) {
            assertTrue(cache.current().isEmpty());
          }
        });
  }

  @Test
  @DisplayName("Secrets Manager keeps the 4 hour default")
  void secretsManagerKeepsDefault() {
    final var policy = Main.refreshPolicy(mock(SecretsManagerTokenSource.class));
    assertEquals(Duration.ofHours(4), policy.successInterval());
  }

  @Test
  @DisplayName("A configured success interval overrides the RDS IAM default")
  void configuredIntervalOverridesDefault() {
    System.setProperty("credential.refresh.success-interval", "PT5M");
    final var rdsIam =
        new RdsIamTokenSource(mock(RdsUtilities.class), "app_user", Clock.systemUTC());
    assertEquals(Duration.ofMinutes(5), Main.refreshPolicy(rdsIam).successInterval());
  }

  @Test
  @DisplayName("Static password wiring has no token source and keeps the default policy")
  void staticPasswordKeepsDefault() {
    assertEquals(Duration.ofHours(4), Main.refreshPolicy(null).successInterval());
  }
}
