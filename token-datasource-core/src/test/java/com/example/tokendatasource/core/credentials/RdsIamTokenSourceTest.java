package com.example.tokendatasource.core.credentials;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.*;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.rds.RdsUtilities;
import software.amazon.awssdk.services.rds.model.GenerateAuthenticationTokenRequest;

public class RdsIamTokenSourceTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  private RdsUtilities utilities;
  private RdsIamTokenSource tokenSource;

  @BeforeEach
  void setUp() {
    utilities = mock(RdsUtilities.class);
    tokenSource = new RdsIamTokenSource(utilities, "app_user", Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  @DisplayName("Should sign a token for the endpoint in the scope")
  void shouldSignTokenForEndpoint() {
    when(utilities.generateAuthenticationToken(any(GenerateAuthenticationTokenRequest.class)))
        .thenReturn("signed-token");

    final var credential = tokenSource.fetch("db.example.com:5432");

    final var request = ArgumentCaptor.forClass(GenerateAuthenticationTokenRequest.class);
    verify(utilities).generateAuthenticationToken(request.capture());
    assertEquals("db.example.com", request.getValue().hostname());
    assertEquals(5432, request.getValue().port());
    assertEquals("app_user", request.getValue().username());

    assertEquals("signed-token", credential.token());
    assertEquals(NOW, credential.obtainedAt());
    assertEquals(NOW.plus(Duration.ofMinutes(15)), credential.expiresAt());
  }

  @Test
  @DisplayName("Should report the token lifetime and a refresh interval inside it")
  void shouldReportTokenLifetime() {
    assertEquals(Optional.of(Duration.ofMinutes(15)), tokenSource.tokenLifetime());
    assertTrue(RdsIamTokenSource.REFRESH_INTERVAL.compareTo(Duration.ofMinutes(15)) < 0);
    assertDoesNotThrow(
        () ->
            CredentialCache.builder()
                .tokenSource(tokenSource)
                .scope("db:5432")
                .refreshPolicy(
                    new RefreshPolicy(RdsIamTokenSource.REFRESH_INTERVAL, Duration.ofSeconds(10)))
                .scheduler(new ManualDelayScheduler(NOW))
                .build());
  }

  @Test
  @DisplayName("Should reject scopes that are not host:port")
  void shouldRejectMalformedScope() {
    assertThrows(CredentialFetchException.class, () -> tokenSource.fetch("db.example.com"));
    assertThrows(CredentialFetchException.class, () -> tokenSource.fetch("db.example.com:"));
    assertThrows(CredentialFetchException.class, () -> tokenSource.fetch("db.example.com:pg"));
    verifyNoInteractions(utilities);
  }

  @Test
  @DisplayName("Should convert SDK failures into CredentialFetchException")
  void shouldConvertSdkFailures() {
    when(utilities.generateAuthenticationToken(any(GenerateAuthenticationTokenRequest.class)))
        .thenThrow(SdkClientException.create("no credentials in chain"));

    final var ex =
        assertThrows(CredentialFetchException.class, () -> tokenSource.fetch("db:5432"));
    assertEquals("db:5432", ex.scope());
    assertInstanceOf(SdkClientException.class, ex.getCause());
  }
}
