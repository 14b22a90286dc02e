package com.example.tokendatasource.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.example.tokendatasource.core.credentials.CredentialFetchException;
import com.example.tokendatasource.core.credentials.PasswordProvider;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class TokenConnectionFactoryTest {

  private final ConnectionSettings settings =
      ConnectionSettings.builder()
          .host("db.example.com")
          .database("app")
          .username("app_user")
          .property("sslmode", "require")
          .build();

  private ConnectionOpener opener;
  private Connection connection;
  private List<Properties> opened;

  @BeforeEach
  void setUp() throws SQLException {
    connection = mock(Connection.class);
    opened = new ArrayList<>();
    opener =
        (url, props) -> {
          opened.add(props);
          return connection;
        };
  }

  private TokenConnectionFactory factory(final PasswordProvider passwords) {
    return TokenConnectionFactory.builder()
        .name("orm")
        .settings(settings)
        .passwordProvider(passwords)
        .opener(opener)
        .build();
  }

  @Nested
  @DisplayName("Password Injection")
  class PasswordInjection {

    @Test
    @DisplayName("Should read the password at connection time, not at construction")
    void shouldReadPasswordAtConnectionTime() throws SQLException {
      final var current = new AtomicReference<>("A");
      final var factory = factory(current::get);

      factory.getConnection();
      current.set("B");
      factory.getConnection();

      assertEquals("A", opened.get(0).getProperty("password"));
      assertEquals("B", opened.get(1).getProperty("password"));
      assertEquals("app_user", opened.get(1).getProperty("user"));
      assertEquals("require", opened.get(1).getProperty("sslmode"));
    }

    @Test
    @DisplayName("Should open the configured URL")
    void shouldOpenConfiguredUrl() throws SQLException {
      final var mockOpener = mock(ConnectionOpener.class);
      when(mockOpener.open(anyString(), any())).thenReturn(connection);

      TokenConnectionFactory.builder()
          .settings(settings)
          .passwordProvider(PasswordProvider.fixed("pw"))
          .opener(mockOpener)
          .build()
          .getConnection();

      verify(mockOpener).open(eq("jdbc:postgresql://db.example.com:5432/app"), any());
    }

    @Test
    @DisplayName("Should surface a missing credential as a transient connection error")
    void shouldSurfaceMissingCredential() {
      final var factory =
          factory(
              () -> {
                throw new CredentialFetchException("db.example.com:5432", "unreachable");
              });

      final var ex = assertThrows(SQLTransientConnectionException.class, factory::getConnection);
      assertEquals("08001", ex.getSQLState());
      assertInstanceOf(CredentialFetchException.class, ex.getCause());
      assertTrue(opened.isEmpty());
    }
  }

  @Nested
  @DisplayName("Failure Handling")
  class FailureHandling {

    @Test
    @DisplayName("Should wrap authentication rejections without retrying")
    void shouldWrapAuthRejectionsWithoutRetrying() throws SQLException {
      final var mockOpener = mock(ConnectionOpener.class);
      when(mockOpener.open(anyString(), any()))
          .thenThrow(new SQLException("password authentication failed for user", "28P01"));
      final var factory =
          TokenConnectionFactory.builder()
              .name("jobs")
              .settings(settings)
              .passwordProvider(PasswordProvider.fixed("stale"))
              .opener(mockOpener)
              .build();

      final var ex = assertThrows(ConnectionAuthException.class, factory::getConnection);

      assertEquals("28P01", ex.getSQLState());
      assertTrue(ex.getMessage().contains("jobs"));
      verify(mockOpener, times(1)).open(anyString(), any());
    }

    @Test
    @DisplayName("Should propagate non-auth errors unchanged")
    void shouldPropagateNonAuthErrors() {
      final var refused = new SQLException("Connection refused", "08001");
      final var factory =
          TokenConnectionFactory.builder()
              .settings(settings)
              .passwordProvider(PasswordProvider.fixed("pw"))
              .opener(
                  (url, props) -> {
                    throw refused;
                  })
              .build();

      assertSame(refused, assertThrows(SQLException.class, factory::getConnection));
    }

    @Test
    @DisplayName("Should close the connection when the setup hook fails")
    void shouldCloseConnectionWhenHookFails() throws SQLException {
      doThrow(new SQLException("close failed")).when(connection).close();
      final var factory =
          TokenConnectionFactory.builder()
              .settings(settings)
              .passwordProvider(PasswordProvider.fixed("pw"))
              .opener(opener)
              .setupHook(
                  conn -> {
                    throw new SQLException("SET failed");
                  })
              .build();

      final var ex = assertThrows(SQLException.class, factory::getConnection);

      assertEquals("SET failed", ex.getMessage());
      assertEquals("close failed", ex.getSuppressed()[0].getMessage());
      verify(connection).close();
    }
  }

  @Nested
  @DisplayName("Setup Hook")
  class SetupHook {

    @Test
    @DisplayName("Should apply hooks in order before returning the connection")
    void shouldApplyHooksInOrder() throws SQLException {
      final var calls = new ArrayList<String>();
      final var factory =
          TokenConnectionFactory.builder()
              .settings(settings)
              .passwordProvider(PasswordProvider.fixed("pw"))
              .opener(opener)
              .setupHook(
                  ((ConnectionSetupHook) conn -> calls.add("first"))
                      .andThen(conn -> calls.add("second")))
              .build();

      assertSame(connection, factory.getConnection());
      assertEquals(List.of("first", "second"), calls);
    }

    @Test
    @DisplayName("Should execute SQL through the statement hook")
    void shouldExecuteSqlHook() throws SQLException {
      final var statement = mock(java.sql.Statement.class);
      when(connection.createStatement()).thenReturn(statement);

      ConnectionSetupHook.execute("SET application_name = 'jobs'").apply(connection);

      verify(statement).execute("SET application_name = 'jobs'");
      verify(statement).close();
    }
  }

  @Test
  @DisplayName("Should require settings and a password provider")
  void shouldRequireSettingsAndPasswordProvider() {
    assertThrows(
        IllegalStateException.class,
        () -> TokenConnectionFactory.builder().passwordProvider(() -> "pw").build());
    assertThrows(
        IllegalStateException.class,
        () -> TokenConnectionFactory.builder().settings(settings).build());
  }
}
