package com.example.tokendatasource.core.jdbc;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/** The raw driver call that opens a physical connection. */
@FunctionalInterface
public interface ConnectionOpener {

  Connection open(final String url, final Properties properties) throws SQLException;

  static ConnectionOpener driverManager() {
    return DriverManager::getConnection;
  }
}
