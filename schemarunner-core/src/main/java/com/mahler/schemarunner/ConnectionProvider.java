package com.mahler.schemarunner;

import java.sql.Connection;
import javax.sql.DataSource;

/** Source of JDBC connections to the database being migrated. */
public interface ConnectionProvider {

  /**
   * Requests a new connection, or an available connection from a pool. The caller is responsible
   * for calling {@link Connection#close()}.
   *
   * @return The connection.
   */
  Connection obtainConnection();

  /**
   * @param url The JDBC URL.
   * @param user The user name, or null if the driver needs none.
   * @param password The password, or null if the driver needs none.
   * @return A provider opening a fresh connection through {@link java.sql.DriverManager} each time.
   */
  static ConnectionProvider fromConnectionDetails(String url, String user, String password) {
    return DriverConnectionProvider.builder().url(url).user(user).password(password).build();
  }

  /**
   * @param dataSource The data source, pooled or otherwise.
   * @return A provider borrowing connections from {@code dataSource}.
   */
  static ConnectionProvider fromDataSource(DataSource dataSource) {
    return DataSourceConnectionProvider.builder().dataSource(dataSource).build();
  }
}
