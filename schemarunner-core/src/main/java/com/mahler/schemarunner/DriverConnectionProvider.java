package com.mahler.schemarunner;

import static com.mahler.schemarunner.Utils.uncheckedly;

import java.sql.Connection;
import java.sql.DriverManager;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link ConnectionProvider} which requests connections directly from {@link DriverManager}. A
 * migration run holds a single connection for its whole duration, so there is nothing to gain from
 * pooling here.
 *
 * <p>Usage:
 *
 * <pre>ConnectionProvider provider = DriverConnectionProvider.builder()
 *   .url("jdbc:sqlite:/var/lib/mahler/mahler.db")
 *   .build()</pre>
 */
@Builder
@Slf4j
final class DriverConnectionProvider implements ConnectionProvider {

  /** Optional. Only needed for drivers which do not register themselves. */
  private final String driverClassName;

  private final String url;

  private final String user;

  private final String password;

  private volatile boolean initialized;

  @Override
  public Connection obtainConnection() {
    return uncheckedly(
        () -> {
          if (!initialized && driverClassName != null) {
            synchronized (this) {
              log.debug("Initialising {}", driverClassName);
              Class.forName(driverClassName);
              initialized = true;
            }
          }
          log.debug("Opening connection to {}", url);
          if (user == null) {
            return DriverManager.getConnection(url);
          }
          return DriverManager.getConnection(url, user, password);
        });
  }
}
