package com.gruelbox.migrator.jdbc;

import static com.gruelbox.migrator.Utils.uncheckedly;

import com.gruelbox.migrator.Validatable;
import com.gruelbox.migrator.Validator;
import java.sql.Connection;
import java.sql.DriverManager;
import lombok.Builder;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link ConnectionProvider} which requests connections directly from {@link DriverManager}.
 * Fine for a one-off migration run, where there is no point standing up a pool.
 *
 * <p>Usage:
 *
 * <pre>ConnectionProvider provider = DriverConnectionProvider.builder()
 *   .driverClassName("org.postgresql.Driver")
 *   .url(myJdbcUrl)
 *   .user("myusername")
 *   .password("mypassword")
 *   .build()</pre>
 */
@Builder
@Slf4j
@ToString(exclude = "password")
public final class DriverConnectionProvider implements ConnectionProvider, Validatable {

  private final String driverClassName;
  private final String url;
  private final String user;
  private final String password;
  private volatile boolean initialized;

  @Override
  public void validate(Validator validator) {
    validator.notBlank("url", url);
  }

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
          return DriverManager.getConnection(url, user, password);
        });
  }
}
