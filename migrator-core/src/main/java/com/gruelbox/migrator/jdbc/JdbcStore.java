package com.gruelbox.migrator.jdbc;

import com.gruelbox.migrator.Migration;
import com.gruelbox.migrator.MigratorConfig;
import com.gruelbox.migrator.Store;
import com.gruelbox.migrator.Utils;
import com.gruelbox.migrator.Validatable;
import com.gruelbox.migrator.Validator;
import java.sql.BatchUpdateException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link Store} backed by a relational database over JDBC.
 *
 * <p>Completed migration ids are recorded in a table, by default called {@code
 * schema_migrations}, which is created on {@link #connect()} if it doesn't exist. Migrations are
 * given up-front rather than discovered, and their scripts are run as SQL. A script may contain
 * several statements separated by {@value SqlScripts#SEPARATOR} on its own line, in which case they
 * are sent as a single JDBC batch.
 *
 * <p>Each migration runs in its own transaction together with the update to the completed
 * record. On databases where DDL commits implicitly, a failed multi-statement script may leave
 * some of its statements applied.
 */
@Slf4j
public final class JdbcStore implements Store, Validatable {

  private final ConnectionProvider connectionProvider;
  private final String tableName;
  private final List<Migration> migrations;
  private final String initScript;
  private final boolean initInTransaction;
  private final Clock clock;
  private Connection connection;

  /**
   * @param connectionProvider Source of connections. Required.
   * @param tableName The completed record table. Defaults to {@code schema_migrations}.
   * @param migrations The migration inventory.
   * @param initScript Run by {@link #init()}. Optional.
   * @param initInTransaction Whether the init script is run in one transaction. Defaults to
   *     true.
   * @param clock Used to timestamp completed records. Defaults to the system UTC clock.
   */
  @Builder
  JdbcStore(
      ConnectionProvider connectionProvider,
      String tableName,
      @Singular List<Migration> migrations,
      String initScript,
      Boolean initInTransaction,
      Clock clock) {
    this.connectionProvider = connectionProvider;
    this.tableName = tableName == null ? "schema_migrations" : tableName;
    this.migrations = List.copyOf(migrations);
    this.initScript = initScript;
    this.initInTransaction = initInTransaction == null || initInTransaction;
    this.clock = clock == null ? Clock.systemUTC() : clock;
    new Validator().validate(this);
  }

  /**
   * Creates a store from configuration. Registered as {@code database} in {@link
   * com.gruelbox.migrator.StoreRegistry#defaults()}.
   *
   * @param config The configuration.
   * @return The store.
   */
  public static JdbcStore forConfig(MigratorConfig config) {
    ConnectionProvider provider;
    if (config.getDataSource() != null) {
      provider = DataSourceConnectionProvider.builder().dataSource(config.getDataSource()).build();
    } else {
      DriverConnectionProvider driverProvider =
          DriverConnectionProvider.builder()
              .driverClassName(config.getDriverClassName())
              .url(config.getJdbcUrl())
              .user(config.getUser())
              .password(config.getPassword())
              .build();
      new Validator().validate(driverProvider);
      provider = driverProvider;
    }
    return JdbcStore.builder()
        .connectionProvider(provider)
        .tableName(config.getMigrationTableName())
        .migrations(config.getMigrations())
        .initScript(config.getInitScript())
        .initInTransaction(config.isInitInTransaction())
        .build();
  }

  @Override
  public void validate(Validator validator) {
    validator.notNull("connectionProvider", connectionProvider);
    validator.sqlIdentifier("tableName", tableName);
    validator.isTrue(
        "migrations",
        migrations.stream().map(Migration::getId).distinct().count() == migrations.size(),
        "may not contain duplicate ids");
  }

  @Override
  public void connect() throws SQLException {
    if (connection != null) {
      throw new IllegalStateException("Already connected");
    }
    connection = connectionProvider.obtainConnection();
    log.debug("Connected");
    createTableIfNotExists(connection);
  }

  @Override
  public void disconnect() throws SQLException {
    if (connection == null) {
      return;
    }
    try {
      connection.close();
      log.debug("Disconnected");
    } finally {
      connection = null;
    }
  }

  @Override
  public Collection<Migration> migrations() {
    return migrations;
  }

  @Override
  public Set<Long> completedIds() throws SQLException {
    Set<Long> result = new HashSet<>();
    try (Statement s = connection().createStatement();
        ResultSet rs = s.executeQuery("SELECT id FROM " + tableName)) {
      while (rs.next()) {
        result.add(rs.getLong(1));
      }
    }
    return result;
  }

  @Override
  public boolean applyUp(Migration migration) throws SQLException {
    Connection c = connection();
    boolean autoCommit = c.getAutoCommit();
    c.setAutoCommit(false);
    try {
      try {
        execute(c, migration.getUp());
      } catch (SQLException e) {
        log.error("Migration {} failed to apply", migration.displayName(), actionable(e));
        c.rollback();
        return false;
      }
      markCompleted(c, migration);
      c.commit();
      return true;
    } catch (SQLException | RuntimeException e) {
      Utils.safelyRun("rolling back", c::rollback);
      throw e;
    } finally {
      c.setAutoCommit(autoCommit);
    }
  }

  @Override
  public void applyDown(Migration migration) throws SQLException {
    Connection c = connection();
    boolean autoCommit = c.getAutoCommit();
    c.setAutoCommit(false);
    try {
      execute(c, migration.getDown());
      markReverted(c, migration);
      c.commit();
    } catch (SQLException | RuntimeException e) {
      Utils.safelyRun("rolling back", c::rollback);
      throw e;
    } finally {
      c.setAutoCommit(autoCommit);
    }
  }

  @Override
  public void init() throws SQLException {
    List<String> statements = SqlScripts.statements(initScript);
    if (statements.isEmpty()) {
      log.warn("No init script configured, nothing to do");
      return;
    }
    try (Connection c = connectionProvider.obtainConnection()) {
      if (!initInTransaction) {
        log.info("Running init script");
        for (String statement : statements) {
          try (Statement s = c.createStatement()) {
            s.execute(statement);
          }
        }
        return;
      }
      log.info("Running init script in a transaction");
      c.setAutoCommit(false);
      try {
        execute(c, initScript);
        c.commit();
      } catch (SQLException | RuntimeException e) {
        Utils.safelyRun("rolling back", c::rollback);
        throw e;
      }
    }
  }

  @Override
  public void create(String name) {
    throw new UnsupportedOperationException(
        "JdbcStore takes its migrations from configuration and cannot create " + name);
  }

  @Override
  public void destroy(String name) {
    throw new UnsupportedOperationException(
        "JdbcStore takes its migrations from configuration and cannot destroy " + name);
  }

  private Connection connection() {
    if (connection == null) {
      throw new IllegalStateException("Not connected");
    }
    return connection;
  }

  private void createTableIfNotExists(Connection c) throws SQLException {
    try (Statement s = c.createStatement()) {
      s.execute(
          "CREATE TABLE IF NOT EXISTS "
              + tableName
              + " (id BIGINT PRIMARY KEY, applied TIMESTAMP, description VARCHAR(1024))");
    }
    if (!c.getAutoCommit()) {
      c.commit();
    }
  }

  private void execute(Connection c, String script) throws SQLException {
    List<String> statements = SqlScripts.statements(script);
    if (statements.isEmpty()) {
      return;
    }
    try (Statement s = c.createStatement()) {
      if (statements.size() == 1) {
        s.execute(statements.get(0));
      } else {
        for (String statement : statements) {
          s.addBatch(statement);
        }
        s.executeBatch();
      }
    }
  }

  /**
   * @return The statement failure chained behind a batch failure, otherwise the exception itself.
   */
  static SQLException actionable(SQLException e) {
    if (e instanceof BatchUpdateException && e.getNextException() != null) {
      return e.getNextException();
    }
    return e;
  }

  private void markCompleted(Connection c, Migration migration) throws SQLException {
    try (PreparedStatement s =
        c.prepareStatement(
            "INSERT INTO " + tableName + " (id, applied, description) VALUES (?, ?, ?)")) {
      s.setLong(1, migration.getId());
      s.setTimestamp(2, Timestamp.from(clock.instant()));
      s.setString(3, migration.getName());
      s.executeUpdate();
    }
  }

  private void markReverted(Connection c, Migration migration) throws SQLException {
    try (PreparedStatement s = c.prepareStatement("DELETE FROM " + tableName + " WHERE id = ?")) {
      s.setLong(1, migration.getId());
      if (s.executeUpdate() != 1) {
        log.warn("No completed record found for {}", migration.displayName());
      }
    }
  }
}
