package com.gruelbox.migrator.jdbc;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsStringIgnoringCase;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.gruelbox.migrator.Migration;
import com.gruelbox.migrator.MigrationResult;
import com.gruelbox.migrator.Migrator;
import com.gruelbox.migrator.MigratorConfig;
import com.gruelbox.migrator.StoreRegistry;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.BatchUpdateException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@Slf4j
class TestJdbcStoreH2 {

  private static final Migration USERS =
      new Migration(
          20240101000000L,
          "create-users",
          "CREATE TABLE users (id INT PRIMARY KEY, name VARCHAR(100))",
          "DROP TABLE users");
  private static final Migration SEED =
      new Migration(
          20240102000000L,
          "seed-users",
          "INSERT INTO users VALUES (1, 'alice')\n--;;\nINSERT INTO users VALUES (2, 'bob')",
          "DELETE FROM users WHERE id IN (1, 2)");
  private static final Migration BROKEN =
      new Migration(20240103000000L, "broken", "CREATE TABLE", "");
  private static final Migration ORDERS =
      new Migration(
          20240104000000L,
          "create-orders",
          "CREATE TABLE orders (id INT PRIMARY KEY)",
          "DROP TABLE orders");

  private HikariDataSource dataSource;
  private final Migrator migrator = Migrator.builder().build();

  @BeforeEach
  void beforeEach() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setUsername("test");
    config.setPassword("test");
    dataSource = new HikariDataSource(config);
  }

  @AfterEach
  void afterEach() {
    dataSource.close();
  }

  @Test
  void migrateRunsScriptsAndRecordsCompletion() throws SQLException {
    MigrationResult result = migrator.migrate(config(USERS, SEED));

    assertTrue(result.isSuccess());
    assertThat(completedIds("schema_migrations"), contains(USERS.getId(), SEED.getId()));
    assertThat(queryLong("SELECT COUNT(*) FROM users"), equalTo(2L));
    assertThat(
        queryString("SELECT description FROM schema_migrations WHERE id = " + SEED.getId()),
        equalTo("seed-users"));
  }

  @Test
  void failedScriptStopsTheRunAndIsNotRecorded() throws SQLException {
    MigrationResult result = migrator.migrate(config(USERS, BROKEN, ORDERS));

    assertFalse(result.isSuccess());
    assertThat(result.getFailure(), equalTo(BROKEN));
    assertThat(completedIds("schema_migrations"), contains(USERS.getId()));
    assertFalse(tableExists("ORDERS"));
  }

  @Test
  void failedDataScriptIsRolledBack() throws SQLException {
    Migration duplicate =
        new Migration(
            20240105000000L,
            "duplicate",
            "INSERT INTO users VALUES (3, 'carol')\n--;;\nINSERT INTO users VALUES (1, 'again')",
            "");

    MigrationResult result = migrator.migrate(config(USERS, SEED, duplicate));

    assertThat(result.getFailure(), equalTo(duplicate));
    assertThat(queryLong("SELECT COUNT(*) FROM users WHERE id = 3"), equalTo(0L));
    assertThat(completedIds("schema_migrations"), contains(USERS.getId(), SEED.getId()));
  }

  @Test
  void rollbackRevertsLatest() throws SQLException {
    MigratorConfig config = config(USERS, ORDERS);
    migrator.migrate(config);

    MigrationResult result = migrator.rollback(config);

    assertThat(result.getReverted(), contains(ORDERS));
    assertFalse(tableExists("ORDERS"));
    assertTrue(tableExists("USERS"));
    assertThat(completedIds("schema_migrations"), contains(USERS.getId()));
  }

  @Test
  void resetLeavesSchemaAsItWas() throws SQLException {
    MigratorConfig config = config(USERS, SEED, ORDERS);
    migrator.migrate(config);

    MigrationResult result = migrator.reset(config);

    assertThat(result.getReverted(), contains(ORDERS, SEED, USERS));
    assertThat(result.getApplied(), contains(USERS, SEED, ORDERS));
    assertThat(queryLong("SELECT COUNT(*) FROM users"), equalTo(2L));
    assertThat(
        completedIds("schema_migrations"), contains(USERS.getId(), SEED.getId(), ORDERS.getId()));
  }

  @Test
  void downFailurePropagatesAndKeepsRecord() throws SQLException {
    Migration badDown =
        new Migration(
            20240106000000L,
            "bad-down",
            "CREATE TABLE temp (id INT)",
            "DELETE FROM temp\n--;;\nDELETE FROM no_such_table");
    MigratorConfig config = config(USERS, badDown);
    migrator.migrate(config);

    SQLException thrown =
        assertThrows(
            SQLException.class, () -> migrator.down(config, badDown.getId(), USERS.getId()));

    assertThat(thrown, not(instanceOf(BatchUpdateException.class)));
    assertThat(thrown.getMessage(), containsStringIgnoringCase("no_such_table"));

    assertThat(completedIds("schema_migrations"), contains(USERS.getId(), badDown.getId()));
  }

  @Test
  void failedBatchLogsTheStatementFailure() {
    Migration badBatch =
        new Migration(
            20240107000000L,
            "bad-batch",
            "CREATE TABLE temp (id INT)\n--;;\nINSERT INTO no_such_table VALUES (1)",
            "");
    Logger logger = (Logger) LoggerFactory.getLogger(JdbcStore.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      MigrationResult result = migrator.migrate(config(badBatch));

      assertThat(result.getFailure(), equalTo(badBatch));
      List<ILoggingEvent> errors =
          appender.list.stream()
              .filter(event -> event.getLevel() == Level.ERROR)
              .collect(Collectors.toList());
      assertThat(errors, hasSize(1));
      assertThat(
          errors.get(0).getThrowableProxy().getClassName(),
          not(equalTo(BatchUpdateException.class.getName())));
      assertThat(
          errors.get(0).getThrowableProxy().getMessage(),
          containsStringIgnoringCase("no_such_table"));
    } finally {
      logger.detachAppender(appender);
    }
  }

  @Test
  void pendingListReadsCompletedTable() {
    MigratorConfig config = config(USERS, SEED, ORDERS);
    migrator.up(config, USERS.getId());

    assertThat(
        migrator.pendingList(config),
        equalTo("You have 2 pending migrations:\nseed-users\ncreate-orders"));
  }

  @Test
  void customTableName() throws SQLException {
    MigratorConfig config = config(USERS).toBuilder().migrationTableName("applied_changes").build();

    migrator.migrate(config);

    assertThat(completedIds("applied_changes"), contains(USERS.getId()));
  }

  @Test
  void initRunsScriptInTransaction() throws SQLException {
    MigratorConfig config =
        config()
            .toBuilder()
            .initScript(
                "CREATE TABLE settings (k VARCHAR(10))\n--;;\nINSERT INTO settings VALUES ('x')")
            .build();

    migrator.init(config);

    assertThat(queryLong("SELECT COUNT(*) FROM settings"), equalTo(1L));
  }

  @Test
  void initRunsScriptWithoutTransaction() throws SQLException {
    MigratorConfig config =
        config()
            .toBuilder()
            .initScript("CREATE TABLE settings (k VARCHAR(10))")
            .initInTransaction(false)
            .build();

    migrator.init(config);

    assertTrue(tableExists("SETTINGS"));
  }

  @Test
  void initWithoutScriptDoesNothing() throws SQLException {
    migrator.init(config());

    assertFalse(tableExists("SCHEMA_MIGRATIONS"));
  }

  @Test
  void createAndDestroyAreUnsupported() {
    MigratorConfig config = config(USERS);

    assertThrows(UnsupportedOperationException.class, () -> migrator.create(config, "new"));
    assertThrows(UnsupportedOperationException.class, () -> migrator.destroy(config, "new"));
  }

  @Test
  void duplicateIdsAreRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            JdbcStore.builder()
                .connectionProvider(
                    DataSourceConnectionProvider.builder().dataSource(dataSource).build())
                .migration(USERS)
                .migration(new Migration(USERS.getId(), "other", "", ""))
                .build());
  }

  @Test
  void badTableNameIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            migrator.migrate(
                config(USERS).toBuilder().migrationTableName("x; DROP TABLE y").build()));
  }

  @Test
  void connectsThroughDriverManager() throws SQLException {
    String url = "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
    MigratorConfig config =
        MigratorConfig.builder()
            .store(StoreRegistry.DATABASE)
            .driverClassName("org.h2.Driver")
            .jdbcUrl(url)
            .user("test")
            .password("test")
            .migration(USERS)
            .build();

    MigrationResult result = migrator.migrate(config);

    assertThat(result.getApplied(), contains(USERS));
    assertThat(migrator.pendingList(config), equalTo("You have 0 pending migrations:\n"));
  }

  @Test
  void noMigrationsMeansNothingPending() {
    assertThat(migrator.migrate(config()).getApplied(), empty());
  }

  private MigratorConfig config(Migration... migrations) {
    return MigratorConfig.builder()
        .store(StoreRegistry.DATABASE)
        .dataSource(dataSource)
        .migrations(List.of(migrations))
        .build();
  }

  private List<Long> completedIds(String table) throws SQLException {
    List<Long> result = new ArrayList<>();
    try (Connection c = dataSource.getConnection();
        Statement s = c.createStatement();
        ResultSet rs = s.executeQuery("SELECT id FROM " + table + " ORDER BY id")) {
      while (rs.next()) {
        result.add(rs.getLong(1));
      }
    }
    return result;
  }

  private long queryLong(String sql) throws SQLException {
    try (Connection c = dataSource.getConnection();
        Statement s = c.createStatement();
        ResultSet rs = s.executeQuery(sql)) {
      assertTrue(rs.next());
      return rs.getLong(1);
    }
  }

  private String queryString(String sql) throws SQLException {
    try (Connection c = dataSource.getConnection();
        Statement s = c.createStatement();
        ResultSet rs = s.executeQuery(sql)) {
      assertTrue(rs.next());
      return rs.getString(1);
    }
  }

  private boolean tableExists(String name) throws SQLException {
    try (Connection c = dataSource.getConnection();
        ResultSet rs = c.getMetaData().getTables(null, null, name, null)) {
      boolean exists = rs.next();
      log.debug("Table {} exists: {}", name, exists);
      return exists;
    }
  }
}
