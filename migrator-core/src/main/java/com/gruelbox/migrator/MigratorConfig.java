package com.gruelbox.migrator;

import java.util.List;
import javax.sql.DataSource;
import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

/**
 * Configuration for a single {@link Migrator} command. The migrator itself only reads {@link
 * #getStore()}, which selects the {@link StoreFactory} from the {@link StoreRegistry}; everything
 * else is interpreted by the store.
 *
 * <p>Usage:
 *
 * <pre>MigratorConfig config = MigratorConfig.builder()
 *   .store(StoreRegistry.DATABASE)
 *   .dataSource(dataSource)
 *   .migration(new Migration(20240101120000L, "create-users", createSql, dropSql))
 *   .build();</pre>
 */
@Value
@Builder(toBuilder = true)
@ToString(exclude = "password")
public class MigratorConfig {

  /** The store type name, as registered in the {@link StoreRegistry}. Required. */
  String store;

  /** The migration inventory, for stores which are given their migrations programmatically. */
  @Singular List<Migration> migrations;

  /** Pooled JDBC connections. Takes precedence over {@link #getJdbcUrl()}. */
  DataSource dataSource;

  /** JDBC driver class, used with {@link #getJdbcUrl()}. Optional for JDBC 4 drivers. */
  String driverClassName;

  /** JDBC URL, used to connect via {@link java.sql.DriverManager} if no data source is given. */
  String jdbcUrl;

  String user;

  String password;

  /** The table recording completed migration ids. */
  @Builder.Default String migrationTableName = "schema_migrations";

  /** Script run by {@link Migrator#init(MigratorConfig)}. */
  String initScript;

  /** Whether {@link #getInitScript()} is run in a single transaction. */
  @Builder.Default boolean initInTransaction = true;
}
