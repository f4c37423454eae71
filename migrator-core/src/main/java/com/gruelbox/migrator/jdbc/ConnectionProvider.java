package com.gruelbox.migrator.jdbc;

import java.sql.Connection;

/** Source for JDBC connections used by a {@link JdbcStore}. */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Requests a new connection, or an available connection from a pool. The caller is responsible
   * for calling {@link Connection#close()}.
   *
   * @return The connection.
   */
  Connection obtainConnection();
}
