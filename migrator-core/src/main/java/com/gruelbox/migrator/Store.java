package com.gruelbox.migrator;

import java.util.Collection;
import java.util.Set;

/**
 * Persistence and execution primitives for migrations. The {@link Migrator} works purely in terms
 * of this interface: it decides <em>which</em> migrations to apply and in what order, while the
 * store knows how to run them and owns the durable record of which have completed.
 *
 * <p>A store instance is connected for exactly one command invocation. All calls between {@link
 * #connect()} and {@link #disconnect()} come from a single thread.
 *
 * <p>Any implementation should be accompanied by a subclass of {@code AbstractStoreTest} from the
 * {@code migrator-testing} module to ensure that it delivers against the contract.
 */
public interface Store {

  /**
   * Opens whatever connection or session the store needs. Called once at the start of an
   * invocation.
   *
   * @throws Exception Any exception.
   */
  void connect() throws Exception;

  /**
   * Releases the connection opened by {@link #connect()}. Called on every exit path, including
   * when the command failed.
   *
   * @throws Exception Any exception.
   */
  void disconnect() throws Exception;

  /**
   * @return All known migrations, in any order.
   * @throws Exception Any exception.
   */
  Collection<Migration> migrations() throws Exception;

  /**
   * @return The ids of all migrations whose up script has completed successfully.
   * @throws Exception Any exception.
   */
  Set<Long> completedIds() throws Exception;

  /**
   * Runs the up script of a migration and, if it succeeds, records the migration as completed
   * before returning.
   *
   * <p>A failure of the script itself should be reported by returning {@code false} rather than
   * throwing. Exceptions are reserved for the store being unusable.
   *
   * @param migration The migration.
   * @return true if the migration was applied and recorded.
   * @throws Exception If the store failed.
   */
  boolean applyUp(Migration migration) throws Exception;

  /**
   * Runs the down script of a migration and removes it from the completed record.
   *
   * @param migration The migration.
   * @throws Exception Any failure, which aborts the remaining down sequence.
   */
  void applyDown(Migration migration) throws Exception;

  /**
   * Bootstraps the underlying data store. Not bracketed by {@link #connect()}.
   *
   * @throws Exception Any exception.
   */
  void init() throws Exception;

  /**
   * Creates a new, empty migration.
   *
   * @param name The migration name. May be null.
   * @throws Exception Any exception.
   */
  void create(String name) throws Exception;

  /**
   * Removes a migration.
   *
   * @param name The migration name. May be null.
   * @throws Exception Any exception.
   */
  void destroy(String name) throws Exception;
}
