package com.gruelbox.migrator;

import java.util.Collection;
import lombok.ToString;

/**
 * Brings a data store's schema up and down by applying {@link Migration}s through a {@link Store}.
 *
 * <p>The migrator holds no state of its own between commands. Which migrations have been applied
 * is read from the store at the start of every command, so the store's completed record is the
 * single source of truth. Commands are strictly sequential; nothing prevents two processes from
 * running commands against the same store at once, so callers must arrange that themselves.
 *
 * <p>Usage:
 *
 * <pre>Migrator migrator = Migrator.builder().build();
 * MigrationResult result = migrator.migrate(config);
 * if (!result.isSuccess()) {
 *   // result.getFailure() failed to apply
 * }</pre>
 *
 * <p>Exceptions raised by the store propagate from every command unwrapped, checked or not.
 */
public interface Migrator {

  /**
   * @return A builder for creating a new instance of {@link Migrator}.
   */
  static MigratorBuilder builder() {
    return MigratorImpl.builder();
  }

  /**
   * Brings up every migration which is not yet completed, in ascending id order.
   *
   * <p>If a migration fails, the remaining migrations are not applied and the returned result
   * identifies the failed migration. No exception is thrown in that case.
   *
   * @param config The configuration.
   * @return The outcome.
   */
  MigrationResult migrate(MigratorConfig config);

  /**
   * Brings up the identified migrations, in ascending id order. Any which are already complete, or
   * which the store does not know about, are skipped.
   *
   * @param config The configuration.
   * @param ids The migration ids.
   * @return The outcome.
   */
  MigrationResult up(MigratorConfig config, Collection<Long> ids);

  /**
   * @see #up(MigratorConfig, Collection)
   * @param config The configuration.
   * @param ids The migration ids.
   * @return The outcome.
   */
  default MigrationResult up(MigratorConfig config, long... ids) {
    return up(config, MigratorImpl.boxed(ids));
  }

  /**
   * Brings down the identified migrations, in descending id order. Any which are not complete are
   * skipped. A failure aborts the remaining migrations and propagates.
   *
   * @param config The configuration.
   * @param ids The migration ids.
   * @return The outcome.
   */
  MigrationResult down(MigratorConfig config, Collection<Long> ids);

  /**
   * @see #down(MigratorConfig, Collection)
   * @param config The configuration.
   * @param ids The migration ids.
   * @return The outcome.
   */
  default MigrationResult down(MigratorConfig config, long... ids) {
    return down(config, MigratorImpl.boxed(ids));
  }

  /**
   * Brings down the completed migration with the highest id. Does nothing if no migrations are
   * complete.
   *
   * @param config The configuration.
   * @return The outcome.
   */
  MigrationResult rollback(MigratorConfig config);

  /**
   * Brings down every completed migration, then runs {@link #migrate(MigratorConfig)}. Always
   * reapplies, even if nothing was brought down.
   *
   * @param config The configuration.
   * @return The combined outcome of both phases.
   */
  MigrationResult reset(MigratorConfig config);

  /**
   * Brings up every uncompleted migration with an id lower than {@code migrationId}. Useful for
   * positioning a schema just before a migration in order to test it against fixture data. Never
   * brings anything down.
   *
   * @param config The configuration.
   * @param migrationId The id of the first migration not to apply.
   * @return The outcome.
   */
  MigrationResult migrateUntilJustBefore(MigratorConfig config, long migrationId);

  /**
   * Describes the migrations not yet completed. Changes nothing.
   *
   * @param config The configuration.
   * @return A report of the form {@code You have 2 pending migrations:\nfirst\nsecond}.
   */
  String pendingList(MigratorConfig config);

  /**
   * Bootstraps the data store. See {@link Store#init()}.
   *
   * @param config The configuration.
   */
  void init(MigratorConfig config);

  /**
   * Creates a new migration. See {@link Store#create(String)}.
   *
   * @param config The configuration.
   * @param name The migration name. May be null.
   */
  void create(MigratorConfig config, String name);

  default void create(MigratorConfig config) {
    create(config, null);
  }

  /**
   * Removes a migration. See {@link Store#destroy(String)}.
   *
   * @param config The configuration.
   * @param name The migration name. May be null.
   */
  void destroy(MigratorConfig config, String name);

  default void destroy(MigratorConfig config) {
    destroy(config, null);
  }

  /** Builder for {@link Migrator}. */
  @ToString
  abstract class MigratorBuilder {

    protected StoreRegistry registry;
    protected MigrationListener listener;

    protected MigratorBuilder() {}

    /**
     * @param registry Resolves {@link MigratorConfig#getStore()} to a {@link Store}. Defaults to
     *     {@link StoreRegistry#defaults()}.
     * @return Builder.
     */
    public MigratorBuilder registry(StoreRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * @param listener Event listener. Defaults to {@link MigrationListener#EMPTY}.
     * @return Builder.
     */
    public MigratorBuilder listener(MigrationListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Creates and validates a new instance.
     *
     * @return The migrator.
     */
    public abstract Migrator build();
  }
}
