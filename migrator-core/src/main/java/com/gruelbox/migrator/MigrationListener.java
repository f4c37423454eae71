package com.gruelbox.migrator;

import java.util.List;

/**
 * A listener for events fired by {@link Migrator}. All methods default to no-ops. Exceptions thrown
 * by a listener are logged and otherwise ignored, so cannot change the outcome of a command.
 */
public interface MigrationListener {

  MigrationListener EMPTY = new MigrationListener() {};

  /**
   * Fired before a non-empty up sequence is applied.
   *
   * @param migrations The migrations about to be applied, in application order.
   */
  default void upStarted(List<Migration> migrations) {
    // No-op
  }

  /**
   * Fired after a migration has been applied and recorded as completed.
   *
   * @param migration The migration.
   */
  default void migratedUp(Migration migration) {
    // No-op
  }

  /**
   * Fired when the store reports that a migration could not be applied. No further migrations in
   * the sequence will be applied.
   *
   * @param migration The migration which failed.
   */
  default void upFailed(Migration migration) {
    // No-op
  }

  /**
   * Fired before a non-empty down sequence is applied.
   *
   * @param migrations The migrations about to be reverted, in application order.
   */
  default void downStarted(List<Migration> migrations) {
    // No-op
  }

  /**
   * Fired after a migration has been reverted.
   *
   * @param migration The migration.
   */
  default void migratedDown(Migration migration) {
    // No-op
  }

  /**
   * Chains this listener with another and returns the result.
   *
   * @param other The other listener. It will always be called after this one.
   * @return The combined listener.
   */
  default MigrationListener andThen(MigrationListener other) {
    var self = this;
    return new MigrationListener() {

      @Override
      public void upStarted(List<Migration> migrations) {
        self.upStarted(migrations);
        other.upStarted(migrations);
      }

      @Override
      public void migratedUp(Migration migration) {
        self.migratedUp(migration);
        other.migratedUp(migration);
      }

      @Override
      public void upFailed(Migration migration) {
        self.upFailed(migration);
        other.upFailed(migration);
      }

      @Override
      public void downStarted(List<Migration> migrations) {
        self.downStarted(migrations);
        other.downStarted(migrations);
      }

      @Override
      public void migratedDown(Migration migration) {
        self.migratedDown(migration);
        other.migratedDown(migration);
      }
    };
  }
}
