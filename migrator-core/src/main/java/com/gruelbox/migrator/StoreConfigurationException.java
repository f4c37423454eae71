package com.gruelbox.migrator;

/**
 * Thrown when no {@link Store} can be resolved from a {@link MigratorConfig}, either because no
 * store type was given or because the {@link StoreRegistry} has nothing registered under it. Always
 * raised before any connection is attempted.
 */
public class StoreConfigurationException extends RuntimeException {

  public StoreConfigurationException(String message) {
    super(message);
  }
}
