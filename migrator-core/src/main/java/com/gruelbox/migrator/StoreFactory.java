package com.gruelbox.migrator;

/** Creates a {@link Store} from configuration. Registered by name in a {@link StoreRegistry}. */
@FunctionalInterface
public interface StoreFactory {

  Store create(MigratorConfig config);
}
