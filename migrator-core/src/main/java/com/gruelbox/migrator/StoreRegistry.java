package com.gruelbox.migrator;

import com.gruelbox.migrator.jdbc.JdbcStore;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Maps the store type named in {@link MigratorConfig#getStore()} to the {@link StoreFactory} which
 * builds it. Instances are immutable; {@link #register(String, StoreFactory)} returns a copy.
 *
 * <p>Usage:
 *
 * <pre>StoreRegistry registry = StoreRegistry.defaults()
 *   .register("memory", config -&gt; myInMemoryStore);</pre>
 */
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class StoreRegistry {

  /** The store type name for {@link JdbcStore}. */
  public static final String DATABASE = "database";

  private final Map<String, StoreFactory> factories;

  /**
   * @return A registry with nothing registered.
   */
  public static StoreRegistry empty() {
    return new StoreRegistry(Map.of());
  }

  /**
   * @return A registry containing the built-in store types: {@value #DATABASE}.
   */
  public static StoreRegistry defaults() {
    return empty().register(DATABASE, JdbcStore::forConfig);
  }

  /**
   * Returns a copy of this registry with an additional store type. Replaces any existing factory
   * with the same name.
   *
   * @param name The store type name.
   * @param factory The factory.
   * @return The new registry.
   */
  public StoreRegistry register(String name, StoreFactory factory) {
    Validator validator = new Validator();
    validator.notBlank("name", name);
    validator.notNull("factory", factory);
    Map<String, StoreFactory> copy = new HashMap<>(factories);
    copy.put(name, factory);
    return new StoreRegistry(Map.copyOf(copy));
  }

  /**
   * @return The registered store type names.
   */
  public Set<String> names() {
    return factories.keySet();
  }

  /**
   * Builds the store selected by the configuration.
   *
   * @param config The configuration.
   * @return The store. Not yet connected.
   * @throws StoreConfigurationException If no store type is configured or it is not registered.
   */
  public Store create(MigratorConfig config) {
    if (config == null || config.getStore() == null || config.getStore().isBlank()) {
      throw new StoreConfigurationException("Store is not configured");
    }
    StoreFactory factory = factories.get(config.getStore());
    if (factory == null) {
      throw new StoreConfigurationException(
          "Unknown store: " + config.getStore() + ". Registered stores: " + names());
    }
    return factory.create(config);
  }
}
