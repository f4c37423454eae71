package com.gruelbox.migrator;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;
import lombok.Builder;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link Store} which keeps everything in memory. Useful in tests, and for exercising migration
 * sequences without a database.
 *
 * <p>Every call is recorded in {@link #getEvents()}, as {@code connect}, {@code up <id>}, {@code
 * down <id>}, {@code disconnect} and so on. Failures can be injected with {@link #failUp(long)}
 * and {@link #failDown(long, Exception)}.
 *
 * <p>Since state lives in the instance, register the same instance for every command:
 *
 * <pre>InMemoryStore store = InMemoryStore.builder().migration(m1).migration(m2).build();
 * StoreRegistry registry = StoreRegistry.empty().register("memory", config -&gt; store);</pre>
 */
@Slf4j
public class InMemoryStore implements Store {

  private static final DateTimeFormatter ID_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

  private final Map<Long, Migration> migrations = new TreeMap<>();
  private final Set<Long> completed = new TreeSet<>();
  private final Set<Long> upFailures = new HashSet<>();
  private final Map<Long, Exception> downFailures = new HashMap<>();
  private final List<String> events = new ArrayList<>();
  private final Supplier<Clock> clockProvider;
  private boolean connected;

  @Builder
  InMemoryStore(
      @Singular List<Migration> migrations,
      @Singular Set<Long> completedIds,
      Supplier<Clock> clockProvider) {
    migrations.forEach(migration -> this.migrations.put(migration.getId(), migration));
    this.completed.addAll(completedIds);
    this.clockProvider = clockProvider == null ? Clock::systemUTC : clockProvider;
  }

  /**
   * Makes {@link #applyUp(Migration)} report failure for a migration.
   *
   * @param id The migration id.
   * @return This store.
   */
  public InMemoryStore failUp(long id) {
    upFailures.add(id);
    return this;
  }

  /**
   * Makes {@link #applyDown(Migration)} throw for a migration.
   *
   * @param id The migration id.
   * @param exception The exception to throw.
   * @return This store.
   */
  public InMemoryStore failDown(long id, Exception exception) {
    downFailures.put(id, exception);
    return this;
  }

  /** Removes all injected failures. */
  public void clearFailures() {
    upFailures.clear();
    downFailures.clear();
  }

  /**
   * @return The calls made so far, oldest first.
   */
  public List<String> getEvents() {
    return List.copyOf(events);
  }

  /**
   * @return The completed ids, readable without connecting.
   */
  public Set<Long> getCompletedIds() {
    return Set.copyOf(completed);
  }

  public void clearEvents() {
    events.clear();
  }

  public boolean isConnected() {
    return connected;
  }

  @Override
  public void connect() {
    if (connected) {
      throw new IllegalStateException("Already connected");
    }
    events.add("connect");
    connected = true;
  }

  @Override
  public void disconnect() {
    if (connected) {
      events.add("disconnect");
      connected = false;
    }
  }

  @Override
  public Collection<Migration> migrations() {
    checkConnected();
    return List.copyOf(migrations.values());
  }

  @Override
  public Set<Long> completedIds() {
    checkConnected();
    return Set.copyOf(completed);
  }

  @Override
  public boolean applyUp(Migration migration) {
    checkConnected();
    events.add("up " + migration.getId());
    if (upFailures.contains(migration.getId())) {
      log.debug("Simulating failure of {}", migration.displayName());
      return false;
    }
    completed.add(migration.getId());
    return true;
  }

  @Override
  public void applyDown(Migration migration) throws Exception {
    checkConnected();
    events.add("down " + migration.getId());
    Exception failure = downFailures.get(migration.getId());
    if (failure != null) {
      throw failure;
    }
    completed.remove(migration.getId());
  }

  @Override
  public void init() {
    events.add("init");
  }

  /**
   * Adds an empty migration with an id taken from the current UTC time, to the second. Fails if
   * that id is already taken.
   */
  @Override
  public void create(String name) {
    new Validator().notBlank("name", name);
    long id = Long.parseLong(ID_FORMAT.format(clockProvider.get().instant()));
    Migration existing = migrations.get(id);
    if (existing != null) {
      throw new IllegalStateException(
          "Cannot create " + name + ": id " + id + " is already used by " + existing.displayName());
    }
    migrations.put(id, new Migration(id, name, "", ""));
    events.add("create " + id);
    log.info("Created migration {}-{}", id, name);
  }

  /** Removes every migration with the given name, along with its completed record. */
  @Override
  public void destroy(String name) {
    if (name == null) {
      log.warn("No migration name given, nothing to destroy");
      return;
    }
    List<Long> ids = new ArrayList<>();
    migrations.values().stream()
        .filter(migration -> name.equals(migration.getName()))
        .forEach(migration -> ids.add(migration.getId()));
    ids.forEach(
        id -> {
          migrations.remove(id);
          completed.remove(id);
          events.add("destroy " + id);
        });
    if (ids.isEmpty()) {
      log.warn("No migration named {}", name);
    }
  }

  private void checkConnected() {
    if (!connected) {
      throw new IllegalStateException("Not connected");
    }
  }
}
