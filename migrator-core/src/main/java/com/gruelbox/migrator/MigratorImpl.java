package com.gruelbox.migrator;

import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
final class MigratorImpl implements Migrator, Validatable {

  private final StoreRegistry registry;
  private final MigrationListener listener;
  private final UpExecutor upExecutor;
  private final DownExecutor downExecutor;

  @Override
  public void validate(Validator validator) {
    validator.notNull("registry", registry);
    validator.notNull("listener", listener);
  }

  static MigratorBuilder builder() {
    return new MigratorBuilderImpl();
  }

  @Override
  public MigrationResult migrate(MigratorConfig config) {
    return StoreRunner.run(
        registry.create(config), store -> upExecutor.apply(store, Sequencer.uncompleted(store)));
  }

  @Override
  public MigrationResult up(MigratorConfig config, Collection<Long> ids) {
    return StoreRunner.run(
        registry.create(config),
        store -> upExecutor.apply(store, Sequencer.selectUp(store, ids)));
  }

  @Override
  public MigrationResult down(MigratorConfig config, Collection<Long> ids) {
    return StoreRunner.run(
        registry.create(config),
        store -> downExecutor.apply(store, Sequencer.selectDown(store, ids)));
  }

  @Override
  public MigrationResult rollback(MigratorConfig config) {
    return StoreRunner.run(
        registry.create(config),
        store -> downExecutor.apply(store, Sequencer.selectRollback(store)));
  }

  @Override
  public MigrationResult reset(MigratorConfig config) {
    MigrationResult reverted =
        StoreRunner.run(
            registry.create(config),
            store -> downExecutor.apply(store, Sequencer.selectReset(store)));
    return reverted.merge(migrate(config));
  }

  @Override
  public MigrationResult migrateUntilJustBefore(MigratorConfig config, long migrationId) {
    List<Long> ids =
        StoreRunner.withConnection(
            registry.create(config),
            store ->
                Sequencer.uncompleted(store).stream()
                    .map(Migration::getId)
                    .distinct()
                    .sorted()
                    .takeWhile(id -> id < migrationId)
                    .collect(toList()));
    log.debug("Migrating until just before {}: {}", migrationId, ids);
    return up(config, ids);
  }

  @Override
  public String pendingList(MigratorConfig config) {
    List<String> names =
        StoreRunner.withConnection(
            registry.create(config),
            store ->
                Sequencer.uncompleted(store).stream()
                    .map(Migration::getName)
                    .collect(toList()));
    return "You have "
        + names.size()
        + " pending migrations:\n"
        + names.stream().collect(joining("\n"));
  }

  @Override
  public void init(MigratorConfig config) {
    Store store = registry.create(config);
    Utils.sneakyThrowing(store::init);
  }

  @Override
  public void create(MigratorConfig config, String name) {
    Store store = registry.create(config);
    Utils.sneakyThrowing(() -> store.create(name));
  }

  @Override
  public void destroy(MigratorConfig config, String name) {
    Store store = registry.create(config);
    Utils.sneakyThrowing(() -> store.destroy(name));
  }

  static List<Long> boxed(long... ids) {
    return Arrays.stream(ids).boxed().collect(toList());
  }

  @ToString
  static class MigratorBuilderImpl extends MigratorBuilder {

    MigratorBuilderImpl() {
      super();
    }

    @Override
    public MigratorImpl build() {
      MigrationListener effectiveListener =
          Utils.firstNonNull(listener, () -> MigrationListener.EMPTY);
      MigratorImpl impl =
          new MigratorImpl(
              Utils.firstNonNull(registry, StoreRegistry::defaults),
              effectiveListener,
              new UpExecutor(effectiveListener),
              new DownExecutor(effectiveListener));
      new Validator().validate(impl);
      return impl;
    }
  }
}
