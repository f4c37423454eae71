package com.gruelbox.migrator;

import static java.util.stream.Collectors.toList;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Applies migrations in ascending id order, stopping at the first the store reports as failed. */
@Slf4j
@AllArgsConstructor
final class UpExecutor {

  private final MigrationListener listener;

  MigrationResult apply(Store store, List<Migration> migrations) throws Exception {
    if (migrations.isEmpty()) {
      return MigrationResult.EMPTY;
    }
    List<Migration> sorted = migrations.stream().sorted(Sequencer.ASCENDING).collect(toList());
    log.info("Running up for {}", ids(sorted));
    Utils.safelyRun("notifying listener", () -> listener.upStarted(sorted));
    List<Migration> applied = new ArrayList<>();
    for (Migration migration : sorted) {
      log.info("Up {}", migration.displayName());
      if (!store.applyUp(migration)) {
        log.error("Stopping: {} failed to migrate", migration.displayName());
        Utils.safelyRun("notifying listener", () -> listener.upFailed(migration));
        return MigrationResult.stoppedAt(applied, migration);
      }
      applied.add(migration);
      Utils.safelyRun("notifying listener", () -> listener.migratedUp(migration));
    }
    return MigrationResult.applied(applied);
  }

  static List<Long> ids(List<Migration> migrations) {
    return migrations.stream().map(Migration::getId).collect(toList());
  }
}
