package com.gruelbox.migrator;

import static java.util.stream.Collectors.toList;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reverts migrations in descending id order. Unlike {@link UpExecutor} there is no soft stop: any
 * exception from the store propagates straight away and the rest of the sequence is abandoned.
 */
@Slf4j
@AllArgsConstructor
final class DownExecutor {

  private final MigrationListener listener;

  MigrationResult apply(Store store, List<Migration> migrations) throws Exception {
    if (migrations.isEmpty()) {
      return MigrationResult.EMPTY;
    }
    List<Migration> sorted = migrations.stream().sorted(Sequencer.DESCENDING).collect(toList());
    log.info("Running down for {}", UpExecutor.ids(sorted));
    Utils.safelyRun("notifying listener", () -> listener.downStarted(sorted));
    List<Migration> reverted = new ArrayList<>();
    for (Migration migration : sorted) {
      log.info("Down {}", migration.displayName());
      store.applyDown(migration);
      reverted.add(migration);
      Utils.safelyRun("notifying listener", () -> listener.migratedDown(migration));
    }
    return MigrationResult.reverted(reverted);
  }
}
