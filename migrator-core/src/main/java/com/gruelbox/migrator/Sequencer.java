package com.gruelbox.migrator;

import static java.util.stream.Collectors.toList;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Works out which migrations a command should act on by diffing the store's inventory against its
 * completed record. Nothing is cached; every call reads the store afresh.
 */
final class Sequencer {

  static final Comparator<Migration> ASCENDING = Comparator.comparingLong(Migration::getId);
  static final Comparator<Migration> DESCENDING = ASCENDING.reversed();

  private Sequencer() {}

  /** All migrations not yet completed, ascending. */
  static List<Migration> uncompleted(Store store) throws Exception {
    Set<Long> completed = store.completedIds();
    return store.migrations().stream()
        .filter(migration -> !completed.contains(migration.getId()))
        .sorted(ASCENDING)
        .collect(toList());
  }

  /** The requested migrations which are not yet completed, ascending. */
  static List<Migration> selectUp(Store store, Collection<Long> ids) throws Exception {
    Set<Long> wanted = new HashSet<>(ids);
    wanted.removeAll(store.completedIds());
    return select(store, wanted, ASCENDING);
  }

  /** The requested migrations which are completed, descending. */
  static List<Migration> selectDown(Store store, Collection<Long> ids) throws Exception {
    Set<Long> wanted = new HashSet<>(ids);
    wanted.retainAll(store.completedIds());
    return select(store, wanted, DESCENDING);
  }

  /** The most recently completed migration, if any. */
  static List<Migration> selectRollback(Store store) throws Exception {
    Optional<Long> latest = store.completedIds().stream().max(Long::compare);
    if (latest.isEmpty()) {
      return List.of();
    }
    return select(store, Set.of(latest.get()), ASCENDING);
  }

  /** Every completed migration, ascending. The down path reverses them. */
  static List<Migration> selectReset(Store store) throws Exception {
    return select(store, store.completedIds(), ASCENDING);
  }

  private static List<Migration> select(Store store, Set<Long> ids, Comparator<Migration> order)
      throws Exception {
    if (ids.isEmpty()) {
      return List.of();
    }
    return store.migrations().stream()
        .filter(migration -> ids.contains(migration.getId()))
        .sorted(order)
        .collect(toList());
  }
}
