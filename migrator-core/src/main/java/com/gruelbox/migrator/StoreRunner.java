package com.gruelbox.migrator;

import java.sql.BatchUpdateException;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;

/**
 * Brackets the work of a single command with {@link Store#connect()} and {@link
 * Store#disconnect()}, making sure the store is disconnected on every exit path.
 *
 * <p>Failures are rethrown as raised, without wrapping, except that a {@link BatchUpdateException}
 * carrying a chained exception is replaced by that chained exception, since the batch wrapper
 * itself rarely says what actually went wrong.
 */
@Slf4j
final class StoreRunner {

  private StoreRunner() {}

  /** Runs a state-changing command, logging its start and end. */
  static <T> T run(Store store, ThrowingFunction<Store, T> command) {
    log.info("Starting migrations");
    try {
      return withConnection(store, command);
    } finally {
      log.info("Ending migrations");
    }
  }

  /** Runs work against a connected store without the run log lines. */
  static <T> T withConnection(Store store, ThrowingFunction<Store, T> work) {
    Throwable failure = null;
    try {
      store.connect();
      return work.apply(store);
    } catch (Throwable e) {
      failure = rootCause(e);
      throw Utils.sneakyThrow(failure);
    } finally {
      disconnect(store, failure);
    }
  }

  private static void disconnect(Store store, Throwable failure) {
    try {
      store.disconnect();
    } catch (Exception e) {
      if (failure == null) {
        throw Utils.sneakyThrow(rootCause(e));
      }
      log.warn("Failed to disconnect after an earlier failure", e);
      failure.addSuppressed(e);
    }
  }

  static Throwable rootCause(Throwable e) {
    Throwable result = e;
    if (result instanceof UncheckedException && result.getCause() != null) {
      result = result.getCause();
    }
    if (result instanceof BatchUpdateException) {
      SQLException next = ((BatchUpdateException) result).getNextException();
      if (next != null) {
        return next;
      }
    }
    return result;
  }
}
