package com.gruelbox.migrator;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

/**
 * Utility methods used by the migrator. These are very firmly {@link NotApi}. Don't use them in
 * your code as they may be modified or removed without warning.
 */
@Slf4j
@NotApi
public class Utils {

  private Utils() {}

  @SuppressWarnings({"SameParameterValue", "UnusedReturnValue"})
  public static boolean safelyRun(String gerund, ThrowingRunnable runnable) {
    try {
      runnable.run();
      return true;
    } catch (Exception e) {
      log.error("Error when {}", gerund, e);
      return false;
    }
  }

  public static <T> T uncheckedly(Callable<T> runnable) {
    try {
      return runnable.call();
    } catch (Exception e) {
      return uncheckAndThrow(e);
    }
  }

  public static <T> T uncheckAndThrow(Throwable e) {
    if (e instanceof RuntimeException) {
      throw (RuntimeException) e;
    }
    if (e instanceof Error) {
      throw (Error) e;
    }
    throw new UncheckedException(e);
  }

  public static <T> T firstNonNull(T one, Supplier<T> two) {
    if (one == null) return two.get();
    return one;
  }

  /**
   * Rethrows any {@link Throwable} without wrapping or declaring it, so checked exceptions from a
   * {@link Store} reach the caller exactly as raised.
   */
  @SneakyThrows
  public static RuntimeException sneakyThrow(Throwable t) {
    if (t instanceof CompletionException || t instanceof UncheckedException) {
      throw t.getCause();
    } else {
      throw t;
    }
  }

  public static void sneakyThrowing(ThrowingRunnable runnable) {
    try {
      runnable.run();
    } catch (Exception e) {
      throw sneakyThrow(e);
    }
  }
}
