package com.gruelbox.migrator;

/** A runnable... that throws. */
@FunctionalInterface
public interface ThrowingRunnable {

  void run() throws Exception;
}
