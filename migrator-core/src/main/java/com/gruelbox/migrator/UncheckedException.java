package com.gruelbox.migrator;

/** A wrapped {@link Exception} where checked exceptions are caught and propagated as runtime. */
public class UncheckedException extends RuntimeException {

  public UncheckedException(Throwable cause) {
    super(cause);
  }
}
