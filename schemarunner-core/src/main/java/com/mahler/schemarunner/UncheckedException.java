package com.mahler.schemarunner;

/** A wrapped checked {@link Exception}, propagated as a runtime exception. */
public class UncheckedException extends RuntimeException {

  public UncheckedException(Throwable cause) {
    super(cause);
  }
}
