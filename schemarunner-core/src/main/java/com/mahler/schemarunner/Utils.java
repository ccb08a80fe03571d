package com.mahler.schemarunner;

import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;

/** Internal helpers. Not part of the API. */
@Slf4j
final class Utils {

  private Utils() {}

  @SuppressWarnings("UnusedReturnValue")
  static boolean safelyRun(String gerund, ThrowingRunnable runnable) {
    try {
      runnable.run();
      return true;
    } catch (Exception e) {
      log.error("Error when {}", gerund, e);
      return false;
    }
  }

  static <T> T uncheckedly(Callable<T> callable) {
    try {
      return callable.call();
    } catch (Exception e) {
      return uncheckAndThrow(e);
    }
  }

  static <T> T uncheckAndThrow(Throwable e) {
    if (e instanceof RuntimeException) {
      throw (RuntimeException) e;
    }
    if (e instanceof Error) {
      throw (Error) e;
    }
    throw new UncheckedException(e);
  }
}
