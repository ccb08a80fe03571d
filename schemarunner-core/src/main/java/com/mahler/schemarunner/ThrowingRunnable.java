package com.mahler.schemarunner;

/** A runnable... that throws. */
@FunctionalInterface
interface ThrowingRunnable {

  void run() throws Exception;
}
