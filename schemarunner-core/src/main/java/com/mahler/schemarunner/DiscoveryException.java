package com.mahler.schemarunner;

/**
 * Thrown when the set of migrations cannot be loaded: a missing directory, a badly named or
 * unparsable file, or two files sharing an id.
 */
public class DiscoveryException extends MigrationException {

  public DiscoveryException(String message) {
    super(message, null, null, null);
  }

  public DiscoveryException(String message, Throwable cause) {
    super(message, null, null, cause);
  }
}
