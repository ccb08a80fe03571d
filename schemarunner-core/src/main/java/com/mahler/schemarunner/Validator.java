package com.mahler.schemarunner;

/** Checks builder-supplied configuration, reporting the dotted path of the offending property. */
public final class Validator {

  private final String path;

  Validator() {
    this.path = "";
  }

  private Validator(String path) {
    this.path = path;
  }

  public void validate(Validatable validatable) {
    validatable.validate(new Validator(validatable.getClass().getSimpleName()));
  }

  public void notNull(String propertyName, Object object) {
    if (object == null) {
      error(propertyName, "may not be null");
    }
  }

  public void notBlank(String propertyName, String object) {
    notNull(propertyName, object);
    if (object.isBlank()) {
      error(propertyName, "may not be blank");
    }
  }

  public void isTrue(String propertyName, boolean condition, String message, Object... args) {
    if (!condition) {
      error(propertyName, String.format(message, args));
    }
  }

  private void error(String propertyName, String message) {
    throw new IllegalArgumentException(
        (path.isEmpty() ? "" : path + ".") + propertyName + " " + message);
  }
}
