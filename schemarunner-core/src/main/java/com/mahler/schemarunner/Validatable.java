package com.mahler.schemarunner;

/** Implemented by configurable components which check their settings before use. */
public interface Validatable {

  void validate(Validator validator);
}
