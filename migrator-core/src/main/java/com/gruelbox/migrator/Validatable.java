package com.gruelbox.migrator;

/** Implemented by components which can check their own configuration using a {@link Validator}. */
public interface Validatable {

  void validate(Validator validator);
}
