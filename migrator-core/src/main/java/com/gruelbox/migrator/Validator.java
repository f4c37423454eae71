package com.gruelbox.migrator;

import java.util.regex.Pattern;

/**
 * Checks the properties of {@link Validatable} components, reporting the first problem found as an
 * {@link IllegalArgumentException} prefixed with the path to the offending property.
 */
public final class Validator {

  private static final Pattern IDENTIFIER =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

  private final String path;

  public Validator() {
    this.path = "";
  }

  private Validator(String path) {
    this.path = path;
  }

  public void validate(Validatable validatable) {
    validatable.validate(new Validator(validatable.getClass().getSimpleName()));
  }

  public void valid(String propertyName, Object object) {
    notNull(propertyName, object);
    if (!(object instanceof Validatable)) {
      return;
    }
    ((Validatable) object)
        .validate(new Validator(path.isEmpty() ? propertyName : (path + "." + propertyName)));
  }

  public void notNull(String propertyName, Object object) {
    if (object == null) {
      error(propertyName, "may not be null");
    }
  }

  public void isTrue(String propertyName, boolean condition, String message, Object... args) {
    if (!condition) {
      error(propertyName, String.format(message, args));
    }
  }

  public void notBlank(String propertyName, String object) {
    notNull(propertyName, object);
    if (object.isBlank()) {
      error(propertyName, "may not be blank");
    }
  }

  /** Guards names which get concatenated into SQL, such as table names. */
  public void sqlIdentifier(String propertyName, String object) {
    notBlank(propertyName, object);
    if (!IDENTIFIER.matcher(object).matches()) {
      error(propertyName, "is not a valid SQL identifier");
    }
  }

  private void error(String propertyName, String message) {
    throw new IllegalArgumentException(
        (path.isEmpty() ? "" : path + ".") + propertyName + " " + message);
  }
}
