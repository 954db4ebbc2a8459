package org.waabox.vigia.query.jdbc;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validation of the identifiers embedded in generated SQL.
 *
 * <p>Table and column names cannot be bound as statement parameters, so
 * only plain unquoted identifiers are accepted.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class SqlIdentifiers {

  /** A plain SQL identifier. */
  private static final Pattern IDENTIFIER =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private SqlIdentifiers() {
  }

  /**
   * Checks that a name is a plain SQL identifier.
   *
   * @param name the name, never null
   *
   * @return the same name, never null
   *
   * @throws IllegalArgumentException if the name is not a plain identifier
   */
  static String requireValid(final String name) {
    Objects.requireNonNull(name, "identifier cannot be null");
    if (!IDENTIFIER.matcher(name).matches()) {
      throw new IllegalArgumentException(
          "Not a valid SQL identifier: '" + name + "'");
    }
    return name;
  }
}
