package org.waabox.vigia.query.jdbc;

import java.util.Objects;
import java.util.Optional;

import javax.sql.DataSource;

/**
 * Configuration for the JDBC resource query and schema introspection.
 *
 * <p>Holds the {@link DataSource} and, optionally, the schema the
 * resources live in. Resources are table or view names.
 *
 * <p>Instances are created via the static factory methods
 * {@link #create(DataSource)} and {@link #create(DataSource, String)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcQueryConfig {

  /** The JDBC data source, never null. */
  private final DataSource dataSource;

  /** The schema of the resources, null for the connection's default. */
  private final String schema;

  /** Private constructor; use static factories.
   *
   * @param theDataSource the JDBC data source
   * @param theSchema     the schema, may be null
   */
  private JdbcQueryConfig(final DataSource theDataSource,
      final String theSchema) {
    dataSource = theDataSource;
    schema = theSchema;
  }

  /**
   * Creates a configuration whose resources live in the given schema.
   *
   * @param dataSource the JDBC data source, never null
   * @param schema     the schema name, never null, must be a plain SQL
   *                   identifier
   *
   * @return a new configuration instance, never null
   */
  public static JdbcQueryConfig create(final DataSource dataSource,
      final String schema) {
    Objects.requireNonNull(dataSource, "dataSource cannot be null");
    Objects.requireNonNull(schema, "schema cannot be null");
    SqlIdentifiers.requireValid(schema);
    return new JdbcQueryConfig(dataSource, schema);
  }

  /**
   * Creates a configuration whose resources live in the connection's
   * default schema.
   *
   * @param dataSource the JDBC data source, never null
   *
   * @return a new configuration instance, never null
   */
  public static JdbcQueryConfig create(final DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource cannot be null");
    return new JdbcQueryConfig(dataSource, null);
  }

  /**
   * Returns the JDBC data source.
   *
   * @return the data source, never null
   */
  public DataSource dataSource() {
    return dataSource;
  }

  /**
   * Returns the schema of the resources.
   *
   * @return the schema, empty for the connection's default
   */
  public Optional<String> schema() {
    return Optional.ofNullable(schema);
  }
}
