package org.waabox.vigia.query.jdbc;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.VigiaException;
import org.waabox.vigia.poll.FieldType;
import org.waabox.vigia.poll.SchemaIntrospection;

/**
 * A {@link SchemaIntrospection} backed by JDBC {@link DatabaseMetaData}.
 *
 * <p>Names are matched the way the database stores unquoted identifiers,
 * so {@code widgets} finds a table created as {@code WIDGETS} on
 * databases that upper-case identifiers. Returned field names are
 * lower-cased, matching the record keys of {@link JdbcResourceQuery}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcSchemaIntrospection implements SchemaIntrospection {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdbcSchemaIntrospection.class);

  /** The configuration, never null. */
  private final JdbcQueryConfig config;

  /**
   * Creates a new JDBC schema introspection.
   *
   * @param theConfig the configuration, never null
   */
  public JdbcSchemaIntrospection(final JdbcQueryConfig theConfig) {
    Objects.requireNonNull(theConfig, "config cannot be null");
    config = theConfig;
  }

  /** {@inheritDoc} */
  @Override
  public boolean resourceExists(final String resource) {
    SqlIdentifiers.requireValid(resource);
    try (final Connection conn = config.dataSource().getConnection()) {
      final DatabaseMetaData meta = conn.getMetaData();
      try (final ResultSet rs = meta.getTables(null, schemaPattern(meta),
          pattern(meta, resource), null)) {
        return rs.next();
      }
    } catch (final SQLException e) {
      throw new VigiaException(
          "Failed to look up resource '" + resource + "'", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean columnExists(final String resource, final String field) {
    SqlIdentifiers.requireValid(resource);
    SqlIdentifiers.requireValid(field);
    try (final Connection conn = config.dataSource().getConnection()) {
      final DatabaseMetaData meta = conn.getMetaData();
      try (final ResultSet rs = meta.getColumns(null, schemaPattern(meta),
          pattern(meta, resource), pattern(meta, field))) {
        return rs.next();
      }
    } catch (final SQLException e) {
      throw new VigiaException("Failed to look up column '" + field
          + "' of resource '" + resource + "'", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<String> fieldsByType(final String resource,
      final Set<FieldType> types) {
    SqlIdentifiers.requireValid(resource);
    Objects.requireNonNull(types, "types cannot be null");
    final List<String> fields = new ArrayList<>();
    try (final Connection conn = config.dataSource().getConnection()) {
      final DatabaseMetaData meta = conn.getMetaData();
      try (final ResultSet rs = meta.getColumns(null, schemaPattern(meta),
          pattern(meta, resource), null)) {
        while (rs.next()) {
          final FieldType type = fieldType(rs.getInt("DATA_TYPE"));
          if (type != null && types.contains(type)) {
            fields.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
          }
        }
      }
    } catch (final SQLException e) {
      throw new VigiaException(
          "Failed to list columns of resource '" + resource + "'", e);
    }
    log.debug("Resource '{}' has {} fields of types {}", resource,
        fields.size(), types);
    return fields;
  }

  /**
   * Maps a JDBC type code to a field type.
   *
   * @param jdbcType the {@link Types} code
   *
   * @return the field type, null if the type is neither temporal nor
   *         integral
   */
  static FieldType fieldType(final int jdbcType) {
    switch (jdbcType) {
      case Types.TIMESTAMP:
      case Types.TIMESTAMP_WITH_TIMEZONE:
      case Types.DATE:
      case Types.TIME:
      case Types.TIME_WITH_TIMEZONE:
        return FieldType.TIMESTAMP;
      case Types.INTEGER:
      case Types.BIGINT:
      case Types.SMALLINT:
      case Types.TINYINT:
        return FieldType.INTEGER;
      default:
        return null;
    }
  }

  /** Builds the schema search pattern.
   *
   * @param meta the database metadata, never null
   * @return the pattern, null to search every schema
   * @throws SQLException if the metadata cannot be read
   */
  private String schemaPattern(final DatabaseMetaData meta)
      throws SQLException {
    if (config.schema().isEmpty()) {
      return null;
    }
    return pattern(meta, config.schema().get());
  }

  /**
   * Turns an identifier into a metadata search pattern that matches only
   * that identifier, in the case the database stores it.
   *
   * @param meta the database metadata, never null
   * @param name the identifier, never null
   * @return the pattern, never null
   * @throws SQLException if the metadata cannot be read
   */
  private static String pattern(final DatabaseMetaData meta,
      final String name) throws SQLException {
    final String stored;
    if (meta.storesUpperCaseIdentifiers()) {
      stored = name.toUpperCase(Locale.ROOT);
    } else if (meta.storesLowerCaseIdentifiers()) {
      stored = name.toLowerCase(Locale.ROOT);
    } else {
      stored = name;
    }
    final String escape = meta.getSearchStringEscape();
    if (escape == null || escape.isEmpty()) {
      return stored;
    }
    return stored.replace("_", escape + "_").replace("%", escape + "%");
  }
}
