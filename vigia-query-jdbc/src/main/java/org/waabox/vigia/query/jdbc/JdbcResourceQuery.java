package org.waabox.vigia.query.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.VigiaException;
import org.waabox.vigia.poll.QueryRequest;
import org.waabox.vigia.poll.ResourceQuery;

/**
 * A {@link ResourceQuery} that reads tables through JDBC.
 *
 * <p>Each query runs a single {@code SELECT} ordered by the cursor field
 * and bounded with {@code LIMIT}. Rows whose cursor field is null are
 * never returned. The resource and the cursor field are
 * validated as plain identifiers before being embedded in the statement;
 * the cursor value is always bound as a parameter.
 *
 * <p>Records are keyed by lower-cased column label. Timestamp values are
 * returned as {@link Instant}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcResourceQuery implements ResourceQuery {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdbcResourceQuery.class);

  /** The configuration, never null. */
  private final JdbcQueryConfig config;

  /**
   * Creates a new JDBC resource query.
   *
   * @param theConfig the configuration, never null
   */
  public JdbcResourceQuery(final JdbcQueryConfig theConfig) {
    Objects.requireNonNull(theConfig, "config cannot be null");
    config = theConfig;
  }

  /** {@inheritDoc} */
  @Override
  public List<Map<String, Object>> query(final String resource,
      final QueryRequest request) {
    Objects.requireNonNull(resource, "resource cannot be null");
    Objects.requireNonNull(request, "request cannot be null");

    final String sql = buildSql(resource, request);

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql)) {

      int index = 1;
      if (request.hasCursorValue()) {
        ps.setObject(index++, toJdbc(request.cursorValue()));
      }
      ps.setInt(index, request.limit());

      try (final ResultSet rs = ps.executeQuery()) {
        final List<Map<String, Object>> records = readAll(rs);
        log.debug("Fetched {} records from '{}'", records.size(), resource);
        return records;
      }

    } catch (final SQLException e) {
      throw new VigiaException(
          "Failed to query resource '" + resource + "'", e);
    }
  }

  /**
   * Builds the statement of a request.
   *
   * @param resource the table name, never null
   * @param request  the request, never null
   *
   * @return the SQL statement, never null
   */
  String buildSql(final String resource, final QueryRequest request) {
    final String field = SqlIdentifiers.requireValid(request.cursorField());
    final StringBuilder sql = new StringBuilder("SELECT * FROM ")
        .append(qualifiedName(resource));
    if (request.hasCursorValue()) {
      sql.append(" WHERE ").append(field).append(" > ?");
    } else {
      sql.append(" WHERE ").append(field).append(" IS NOT NULL");
    }
    sql.append(" ORDER BY ").append(field).append(' ')
        .append(request.order().name())
        .append(" LIMIT ?");
    return sql.toString();
  }

  /** Prefixes the table name with the configured schema.
   *
   * @param resource the table name, never null
   * @return the qualified name, never null
   */
  private String qualifiedName(final String resource) {
    SqlIdentifiers.requireValid(resource);
    return config.schema()
        .map(schema -> schema + "." + resource)
        .orElse(resource);
  }

  /** Reads every row of a result set.
   *
   * @param rs the result set, never null
   * @return the rows keyed by lower-cased column label, never null
   * @throws SQLException if reading fails
   */
  private static List<Map<String, Object>> readAll(final ResultSet rs)
      throws SQLException {
    final ResultSetMetaData meta = rs.getMetaData();
    final int columns = meta.getColumnCount();
    final List<Map<String, Object>> records = new ArrayList<>();
    while (rs.next()) {
      final Map<String, Object> record = new LinkedHashMap<>();
      for (int i = 1; i <= columns; i++) {
        record.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT),
            fromJdbc(rs.getObject(i)));
      }
      records.add(record);
    }
    return records;
  }

  /** Converts driver values to the values handed to listeners.
   *
   * @param value the driver value, may be null
   * @return the converted value, may be null
   */
  private static Object fromJdbc(final Object value) {
    if (value instanceof Timestamp) {
      return ((Timestamp) value).toInstant();
    }
    return value;
  }

  /** Converts a cursor value to a value every driver can bind.
   *
   * @param value the cursor value, never null
   * @return the bindable value, never null
   */
  private static Object toJdbc(final Object value) {
    if (value instanceof Instant) {
      return Timestamp.from((Instant) value);
    }
    return value;
  }
}
