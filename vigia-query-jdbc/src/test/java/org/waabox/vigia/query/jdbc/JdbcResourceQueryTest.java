package org.waabox.vigia.query.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import javax.sql.DataSource;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.vigia.VigiaException;
import org.waabox.vigia.poll.QueryRequest;
import org.waabox.vigia.poll.SortOrder;

/** Unit tests for {@link JdbcResourceQuery}.
 *
 * <p>Uses an H2 in-memory database.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class JdbcResourceQueryTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private static final Instant T1 = Instant.parse("2024-05-01T10:05:00Z");

  private static final Instant T2 = Instant.parse("2024-05-01T10:10:00Z");

  /** The H2 in-memory data source. */
  private DataSource dataSource;

  /** The query under test. */
  private JdbcResourceQuery query;

  @BeforeEach
  void setUp() throws Exception {
    final JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:testdb_" + System.nanoTime()
        + ";DB_CLOSE_DELAY=-1");
    ds.setUser("sa");
    ds.setPassword("");
    dataSource = ds;

    try (final Connection conn = dataSource.getConnection();
         final Statement st = conn.createStatement()) {
      st.execute("CREATE TABLE widgets (id BIGINT PRIMARY KEY,"
          + " name VARCHAR(50), updated_at TIMESTAMP)");
    }
    insert(1, "bolt", T0);
    insert(2, "nut", T2);
    insert(3, null, T1);

    query = new JdbcResourceQuery(JdbcQueryConfig.create(dataSource));
  }

  private void insert(final long id, final String name,
      final Instant updatedAt) throws Exception {
    try (final Connection conn = dataSource.getConnection();
         final PreparedStatement ps = conn.prepareStatement(
             "INSERT INTO widgets (id, name, updated_at) VALUES (?, ?, ?)")) {
      ps.setLong(1, id);
      ps.setString(2, name);
      if (updatedAt == null) {
        ps.setNull(3, Types.TIMESTAMP);
      } else {
        ps.setTimestamp(3, Timestamp.from(updatedAt));
      }
      ps.executeUpdate();
    }
  }

  @Test
  void whenQuerying_givenNoCursorValue_shouldReturnLatestNewestFirst() {
    final List<Map<String, Object>> records = query.query("widgets",
        QueryRequest.latest("updated_at", 2));

    assertEquals(2, records.size());
    assertEquals(2L, records.get(0).get("id"));
    assertEquals(T2, records.get(0).get("updated_at"));
    assertEquals(T1, records.get(1).get("updated_at"));
  }

  @Test
  void whenQuerying_givenRowsWithoutCursorValue_shouldLeaveThemOut()
      throws Exception {
    insert(4, "washer", null);

    final List<Map<String, Object>> records = query.query("widgets",
        QueryRequest.latest("updated_at", 10));

    assertEquals(3, records.size());
    assertEquals(T2, records.get(0).get("updated_at"));
    assertEquals("SELECT * FROM widgets WHERE updated_at IS NOT NULL"
            + " ORDER BY updated_at DESC LIMIT ?",
        query.buildSql("widgets", QueryRequest.latest("updated_at", 10)));
  }

  @Test
  void whenQuerying_givenCursorValue_shouldReturnOnlyNewerRecords() {
    final List<Map<String, Object>> records = query.query("widgets",
        QueryRequest.after("updated_at", T1, 50));

    assertEquals(1, records.size());
    assertEquals("nut", records.get(0).get("name"));
  }

  @Test
  void whenQuerying_shouldKeyRecordsByLowerCaseLabelAndKeepNulls() {
    final List<Map<String, Object>> records = query.query("widgets",
        QueryRequest.latest("updated_at", 3));

    final Map<String, Object> record = records.get(1);
    assertEquals(List.of("id", "name", "updated_at"),
        List.copyOf(record.keySet()));
    assertTrue(record.containsKey("name"));
    assertNull(record.get("name"));
  }

  @Test
  void whenQuerying_givenAscendingOrder_shouldReturnOldestFirst() {
    final List<Map<String, Object>> records = query.query("widgets",
        new QueryRequest("updated_at", null, SortOrder.ASC, 50));

    assertEquals(3, records.size());
    assertEquals(T0, records.get(0).get("updated_at"));
    assertEquals(T2, records.get(2).get("updated_at"));
  }

  @Test
  void whenQuerying_givenSchema_shouldQualifyTable() {
    final JdbcResourceQuery qualified = new JdbcResourceQuery(
        JdbcQueryConfig.create(dataSource, "public"));

    assertEquals("SELECT * FROM public.widgets WHERE updated_at > ?"
            + " ORDER BY updated_at DESC LIMIT ?",
        qualified.buildSql("widgets",
            QueryRequest.after("updated_at", T0, 10)));
    assertEquals(3, qualified.query("widgets",
        QueryRequest.latest("updated_at", 10)).size());
  }

  @Test
  void whenQuerying_givenInjectedIdentifier_shouldRejectIt() {
    assertThrows(IllegalArgumentException.class, () ->
        query.query("widgets; DROP TABLE widgets",
            QueryRequest.latest("updated_at", 10))
    );
    assertThrows(IllegalArgumentException.class, () ->
        query.query("widgets",
            QueryRequest.latest("updated_at DESC --", 10))
    );
  }

  @Test
  void whenQuerying_givenMissingTable_shouldWrapFailure() {
    final VigiaException error = assertThrows(VigiaException.class, () ->
        query.query("gadgets", QueryRequest.latest("updated_at", 10))
    );

    assertTrue(error.getMessage().contains("gadgets"));
  }
}
