package org.waabox.vigia.query.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.Connection;
import java.sql.Statement;
import java.sql.Types;
import java.util.EnumSet;
import java.util.List;

import javax.sql.DataSource;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.vigia.poll.CursorDiscovery;
import org.waabox.vigia.poll.CursorField;
import org.waabox.vigia.poll.FieldType;

/** Unit tests for {@link JdbcSchemaIntrospection}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class JdbcSchemaIntrospectionTest {

  /** The H2 in-memory data source. */
  private DataSource dataSource;

  /** The introspection under test. */
  private JdbcSchemaIntrospection introspection;

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
          + " name VARCHAR(50), created_at TIMESTAMP,"
          + " updated_at TIMESTAMP)");
      st.execute("CREATE TABLE shipments (code VARCHAR(10),"
          + " shipped_on DATE, seq INTEGER)");
      st.execute("CREATE TABLE ledger (entry_no BIGINT, amount DECIMAL(10,2))");
      st.execute("CREATE TABLE tags (id VARCHAR(36), label VARCHAR(20))");
      st.execute("CREATE TABLE notes (body VARCHAR(200))");
      st.execute("CREATE TABLE gearxitems (id BIGINT)");
    }

    introspection = new JdbcSchemaIntrospection(
        JdbcQueryConfig.create(dataSource));
  }

  @Test
  void whenCheckingResource_givenLowerCaseName_shouldFindUpperCaseTable() {
    assertTrue(introspection.resourceExists("widgets"));
    assertFalse(introspection.resourceExists("gadgets"));
  }

  @Test
  void whenCheckingResource_givenUnderscore_shouldNotMatchAsWildcard() {
    assertFalse(introspection.resourceExists("gear_items"));
    assertTrue(introspection.resourceExists("gearxitems"));
  }

  @Test
  void whenCheckingColumn_shouldMatchExactName() {
    assertTrue(introspection.columnExists("widgets", "updated_at"));
    assertFalse(introspection.columnExists("widgets", "modified_at"));
    assertFalse(introspection.columnExists("gadgets", "updated_at"));
  }

  @Test
  void whenListingFields_givenTimestampType_shouldReturnInColumnOrder() {
    assertEquals(List.of("created_at", "updated_at"),
        introspection.fieldsByType("widgets",
            EnumSet.of(FieldType.TIMESTAMP)));
    assertEquals(List.of("shipped_on"),
        introspection.fieldsByType("shipments",
            EnumSet.of(FieldType.TIMESTAMP)));
  }

  @Test
  void whenListingFields_givenIntegerType_shouldReturnIntegralColumns() {
    assertEquals(List.of("seq"), introspection.fieldsByType("shipments",
        EnumSet.of(FieldType.INTEGER)));
    assertEquals(List.of("entry_no"), introspection.fieldsByType("ledger",
        EnumSet.of(FieldType.INTEGER)));
  }

  @Test
  void whenMappingTypes_shouldCoverTemporalAndIntegralCodes() {
    assertEquals(FieldType.TIMESTAMP,
        JdbcSchemaIntrospection.fieldType(Types.TIMESTAMP_WITH_TIMEZONE));
    assertEquals(FieldType.INTEGER,
        JdbcSchemaIntrospection.fieldType(Types.SMALLINT));
    assertNull(JdbcSchemaIntrospection.fieldType(Types.VARCHAR));
    assertNull(JdbcSchemaIntrospection.fieldType(Types.DECIMAL));
  }

  @Test
  void whenDiscoveringCursors_shouldFollowTheFallbackChain() {
    final CursorDiscovery discovery = new CursorDiscovery(introspection);

    assertEquals(new CursorField("updated_at", CursorField.Kind.TIMESTAMP),
        discovery.resolve("widgets").cursorField().get());
    assertEquals(new CursorField("shipped_on", CursorField.Kind.TIMESTAMP),
        discovery.resolve("shipments").cursorField().get());
    assertEquals(new CursorField("entry_no", CursorField.Kind.SEQUENCE),
        discovery.resolve("ledger").cursorField().get());
    assertEquals(new CursorField("id", CursorField.Kind.IDENTIFIER),
        discovery.resolve("tags").cursorField().get());
    assertTrue(discovery.resolve("notes").cursorField().isEmpty());
  }

  @Test
  void whenCheckingColumn_givenInvalidIdentifier_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        introspection.columnExists("widgets", "name' OR '1'='1")
    );
  }
}
