package org.waabox.vigia.poll;

import static org.easymock.EasyMock.anyString;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.waabox.vigia.VigiaException;

/**
 * Tests for {@link CursorDiscovery}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CursorDiscoveryTest {

  @Test
  void whenResolving_givenUpdatedAtAndCreatedAt_shouldPickUpdatedAt() {
    final InMemoryResources resources = new InMemoryResources()
        .define("widgets", "id", "created_at", "updated_at");

    final CursorResolution resolution =
        new CursorDiscovery(resources).resolve("widgets");

    assertEquals(new CursorField("updated_at", CursorField.Kind.TIMESTAMP),
        resolution.cursorField().get());
  }

  @Test
  void whenResolving_givenOnlyCreatedAt_shouldPickCreatedAt() {
    final InMemoryResources resources = new InMemoryResources()
        .define("widgets", "id", "name", "created_at");

    final CursorResolution resolution =
        new CursorDiscovery(resources).resolve("widgets");

    assertEquals("created_at", resolution.cursorField().get().name());
  }

  @Test
  void whenResolving_givenUnconventionalTimestamp_shouldPickItByType() {
    final InMemoryResources resources = new InMemoryResources()
        .define("widgets", "id", "name", "shipped_at");

    final CursorField field = new CursorDiscovery(resources)
        .resolve("widgets").cursorField().get();

    assertEquals(new CursorField("shipped_at", CursorField.Kind.TIMESTAMP),
        field);
  }

  @Test
  void whenResolving_givenOnlyIntegerColumn_shouldPickSequence() {
    final InMemoryResources resources = new InMemoryResources()
        .define("ledger", "seq", "amount");

    final CursorField field = new CursorDiscovery(resources)
        .resolve("ledger").cursorField().get();

    assertEquals(new CursorField("seq", CursorField.Kind.SEQUENCE), field);
    assertTrue(field.isOrdered());
  }

  @Test
  void whenResolving_givenOnlyIdentifier_shouldPickUnorderedId() {
    final SchemaIntrospection schema = createMock(SchemaIntrospection.class);
    for (final String candidate : CursorDiscovery.CANDIDATE_FIELDS) {
      expect(schema.columnExists("tags", candidate)).andReturn(false);
    }
    expect(schema.fieldsByType("tags", EnumSet.of(FieldType.TIMESTAMP)))
        .andReturn(List.of());
    expect(schema.fieldsByType("tags", EnumSet.of(FieldType.INTEGER)))
        .andReturn(List.of());
    expect(schema.columnExists("tags", "id")).andReturn(true);
    replay(schema);

    final CursorField field = new CursorDiscovery(schema)
        .resolve("tags").cursorField().get();

    assertEquals(CursorField.Kind.IDENTIFIER, field.kind());
    assertFalse(field.isOrdered());
    verify(schema);
  }

  @Test
  void whenResolving_givenNoUsableField_shouldCacheNone() {
    final SchemaIntrospection schema = createMock(SchemaIntrospection.class);
    expect(schema.columnExists(eq("notes"), anyString()))
        .andReturn(false).times(CursorDiscovery.CANDIDATE_FIELDS.size() + 1);
    expect(schema.fieldsByType("notes", EnumSet.of(FieldType.TIMESTAMP)))
        .andReturn(List.of()).once();
    expect(schema.fieldsByType("notes", EnumSet.of(FieldType.INTEGER)))
        .andReturn(List.of()).once();
    replay(schema);

    final CursorDiscovery discovery = new CursorDiscovery(schema);
    final CursorResolution first = discovery.resolve("notes");
    final CursorResolution second = discovery.resolve("notes");

    assertTrue(first.cursorField().isEmpty());
    assertFalse(first.isUnavailable());
    assertTrue(second.cursorField().isEmpty());
    verify(schema);
  }

  @Test
  void whenResolving_givenFoundField_shouldNotQueryMetadataAgain() {
    final SchemaIntrospection schema = createMock(SchemaIntrospection.class);
    expect(schema.columnExists("widgets", "updated_at")).andReturn(true)
        .once();
    replay(schema);

    final CursorDiscovery discovery = new CursorDiscovery(schema);
    discovery.resolve("widgets");
    final CursorResolution cached = discovery.resolve("widgets");

    assertEquals("updated_at", cached.cursorField().get().name());
    verify(schema);
  }

  @Test
  void whenResolving_givenMetadataFailure_shouldNotCacheIt() {
    final SchemaIntrospection schema = createMock(SchemaIntrospection.class);
    expect(schema.columnExists("widgets", "updated_at"))
        .andThrow(new VigiaException("metadata down"));
    expect(schema.columnExists("widgets", "updated_at")).andReturn(true);
    replay(schema);

    final CursorDiscovery discovery = new CursorDiscovery(schema);
    final CursorResolution failed = discovery.resolve("widgets");
    final CursorResolution retried = discovery.resolve("widgets");

    assertTrue(failed.isUnavailable());
    assertTrue(failed.cursorField().isEmpty());
    assertEquals("updated_at", retried.cursorField().get().name());
    verify(schema);
  }
}
