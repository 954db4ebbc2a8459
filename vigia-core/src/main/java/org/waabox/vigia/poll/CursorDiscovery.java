package org.waabox.vigia.poll;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the field that orders the records of a resource by recency.
 *
 * <p>Discovery tries, in order: a well-known timestamp name, any timestamp
 * field, any integral field and finally a field named {@code id}. The
 * outcome, including "none found", is cached per resource for the
 * lifetime of this instance and shared by every poll engine of a
 * registry. A failure of the metadata source is never cached.
 *
 * <p>Concurrent discoveries of the same resource may both hit the
 * metadata source; the first result stored wins.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CursorDiscovery {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(CursorDiscovery.class);

  /** Conventional timestamp field names, most specific first. */
  public static final List<String> CANDIDATE_FIELDS = List.of(
      "updated_at", "created_at", "timestamp", "date", "modified_at",
      "last_modified", "updated", "created", "modification_date",
      "creation_date");

  /** The weakest fallback field. */
  private static final String IDENTIFIER_FIELD = "id";

  /** The metadata source, never null. */
  private final SchemaIntrospection schemaIntrospection;

  /** Resource name to discovered field; empty means none found. */
  private final ConcurrentHashMap<String, Optional<CursorField>> cache =
      new ConcurrentHashMap<>();

  /**
   * Creates a new cursor discovery.
   *
   * @param theSchemaIntrospection the metadata source, never null
   */
  public CursorDiscovery(final SchemaIntrospection theSchemaIntrospection) {
    schemaIntrospection = Objects.requireNonNull(theSchemaIntrospection,
        "schemaIntrospection must not be null");
  }

  /**
   * Resolves the cursor field of a resource.
   *
   * @param resource the resource name, never null
   *
   * @return the resolution, never null
   */
  public CursorResolution resolve(final String resource) {
    Objects.requireNonNull(resource, "resource must not be null");

    final Optional<CursorField> cached = cache.get(resource);
    if (cached != null) {
      return CursorResolution.of(cached);
    }

    final Optional<CursorField> discovered;
    try {
      discovered = discover(resource);
    } catch (final RuntimeException e) {
      log.warn("Could not read metadata of resource {}, will retry: {}",
          resource, e.getMessage());
      return CursorResolution.unavailable();
    }

    final Optional<CursorField> previous =
        cache.putIfAbsent(resource, discovered);
    final Optional<CursorField> winner =
        previous != null ? previous : discovered;

    if (winner.isPresent()) {
      log.info("Using cursor field {} for resource {}", winner.get(),
          resource);
    } else {
      log.warn("No cursor field found for resource {}", resource);
    }
    return CursorResolution.of(winner);
  }

  /** Runs the discovery steps against the metadata source.
   *
   * @param resource the resource name, never null
   * @return the field, empty if none qualifies
   */
  private Optional<CursorField> discover(final String resource) {
    for (final String candidate : CANDIDATE_FIELDS) {
      if (schemaIntrospection.columnExists(resource, candidate)) {
        return Optional.of(
            new CursorField(candidate, CursorField.Kind.TIMESTAMP));
      }
    }

    final List<String> timestamps = schemaIntrospection.fieldsByType(
        resource, EnumSet.of(FieldType.TIMESTAMP));
    if (!timestamps.isEmpty()) {
      return Optional.of(
          new CursorField(timestamps.get(0), CursorField.Kind.TIMESTAMP));
    }

    final List<String> integers = schemaIntrospection.fieldsByType(
        resource, EnumSet.of(FieldType.INTEGER));
    if (!integers.isEmpty()) {
      return Optional.of(
          new CursorField(integers.get(0), CursorField.Kind.SEQUENCE));
    }

    if (schemaIntrospection.columnExists(resource, IDENTIFIER_FIELD)) {
      return Optional.of(
          new CursorField(IDENTIFIER_FIELD, CursorField.Kind.IDENTIFIER));
    }
    return Optional.empty();
  }
}
