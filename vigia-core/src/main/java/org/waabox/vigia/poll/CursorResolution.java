package org.waabox.vigia.poll;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of a cursor discovery.
 *
 * <p>A resolution is either a found field, a definitive "none found", or
 * "unavailable" when the metadata could not be read. Only the first two
 * are cached.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CursorResolution {

  /** The shared unavailable resolution. */
  private static final CursorResolution UNAVAILABLE =
      new CursorResolution(null, true);

  /** The shared none-found resolution. */
  private static final CursorResolution NONE =
      new CursorResolution(null, false);

  /** The found field, null if none. */
  private final CursorField field;

  /** Whether the metadata could not be read. */
  private final boolean unavailable;

  /** Creates a resolution.
   *
   * @param theField       the field, may be null
   * @param isUnavailable  whether metadata was unavailable
   */
  private CursorResolution(final CursorField theField,
      final boolean isUnavailable) {
    field = theField;
    unavailable = isUnavailable;
  }

  /**
   * A resolution carrying the discovered field.
   *
   * @param field the field, never null
   *
   * @return the resolution, never null
   */
  public static CursorResolution found(final CursorField field) {
    Objects.requireNonNull(field, "field must not be null");
    return new CursorResolution(field, false);
  }

  /**
   * The resolution of a resource with no usable cursor field.
   *
   * @return the resolution, never null
   */
  public static CursorResolution none() {
    return NONE;
  }

  /**
   * The resolution of a failed metadata lookup.
   *
   * @return the resolution, never null
   */
  public static CursorResolution unavailable() {
    return UNAVAILABLE;
  }

  /**
   * Creates a resolution out of a cached lookup.
   *
   * @param cached the cached lookup, never null
   *
   * @return found or none, never null
   */
  static CursorResolution of(final Optional<CursorField> cached) {
    return cached.map(CursorResolution::found).orElse(NONE);
  }

  /**
   * Whether the metadata could not be read.
   *
   * @return true if the lookup failed and should be retried later
   */
  public boolean isUnavailable() {
    return unavailable;
  }

  /**
   * The discovered field.
   *
   * @return the field, empty if none was found or the lookup failed
   */
  public Optional<CursorField> cursorField() {
    return Optional.ofNullable(field);
  }

  @Override
  public String toString() {
    if (unavailable) {
      return "CursorResolution[unavailable]";
    }
    return "CursorResolution[" + (field == null ? "none" : field) + "]";
  }
}
