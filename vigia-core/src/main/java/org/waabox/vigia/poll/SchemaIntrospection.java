package org.waabox.vigia.poll;

import java.util.List;
import java.util.Set;

/**
 * Answers questions about the shape of a resource.
 *
 * <p>Implementations may throw unchecked exceptions, typically
 * {@link org.waabox.vigia.VigiaException}, when the metadata source is
 * unavailable. Callers treat those failures as transient.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SchemaIntrospection {

  /**
   * Checks whether a resource exists.
   *
   * @param resource the resource name, never null
   *
   * @return true if the resource exists
   */
  boolean resourceExists(String resource);

  /**
   * Checks whether a resource has a field with the given name.
   *
   * @param resource the resource name, never null
   * @param field    the field name, never null
   *
   * @return true if the field exists
   */
  boolean columnExists(String resource, String field);

  /**
   * Lists the fields of a resource whose type is one of the given types.
   *
   * @param resource the resource name, never null
   * @param types    the accepted types, never null
   *
   * @return the matching field names in declaration order, never null
   */
  List<String> fieldsByType(String resource, Set<FieldType> types);
}
