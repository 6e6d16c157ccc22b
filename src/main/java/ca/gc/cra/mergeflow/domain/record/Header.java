package ca.gc.cra.mergeflow.domain.record;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Canonical, ordered list of unique field names for a decode session.
 * <p><strong>Why:</strong> Every record of a merged stream is validated and indexed against one header, and
 * repeated per-source copies of that header are recognised by exact comparison.</p>
 * <p><strong>Role:</strong> Domain value owned by the record decoder and shared by every record it serves.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the name index is built once at construction.</p>
 * <p><strong>Performance:</strong> Name lookups are O(1); {@link #matches(List)} is O(n) in the field count.</p>
 *
 * @since 0.1.0
 */
public final class Header {
  private final List<String> names;
  private final Map<String, Integer> index;

  private Header(List<String> names, Map<String, Integer> index) {
    this.names = names;
    this.index = index;
  }

  /**
   * Builds a header from ordered field names.
   *
   * @param names ordered field names; must not be {@code null} or contain {@code null}
   * @return immutable header
   * @throws HeaderConfigurationException if the list is empty or a name repeats (case-sensitive)
   */
  public static Header of(List<String> names) throws HeaderConfigurationException {
    Objects.requireNonNull(names, "names");
    if (names.isEmpty()) {
      throw new HeaderConfigurationException("malformed header: no field names");
    }
    List<String> copy = List.copyOf(names);
    Map<String, Integer> index = new HashMap<>(copy.size() * 2);
    for (int i = 0; i < copy.size(); i++) {
      String name = copy.get(i);
      if (index.putIfAbsent(name, i) != null) {
        throw new HeaderConfigurationException(
            "malformed header: duplicate entry " + name + " in header");
      }
    }
    return new Header(copy, index);
  }

  /**
   * Returns the ordered field names.
   *
   * @return immutable name list
   */
  public List<String> names() {
    return names;
  }

  /**
   * Returns the number of fields.
   *
   * @return header length
   */
  public int size() {
    return names.size();
  }

  /**
   * Looks up the position of a field name.
   *
   * @param name field name; case-sensitive
   * @return position, or empty when the name is unknown
   */
  public OptionalInt indexOf(String name) {
    Integer position = name == null ? null : index.get(name);
    return position == null ? OptionalInt.empty() : OptionalInt.of(position);
  }

  /**
   * Checks whether a parsed row is an exact copy of this header.
   *
   * @param row parsed field values
   * @return {@code true} when the row has the same length and the same name at every position
   */
  public boolean matches(List<String> row) {
    return row != null && names.equals(row);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Header header && names.equals(header.names);
  }

  @Override
  public int hashCode() {
    return names.hashCode();
  }

  @Override
  public String toString() {
    return "Header" + names;
  }
}
