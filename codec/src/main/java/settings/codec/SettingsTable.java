/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

/**
 * An ordered mapping from keys to {@link SettingValue}s.
 *
 * <p>Keys are unique and the last write wins. Iteration follows insertion order, which for a
 * parsed table is file order; {@link #sorted()} gives the lexicographic view used for output.
 *
 * <p>Every entry is checked on insertion so that a table can always be written by a text codec:
 *
 * <ul>
 *   <li>keys must not be blank, start or end with whitespace, contain {@value
 *       #KEY_VALUE_SEPARATOR_CHAR} or a line break, nor start with a comment marker, since the
 *       parser trims keys and skips comment lines;
 *   <li>values must not contain line breaks;
 *   <li>list elements must not contain {@link PropertiesCodec#LIST_SEPARATOR_CHAR}, since they
 *       would be split apart again when read back.
 * </ul>
 *
 * <p>This class is not thread-safe.
 */
public final class SettingsTable {

  /** The character separating a key from its value on a line. */
  public static final char KEY_VALUE_SEPARATOR_CHAR = '=';

  /** Creates an empty table. */
  public SettingsTable() {
    entries = new LinkedHashMap<>();
  }

  /**
   * Creates a copy of another table, keeping its iteration order.
   *
   * @param other the table to copy
   */
  public SettingsTable(SettingsTable other) {
    entries = new LinkedHashMap<>(other.entries);
  }

  /**
   * Stores a single-string value, replacing any previous value for the key.
   *
   * @param key the key
   * @param value the value
   * @return the previous value, or {@code null} if there was none
   * @throws InvalidKeyException if the key cannot be represented
   * @throws InvalidValueException if the value cannot be represented
   */
  public @Nullable SettingValue put(String key, String value) {
    return put(key, SettingValue.of(value));
  }

  /**
   * Stores a list value, replacing any previous value for the key.
   *
   * @param key the key
   * @param values the elements, in order
   * @return the previous value, or {@code null} if there was none
   * @throws InvalidKeyException if the key cannot be represented
   * @throws InvalidValueException if an element cannot be represented
   */
  public @Nullable SettingValue put(String key, List<String> values) {
    return put(key, SettingValue.ofList(values));
  }

  /**
   * Stores a value, replacing any previous value for the key. The table is left untouched if the
   * entry is rejected.
   *
   * @param key the key
   * @param value the value
   * @return the previous value, or {@code null} if there was none
   * @throws InvalidKeyException if the key cannot be represented
   * @throws InvalidValueException if the value cannot be represented
   */
  public @Nullable SettingValue put(String key, SettingValue value) {
    Objects.requireNonNull(value, "value");
    validateKey(key);
    validateValue(key, value);
    return entries.put(key, value);
  }

  /**
   * Returns the value stored under {@code key}, of either variant.
   *
   * @param key the key
   * @return the value, or {@code null} if absent
   */
  public @Nullable SettingValue get(String key) {
    return entries.get(key);
  }

  /**
   * Returns the single-string value stored under {@code key}.
   *
   * @param key the key
   * @return the string, or {@code null} if the key is absent or holds a list
   */
  public @Nullable String getSingle(String key) {
    return entries.get(key) instanceof SettingValue.Single single ? single.value() : null;
  }

  /**
   * Returns the list value stored under {@code key}.
   *
   * @param key the key
   * @return the unmodifiable list, or {@code null} if the key is absent or holds a single string
   */
  public @Nullable List<String> getList(String key) {
    return entries.get(key) instanceof SettingValue.Multi multi ? multi.values() : null;
  }

  /**
   * Removes the entry for {@code key}.
   *
   * @param key the key
   * @return the removed value, or {@code null} if there was none
   */
  public @Nullable SettingValue remove(String key) {
    return entries.remove(key);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * Returns the keys in insertion order.
   *
   * @return an unmodifiable view of the keys
   */
  public Set<String> keys() {
    return Collections.unmodifiableSet(entries.keySet());
  }

  /**
   * Returns the keys in lexicographic order.
   *
   * @return a new list of the keys
   */
  public List<String> sortedKeys() {
    var keys = new ArrayList<>(entries.keySet());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Returns a snapshot of the entries ordered lexicographically by key.
   *
   * @return a new sorted map
   */
  public SortedMap<String, SettingValue> sorted() {
    return new TreeMap<>(entries);
  }

  /**
   * Checks that {@code key} could be written to and read back from a text file unchanged.
   *
   * @param key the key to check
   * @throws InvalidKeyException if it could not
   */
  public static void validateKey(@Nullable String key) {
    if (key == null || key.trim().isEmpty()) {
      throw new InvalidKeyException(String.valueOf(key), "key must not be empty or blank");
    }
    if (!key.equals(key.trim())) {
      throw new InvalidKeyException(key, "key must not start or end with whitespace");
    }
    if (key.indexOf(KEY_VALUE_SEPARATOR_CHAR) != -1) {
      throw new InvalidKeyException(
          key, "key must not contain '" + KEY_VALUE_SEPARATOR_CHAR + "'");
    }
    if (StringUtils.containsAny(key, LINE_BREAKS)) {
      throw new InvalidKeyException(key, "key must not contain line breaks");
    }
    if (PropertiesCodec.isCommentMarker(key.charAt(0))) {
      throw new InvalidKeyException(key, "key must not start with a comment marker");
    }
  }

  private static void validateValue(String key, SettingValue value) {
    if (value instanceof SettingValue.Single single) {
      validateString(key, single.value());
      return;
    }
    for (String element : ((SettingValue.Multi) value).values()) {
      validateString(key, element);
      if (element.indexOf(PropertiesCodec.LIST_SEPARATOR_CHAR) != -1) {
        throw new InvalidValueException(
            key,
            "list element '"
                + element
                + "' contains the list separator '"
                + PropertiesCodec.LIST_SEPARATOR_CHAR
                + "'");
      }
    }
  }

  private static void validateString(String key, String value) {
    if (StringUtils.containsAny(value, LINE_BREAKS)) {
      throw new InvalidValueException(key, "value must not contain line breaks");
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SettingsTable other)) {
      return false;
    }
    return entries.equals(other.entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return "SettingsTable" + entries;
  }

  private static final char[] LINE_BREAKS = {'\n', '\r'};

  private final LinkedHashMap<String, SettingValue> entries;
}
