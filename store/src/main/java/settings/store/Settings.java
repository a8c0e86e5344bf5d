/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.store;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import settings.codec.InvalidKeyException;
import settings.codec.InvalidValueException;
import settings.codec.ParseWarning;
import settings.codec.SettingsCodec;
import settings.codec.SettingsParseException;
import settings.codec.SettingsTable;

/**
 * An in-memory settings table bound to one {@link SettingsCodec}, which it uses to load and store
 * files.
 *
 * <p>Each property holds either a single string or an ordered list of strings. The accessors are
 * typed: {@link #property(String)} only sees single values and {@link #propertySlice(String)} only
 * sees lists, a mismatch is reported as "not found".
 *
 * <p>Example:
 *
 * <pre>{@code
 * Settings settings = Settings.builder().fileTypeProperties().build();
 * settings.setProperty("HttpPort", "8081");
 * settings.setPropertySlice("LogLevel", List.of("Debug", "Info", "Warn"));
 * settings.storeToFile("config.properties");
 * }</pre>
 *
 * <p>which writes
 *
 * <pre>
 * HttpPort = 8081
 * LogLevel = Debug,Info,Warn
 * </pre>
 *
 * <p>Implementations are not synchronized; callers sharing one instance between threads must lock
 * externally. All I/O happens synchronously on the calling thread.
 */
public interface Settings {

  /**
   * Returns a builder for a new, independent settings store.
   *
   * @return the builder
   */
  static SettingsBuilder builder() {
    return new SettingsBuilder();
  }

  /**
   * Searches for a single-string property.
   *
   * @param key the key
   * @return the value, or empty if the key is absent or holds a list
   */
  Optional<String> property(String key);

  /**
   * Searches for a list property.
   *
   * @param key the key
   * @return an unmodifiable copy of the elements, or empty if the key is absent or holds a single
   *     string
   */
  Optional<List<String>> propertySlice(String key);

  /**
   * Sets a single-string property, creating or replacing it.
   *
   * @param key the key
   * @param value the value
   * @throws InvalidKeyException if the key is blank, starts or ends with whitespace, contains
   *     {@code '='} or a line break, or starts with a comment marker
   * @throws InvalidValueException if the value contains a line break
   */
  void setProperty(String key, String value);

  /**
   * Sets a list property, creating or replacing it.
   *
   * @param key the key
   * @param values the elements, in order
   * @throws InvalidKeyException if the key is invalid, see {@link #setProperty(String, String)}
   * @throws InvalidValueException if an element contains a line break or the list separator
   */
  void setPropertySlice(String key, List<String> values);

  /**
   * Removes a property of either kind.
   *
   * @param key the key
   * @return {@code true} if the property existed
   */
  boolean removeProperty(String key);

  /**
   * Returns all keys in lexicographic order.
   *
   * @return a new list of the keys
   */
  List<String> propertyNames();

  /** Returns the number of properties. */
  int size();

  /** Returns {@code true} until a property is set or a non-empty file is loaded. */
  boolean isEmpty();

  /**
   * Replaces the current properties with those read from a character stream. On failure the
   * current properties are kept. The reader is not closed.
   *
   * @param reader the source
   * @throws IOException if reading fails
   * @throws SettingsParseException if the content is malformed
   */
  void load(Reader reader) throws IOException, SettingsParseException;

  /**
   * Replaces the current properties with those read from a file. On failure the current
   * properties are kept.
   *
   * @param path the file to read
   * @throws IOException if the file cannot be opened or read
   * @throws SettingsParseException if the content is malformed
   */
  void loadFromFile(Path path) throws IOException, SettingsParseException;

  /**
   * Convenience overload of {@link #loadFromFile(Path)}.
   *
   * @param filePath the file to read
   * @throws IOException if the file cannot be opened or read
   * @throws SettingsParseException if the content is malformed
   */
  default void loadFromFile(String filePath) throws IOException, SettingsParseException {
    loadFromFile(Path.of(filePath));
  }

  /**
   * Writes the current properties to a character stream. The writer is flushed but not closed.
   *
   * @param writer the destination
   * @throws IOException if writing fails
   */
  void store(Writer writer) throws IOException;

  /**
   * Writes the current properties to a file, creating it or replacing its content.
   *
   * @param path the file to write
   * @throws IOException if the file cannot be written
   */
  void storeToFile(Path path) throws IOException;

  /**
   * Convenience overload of {@link #storeToFile(Path)}.
   *
   * @param filePath the file to write
   * @throws IOException if the file cannot be written
   */
  default void storeToFile(String filePath) throws IOException {
    storeToFile(Path.of(filePath));
  }

  /**
   * Returns the duplicate-key warnings of the last successful load.
   *
   * @return the warnings, empty if nothing was loaded yet
   */
  List<ParseWarning> lastLoadWarnings();

  /**
   * Returns a copy of the current properties.
   *
   * @return a new table
   */
  SettingsTable snapshot();

  /** Returns the codec this store reads and writes with. */
  SettingsCodec codec();
}
