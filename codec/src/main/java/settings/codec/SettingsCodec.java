/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.codec;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
 * Translation between one text format and a {@link SettingsTable}.
 *
 * <p>Implementations are stateless apart from their construction-time options, so one instance
 * may serve any number of stores.
 *
 * <p>For every table {@code t} without ambiguous content (see the implementation's notes),
 * {@code parse(serialize(t)).table()} must equal {@code t}, and {@code serialize} must produce the
 * same text for equal tables regardless of insertion order.
 */
public interface SettingsCodec {

  /**
   * Returns the short name of the format, for example {@code properties}.
   *
   * @return the format name
   */
  String name();

  /**
   * Parses settings text.
   *
   * @param text the complete input
   * @return the parsed table and any warnings
   * @throws SettingsParseException if one or more lines could not be parsed
   */
  ParseResult parse(String text) throws SettingsParseException;

  /**
   * Serializes a table into its canonical text form.
   *
   * @param table the table to write
   * @return the text; empty for an empty table
   */
  String serialize(SettingsTable table);

  /**
   * Reads a character stream to its end and parses it. The reader is not closed.
   *
   * @param reader the source
   * @return the parsed table and any warnings
   * @throws IOException if reading fails
   * @throws SettingsParseException if one or more lines could not be parsed
   */
  default ParseResult read(Reader reader) throws IOException, SettingsParseException {
    var text = new StringBuilder();
    char[] buffer = new char[4096];
    int length;
    while ((length = reader.read(buffer)) != -1) {
      text.append(buffer, 0, length);
    }
    return parse(text.toString());
  }

  /**
   * Serializes a table to a character stream. The writer is flushed but not closed.
   *
   * @param table the table to write
   * @param writer the destination
   * @throws IOException if writing fails
   */
  default void write(SettingsTable table, Writer writer) throws IOException {
    writer.write(serialize(table));
    writer.flush();
  }
}
