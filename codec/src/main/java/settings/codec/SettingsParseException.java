/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.codec;

import java.io.Serial;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when settings text could not be parsed according to the format of a {@link
 * SettingsCodec}.
 *
 * <p>Parsing does not stop at the first bad line: the exception lists every {@link MalformedLine}
 * found in the input, so a caller can report all of them at once.
 *
 * @see SettingsCodec#parse(String)
 */
public class SettingsParseException extends Exception {
  @Serial private static final long serialVersionUID = -1;

  /**
   * Constructs a new exception for the given malformed lines.
   *
   * @param malformedLines the offending lines, in input order; must not be empty
   */
  public SettingsParseException(List<MalformedLine> malformedLines) {
    super(describe(malformedLines));
    this.malformedLines = List.copyOf(malformedLines);
  }

  /** Returns the malformed lines, in input order. */
  public List<MalformedLine> getMalformedLines() {
    return malformedLines;
  }

  private static String describe(List<MalformedLine> malformedLines) {
    if (malformedLines.size() == 1) {
      return malformedLines.get(0).toString();
    }
    return malformedLines.size()
        + " malformed lines: "
        + malformedLines.stream().map(MalformedLine::toString).collect(Collectors.joining("; "));
  }

  private final transient List<MalformedLine> malformedLines;
}
