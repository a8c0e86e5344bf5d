/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.codec;

import java.util.List;

/**
 * The outcome of a successful parse: the table, plus anything worth telling the caller about.
 *
 * @param table the parsed entries, in input order
 * @param warnings duplicate keys found while parsing, in input order
 */
public record ParseResult(SettingsTable table, List<ParseWarning> warnings) {
  public ParseResult {
    warnings = List.copyOf(warnings);
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }
}
