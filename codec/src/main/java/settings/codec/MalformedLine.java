/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.codec;

/**
 * A line of settings text that could not be parsed.
 *
 * @param lineNumber the 1-based line number
 * @param text the line as it appeared in the input
 * @param reason why the line was rejected
 */
public record MalformedLine(int lineNumber, String text, String reason) {
  @Override
  public String toString() {
    return "line " + lineNumber + ": " + reason + " (" + text + ")";
  }
}
