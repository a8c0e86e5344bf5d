/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.codec;

/**
 * A key that occurred more than once in parsed text. The later occurrence wins.
 *
 * @param key the repeated key
 * @param firstLine the line number of the occurrence that was overwritten
 * @param lineNumber the line number of the occurrence that was kept
 */
public record ParseWarning(String key, int firstLine, int lineNumber) {
  @Override
  public String toString() {
    return "duplicate key '" + key + "' on line " + lineNumber + " overrides line " + firstLine;
  }
}
