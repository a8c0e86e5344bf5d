/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.codec;

import java.io.Serial;

/**
 * Thrown when a value cannot be stored under a key because the text format could not represent
 * it, for example a value with an embedded line break.
 */
public class InvalidValueException extends IllegalArgumentException {
  @Serial private static final long serialVersionUID = -1;

  public InvalidValueException(String key, String reason) {
    super("Invalid value for key '" + key + "': " + reason);
    this.key = key;
  }

  /** Returns the key the value was meant for. */
  public String getKey() {
    return key;
  }

  private final String key;
}
