/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.codec;

import java.io.Serial;

/**
 * Thrown when a key cannot be stored because the text format could not represent it: the key is
 * empty, contains {@code '='} or a line break, or starts with a comment marker.
 */
public class InvalidKeyException extends IllegalArgumentException {
  @Serial private static final long serialVersionUID = -1;

  public InvalidKeyException(String key, String reason) {
    super("Invalid key '" + key + "': " + reason);
    this.key = key;
  }

  /** Returns the rejected key. */
  public String getKey() {
    return key;
  }

  private final String key;
}
