/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.store;

import java.util.List;
import settings.codec.PropertiesCodec;
import settings.codec.SettingsCodec;

/** The file formats a {@link Settings} store can be bound to. */
public enum FileType {
  /** {@code key = value} lines, see {@link PropertiesCodec}. */
  PROPERTIES {
    @Override
    SettingsCodec createCodec(List<String> header) {
      return new PropertiesCodec(header);
    }
  };

  /**
   * Creates the codec for this format.
   *
   * @param header comment lines to write before the entries
   * @return a new codec
   */
  abstract SettingsCodec createCodec(List<String> header);
}
