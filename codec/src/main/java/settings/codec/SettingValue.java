/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.codec;

import java.util.List;

/**
 * The value half of a settings entry: either one string or an ordered list of strings.
 *
 * <p>On the wire both variants share a single representation (a list is written as its elements
 * joined by {@link PropertiesCodec#LIST_SEPARATOR_CHAR}), so the variant is decided by the parser
 * from the raw text and by the caller from the accessor it uses.
 *
 * @see SettingsTable
 */
public sealed interface SettingValue permits SettingValue.Single, SettingValue.Multi {

  /**
   * Creates a single-string value.
   *
   * @param value the string, must not be {@code null}
   * @return the value
   */
  static SettingValue of(String value) {
    return new Single(value);
  }

  /**
   * Creates a list value. The elements are copied, later changes to {@code values} are not seen.
   *
   * @param values the elements, in order
   * @return the value
   * @throws NullPointerException if the list or one of its elements is {@code null}
   */
  static SettingValue ofList(List<String> values) {
    return new Multi(values);
  }

  /** A value holding exactly one string. */
  record Single(String value) implements SettingValue {
    public Single {
      if (value == null) {
        throw new NullPointerException("value");
      }
    }
  }

  /** A value holding an ordered, unmodifiable list of strings. */
  record Multi(List<String> values) implements SettingValue {
    public Multi {
      values = List.copyOf(values);
    }
  }
}
