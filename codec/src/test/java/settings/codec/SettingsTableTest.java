/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.codec;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Test case for {@link SettingsTable} class. */
class SettingsTableTest {

  /** Tests that a later put replaces the earlier value */
  @Test
  void testPut_Overwrite() {
    SettingsTable table = new SettingsTable();

    assertNull(table.put("K", "1"));
    SettingValue previous = table.put("K", "2");

    assertEquals(SettingValue.of("1"), previous);
    assertEquals("2", table.getSingle("K"));
    assertEquals(1, table.size());
  }

  /** Tests that the typed getters only see their own variant */
  @Test
  void testTypedGetters() {
    SettingsTable table = new SettingsTable();
    table.put("L", List.of("a", "b"));
    table.put("S", "x");

    assertNull(table.getSingle("L"));
    assertEquals(List.of("a", "b"), table.getList("L"));
    assertEquals("x", table.getSingle("S"));
    assertNull(table.getList("S"));
    assertNull(table.getSingle("missing"));
    assertNull(table.getList("missing"));
    assertThat(table.get("L"), instanceOf(SettingValue.Multi.class));
  }

  /** Tests that a stored list does not follow later changes of the caller's list */
  @Test
  void testPut_ListIsCopied() {
    SettingsTable table = new SettingsTable();
    var values = new ArrayList<>(List.of("a", "b"));

    table.put("L", values);
    values.add("c");

    assertEquals(List.of("a", "b"), table.getList("L"));
    assertThrows(UnsupportedOperationException.class, () -> table.getList("L").add("d"));
  }

  /** Tests keys the text format could not represent */
  @ParameterizedTest
  @ValueSource(
      strings = {
        "",
        "   ",
        "bad=key",
        "line\nbreak",
        "carriage\rreturn",
        "#comment",
        "!bang",
        " #hidden",
        "K ",
        " K",
        "\tK"
      })
  void testPut_InvalidKey(String key) {
    SettingsTable table = new SettingsTable();
    table.put("existing", "1");

    var e = assertThrows(InvalidKeyException.class, () -> table.put(key, "v"));

    assertEquals(key, e.getKey());
    assertEquals(1, table.size());
    assertEquals("1", table.getSingle("existing"));
  }

  /** Tests values the text format could not represent */
  @Test
  void testPut_InvalidValue() {
    SettingsTable table = new SettingsTable();
    table.put("K", "old");

    var e = assertThrows(InvalidValueException.class, () -> table.put("K", "two\nlines"));
    assertEquals("K", e.getKey());
    assertThrows(InvalidValueException.class, () -> table.put("K", List.of("ok", "bad\r")));
    assertThrows(InvalidValueException.class, () -> table.put("K", List.of("a,b", "c")));

    assertEquals("old", table.getSingle("K"));
  }

  /** Tests that commas are allowed in single values */
  @Test
  void testPut_CommaInSingleValue() {
    SettingsTable table = new SettingsTable();

    table.put("MongoServer", "mongodb://h1,h2/?replicaSet=rs");

    assertEquals("mongodb://h1,h2/?replicaSet=rs", table.getSingle("MongoServer"));
  }

  @Test
  void testRemove() {
    SettingsTable table = new SettingsTable();
    table.put("K", "v");

    assertEquals(SettingValue.of("v"), table.remove("K"));
    assertNull(table.remove("K"));
    assertTrue(table.isEmpty());
  }

  /** Tests the insertion-ordered and sorted views */
  @Test
  void testOrdering() {
    SettingsTable table = new SettingsTable();
    table.put("b", "2");
    table.put("c", "3");
    table.put("a", "1");

    assertThat(table.keys(), contains("b", "c", "a"));
    assertEquals(List.of("a", "b", "c"), table.sortedKeys());
    assertThat(table.sorted().keySet(), contains("a", "b", "c"));
  }

  /** Tests that a copy is independent of its source */
  @Test
  void testCopy() {
    SettingsTable table = new SettingsTable();
    table.put("a", "1");

    SettingsTable copy = new SettingsTable(table);
    copy.put("b", "2");

    assertEquals(1, table.size());
    assertEquals(2, copy.size());
    assertNotEquals(table, copy);
  }

  /** Tests that equality ignores insertion order */
  @Test
  void testEquals() {
    SettingsTable first = new SettingsTable();
    first.put("a", "1");
    first.put("b", List.of("x", "y"));
    SettingsTable second = new SettingsTable();
    second.put("b", List.of("x", "y"));
    second.put("a", "1");

    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
  }
}
