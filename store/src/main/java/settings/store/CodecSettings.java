/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.store;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import settings.codec.ParseResult;
import settings.codec.ParseWarning;
import settings.codec.SettingsCodec;
import settings.codec.SettingsParseException;
import settings.codec.SettingsTable;
import settings.store.io.FileUtil;

/**
 * {@link Settings} backed by a {@link SettingsTable} and persisted through a {@link
 * SettingsCodec}. Created by {@link SettingsBuilder#build()}.
 */
final class CodecSettings implements Settings {
  private static final Logger logger = LoggerFactory.getLogger(CodecSettings.class);

  CodecSettings(SettingsCodec codec, Charset charset, boolean atomicWrites) {
    this.codec = codec;
    this.charset = charset;
    this.atomicWrites = atomicWrites;
    this.table = new SettingsTable();
    this.lastLoadWarnings = List.of();
  }

  @Override
  public Optional<String> property(String key) {
    return Optional.ofNullable(table.getSingle(key));
  }

  @Override
  public Optional<List<String>> propertySlice(String key) {
    return Optional.ofNullable(table.getList(key));
  }

  @Override
  public void setProperty(String key, String value) {
    table.put(key, value);
  }

  @Override
  public void setPropertySlice(String key, List<String> values) {
    table.put(key, values);
  }

  @Override
  public boolean removeProperty(String key) {
    return table.remove(key) != null;
  }

  @Override
  public List<String> propertyNames() {
    return table.sortedKeys();
  }

  @Override
  public int size() {
    return table.size();
  }

  @Override
  public boolean isEmpty() {
    return table.isEmpty();
  }

  @Override
  public void load(Reader reader) throws IOException, SettingsParseException {
    replaceWith(codec.read(reader));
  }

  @Override
  public void loadFromFile(Path path) throws IOException, SettingsParseException {
    String text = FileUtil.readText(path, charset);
    ParseResult result;
    try {
      result = codec.parse(text);
    } catch (SettingsParseException e) {
      logger.debug("Rejected {}: {}", path, e.getMessage());
      throw e;
    }
    replaceWith(result);
    logger.debug("Loaded {} properties from {}", table.size(), path);
  }

  @Override
  public void store(Writer writer) throws IOException {
    codec.write(table, writer);
  }

  @Override
  public void storeToFile(Path path) throws IOException {
    String text = codec.serialize(table);
    if (atomicWrites) {
      FileUtil.writeTextAtomically(text, path, charset);
    } else {
      FileUtil.writeText(text, path, charset);
    }
    logger.debug("Stored {} properties to {}", table.size(), path);
  }

  @Override
  public List<ParseWarning> lastLoadWarnings() {
    return lastLoadWarnings;
  }

  @Override
  public SettingsTable snapshot() {
    return new SettingsTable(table);
  }

  @Override
  public SettingsCodec codec() {
    return codec;
  }

  @Override
  public String toString() {
    return "Settings[" + codec.name() + ", " + table.size() + " properties]";
  }

  private void replaceWith(ParseResult result) {
    table = result.table();
    lastLoadWarnings = result.warnings();
  }

  private final SettingsCodec codec;
  private final Charset charset;
  private final boolean atomicWrites;
  private SettingsTable table;
  private List<ParseWarning> lastLoadWarnings;
}
