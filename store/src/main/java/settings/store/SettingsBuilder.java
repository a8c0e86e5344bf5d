/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.store;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Builds {@link Settings} stores. Obtain one from {@link Settings#builder()}.
 *
 * <pre>{@code
 * Settings settings = Settings.builder().fileTypeProperties().build();
 * }</pre>
 *
 * <p>Without an explicit file type the properties format is used. Every {@link #build()} returns
 * a new store with its own empty table; builders may be reused.
 */
public final class SettingsBuilder {

  SettingsBuilder() {}

  /**
   * Selects the properties format.
   *
   * @return this builder
   */
  public SettingsBuilder fileTypeProperties() {
    return fileType(FileType.PROPERTIES);
  }

  /**
   * Selects the file format.
   *
   * @param fileType the format
   * @return this builder
   */
  public SettingsBuilder fileType(FileType fileType) {
    this.fileType = Objects.requireNonNull(fileType, "fileType");
    return this;
  }

  /**
   * Sets the charset files are read and written with. Defaults to UTF-8.
   *
   * @param charset the charset
   * @return this builder
   */
  public SettingsBuilder charset(Charset charset) {
    this.charset = Objects.requireNonNull(charset, "charset");
    return this;
  }

  /**
   * Sets comment lines written at the top of every stored file. They are skipped when loading.
   *
   * @param lines the lines, without comment markers
   * @return this builder
   */
  public SettingsBuilder header(String... lines) {
    this.header = List.of(lines);
    return this;
  }

  /**
   * When enabled, {@code storeToFile} writes to a temporary file next to the target and moves it
   * into place, so readers never see a half-written file. The POSIX permissions of an existing
   * file are kept; a file created this way is readable by its owner only. Disabled by default.
   *
   * @param atomicWrites whether to write atomically
   * @return this builder
   */
  public SettingsBuilder atomicWrites(boolean atomicWrites) {
    this.atomicWrites = atomicWrites;
    return this;
  }

  /**
   * Creates a new, empty store.
   *
   * @return the store
   * @throws IllegalArgumentException if a header line contains a line break
   */
  public Settings build() {
    return new CodecSettings(fileType.createCodec(header), charset, atomicWrites);
  }

  private FileType fileType = FileType.PROPERTIES;
  private Charset charset = StandardCharsets.UTF_8;
  private List<String> header = List.of();
  private boolean atomicWrites;
}
