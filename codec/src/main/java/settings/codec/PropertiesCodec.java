/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.codec;

import com.machinezoo.noexception.Exceptions;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Codec for line-oriented {@code key = value} properties text.
 *
 * <p>The format:
 *
 * <pre>
 * # comment
 * ! another comment
 *
 * HttpPort = 8081
 * LogLevel = Debug,Info,Warn
 * </pre>
 *
 * <ul>
 *   <li>Lines whose first non-blank character is {@code #} or {@code !} are comments; blank lines
 *       are ignored.
 *   <li>Every other line holds one entry. The key is the text before the first {@value
 *       SettingsTable#KEY_VALUE_SEPARATOR_CHAR}, the value the text after it, both trimmed.
 *   <li>A value containing {@value #LIST_SEPARATOR_CHAR} is a list: it is split on every
 *       separator and each element is trimmed. Otherwise it is a single string.
 *   <li>Output is one {@code key = value} line per entry, sorted by key, with list elements joined
 *       by the bare separator.
 * </ul>
 *
 * <p>There is no quoting or escaping. A single value that contains a literal comma, such as
 * {@code mongodb://h1,h2/?replicaSet=rs}, is written verbatim and comes back as a list. Leading
 * and trailing blanks of values are lost, and a one-element list comes back as a single string.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class PropertiesCodec implements SettingsCodec {

  /** The character separating the elements of a list value. */
  public static final char LIST_SEPARATOR_CHAR = ',';

  /** The format name returned by {@link #name()}. */
  public static final String NAME = "properties";

  private static final Logger logger = LoggerFactory.getLogger(PropertiesCodec.class);

  private static final String COMMENT_MARKERS = "#!";

  private static final String ENTRY_SEPARATOR = " " + SettingsTable.KEY_VALUE_SEPARATOR_CHAR + " ";

  private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

  /** Creates a codec that writes no header. */
  public PropertiesCodec() {
    this(List.of());
  }

  /**
   * Creates a codec that writes the given comment lines before the entries.
   *
   * @param header the header lines, without the leading {@code #}
   * @throws IllegalArgumentException if a header line contains a line break
   */
  public PropertiesCodec(List<String> header) {
    for (String line : header) {
      if (StringUtils.containsAny(line, '\n', '\r')) {
        throw new IllegalArgumentException("Header line must not contain line breaks: " + line);
      }
    }
    this.header = List.copyOf(header);
  }

  /**
   * Tells whether {@code c} starts a comment line.
   *
   * @param c the first non-blank character of a line
   * @return {@code true} for {@code #} and {@code !}
   */
  public static boolean isCommentMarker(char c) {
    return COMMENT_MARKERS.indexOf(c) != -1;
  }

  @Override
  public String name() {
    return NAME;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Every line is examined even after a malformed one; if any line lacks a separator or has an
   * empty key, the exception lists all of them and no table is returned. A key seen twice keeps
   * its later value and produces a {@link ParseWarning}.
   */
  @Override
  public ParseResult parse(String text) throws SettingsParseException {
    var table = new SettingsTable();
    var warnings = new ArrayList<ParseWarning>();
    var malformed = new ArrayList<MalformedLine>();
    Map<String, Integer> lineOfKey = new HashMap<>();

    String[] lines = LINE_BREAK.split(text, -1);
    for (int i = 0; i < lines.length; i++) {
      processLine(lines[i], i + 1, table, lineOfKey, warnings, malformed);
    }

    if (!malformed.isEmpty()) {
      throw new SettingsParseException(malformed);
    }
    return new ParseResult(table, warnings);
  }

  @Override
  public String serialize(SettingsTable table) {
    var sw = new StringWriter();
    try {
      write(table, sw);
    } catch (IOException e) {
      throw new UncheckedIOException("Writing to a StringWriter failed", e);
    }
    return sw.toString();
  }

  @Override
  public void write(SettingsTable table, Writer writer) throws IOException {
    writeHeader(writer);
    table.sorted().entrySet().forEach(Exceptions.sneak().consumer(
        (Map.Entry<String, SettingValue> entry) ->
            writeEntry(writer, entry.getKey(), entry.getValue())));
    writer.flush();
  }

  /**
   * Turns the raw text after the separator into a value.
   *
   * @param raw the trimmed raw value
   * @return a list value if {@code raw} contains the list separator, otherwise a single value
   */
  static SettingValue toValue(String raw) {
    if (raw.indexOf(LIST_SEPARATOR_CHAR) == -1) {
      return SettingValue.of(raw);
    }
    String[] segments = StringUtils.splitPreserveAllTokens(raw, LIST_SEPARATOR_CHAR);
    var values = new ArrayList<String>(segments.length);
    for (String segment : segments) {
      values.add(segment.trim());
    }
    return SettingValue.ofList(values);
  }

  /**
   * Renders a value the way {@link #toValue(String)} reads it back.
   *
   * @param value the value
   * @return its text form
   */
  static String toText(SettingValue value) {
    if (value instanceof SettingValue.Single single) {
      return single.value();
    }
    return String.join(
        String.valueOf(LIST_SEPARATOR_CHAR), ((SettingValue.Multi) value).values());
  }

  private void processLine(
      String line,
      int lineNumber,
      SettingsTable table,
      Map<String, Integer> lineOfKey,
      List<ParseWarning> warnings,
      List<MalformedLine> malformed) {
    String trimmed = line.trim();
    if (trimmed.isEmpty() || isCommentMarker(trimmed.charAt(0))) {
      return;
    }

    int separatorIndex = trimmed.indexOf(SettingsTable.KEY_VALUE_SEPARATOR_CHAR);
    if (separatorIndex == -1) {
      malformed.add(new MalformedLine(lineNumber, line, "missing '='"));
      return;
    }
    String key = trimmed.substring(0, separatorIndex).trim();
    if (key.isEmpty()) {
      malformed.add(new MalformedLine(lineNumber, line, "empty key"));
      return;
    }
    String raw = trimmed.substring(separatorIndex + 1).trim();

    table.put(key, toValue(raw));

    Integer firstLine = lineOfKey.put(key, lineNumber);
    if (firstLine != null) {
      var warning = new ParseWarning(key, firstLine, lineNumber);
      logger.warn("{}", warning);
      warnings.add(warning);
    }
  }

  private void writeHeader(Writer w) throws IOException {
    if (!header.isEmpty()) {
      var headerBuilder = new StringBuilder();
      for (String line : header) {
        headerBuilder.append("# ").append(line).append('\n');
      }
      w.write(headerBuilder.toString());
    }
  }

  private static void writeEntry(Writer w, String key, SettingValue value) throws IOException {
    w.write(key + ENTRY_SEPARATOR + toText(value) + '\n');
  }

  private final List<String> header;
}
