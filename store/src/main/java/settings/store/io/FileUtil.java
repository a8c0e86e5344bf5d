/* This code is distributed under the GNU General Public License, version 2
 * (or at your option any later version). See http://www.gnu.org/ for
 * further details of the GPL. */
package settings.store.io;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File helpers for settings stores. Every method opens, uses and closes its file before
 * returning, on success and on failure.
 */
public final class FileUtil {
  private static final Logger logger = LoggerFactory.getLogger(FileUtil.class);

  private FileUtil() {}

  /**
   * Reads the whole content of a file.
   *
   * @param path the file to read
   * @param charset the charset to decode with
   * @return the content
   * @throws IOException if the file cannot be opened or read, or is not valid in {@code charset}
   */
  public static String readText(Path path, Charset charset) throws IOException {
    StringBuilder result = new StringBuilder();
    try (var reader = Files.newBufferedReader(path, charset)) {
      char[] buffer = new char[4096];
      int length;
      while ((length = reader.read(buffer)) != -1) {
        result.append(buffer, 0, length);
      }
    }
    return result.toString();
  }

  /**
   * Writes text to a file, creating it or truncating it first. If the write is interrupted the
   * file may be left partially written.
   *
   * @param text the content
   * @param path the file to write
   * @param charset the charset to encode with
   * @throws IOException if the file cannot be written
   */
  public static void writeText(String text, Path path, Charset charset) throws IOException {
    try (var writer = Files.newBufferedWriter(path, charset)) {
      writer.write(text);
    }
  }

  /**
   * Writes text to a file through a temporary file in the same directory, which is then moved
   * over the target. The move is atomic where the file system supports it. On POSIX file systems
   * an existing target's permissions are carried over to the new file; a new target gets the
   * owner-only permissions of a temporary file.
   *
   * @param text the content
   * @param targetPath the file to write
   * @param charset the charset to encode with
   * @throws IOException if the temporary file cannot be written or moved
   */
  public static void writeTextAtomically(String text, Path targetPath, Charset charset)
      throws IOException {
    Path directory = targetPath.toAbsolutePath().getParent();
    Path tempFile = Files.createTempFile(directory, "settings", ".tmp");

    try {
      writeText(text, tempFile, charset);
      copyPermissions(targetPath, tempFile);
      renameTo(tempFile, targetPath);
    } finally {
      try {
        Files.deleteIfExists(tempFile);
      } catch (IOException e) {
        logger.error("Failed to delete temporary file {}", tempFile, e);
      }
    }
  }

  private static void copyPermissions(Path from, Path to) throws IOException {
    if (!Files.exists(from)) {
      return;
    }
    Set<PosixFilePermission> permissions;
    try {
      permissions = Files.getPosixFilePermissions(from);
    } catch (UnsupportedOperationException e) {
      logger.debug("No POSIX permissions to copy from {}", from);
      return;
    }
    Files.setPosixFilePermissions(to, permissions);
  }

  /**
   * Moves {@code source} over {@code target}, atomically if possible, otherwise replacing the
   * target.
   *
   * @param source the file to move
   * @param target the destination
   * @throws IOException if the move fails
   */
  public static void renameTo(Path source, Path target) throws IOException {
    if (source.equals(target)) {
      throw new IllegalArgumentException("Source and target paths are the same");
    }

    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      logger.debug("Atomic move not supported for {}, replacing instead", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
